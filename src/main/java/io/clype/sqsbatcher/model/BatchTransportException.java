package io.clype.sqsbatcher.model;

/**
 * Thrown when a batched send could not be performed at all, as opposed to a send
 * that returned per-entry failures.
 */
public class BatchTransportException extends RuntimeException {

    public BatchTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
