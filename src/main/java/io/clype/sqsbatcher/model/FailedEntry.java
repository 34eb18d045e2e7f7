package io.clype.sqsbatcher.model;

/**
 * Represents a failed entry in a batch send.
 *
 * <p>This record abstracts the AWS SDK's BatchResultErrorEntry to avoid
 * exposing AWS SDK types in the library's public API.</p>
 *
 * @param id          the entry id within the batch
 * @param code        the error code returned by SQS (e.g., "InternalError")
 * @param message     the error message describing the failure
 * @param senderFault true if the error was caused by the sender, false if service-side
 */
public record FailedEntry(
    String id,
    String code,
    String message,
    boolean senderFault
) {}
