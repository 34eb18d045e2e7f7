package io.clype.sqsbatcher.service;

import java.util.Map;
import java.util.Objects;

import io.clype.sqsbatcher.model.EntryOptions;
import io.clype.sqsbatcher.model.FlushReport;
import io.clype.sqsbatcher.model.MessageAttribute;
import io.clype.sqsbatcher.model.OutboundMessage;

/**
 * Scope around a {@link BatchBuffer} that sends whatever is still pending when it closes.
 *
 * <pre>{@code
 * try (BatchSession session = batcher.openSession()) {
 *     for (Order order : orders) {
 *         session.add(toJson(order));
 *     }
 * } // remaining messages are flushed here
 * }</pre>
 *
 * <p><b>Error precedence:</b> if the block throws and the closing flush throws too, the block's
 * exception propagates with the flush failure attached via
 * {@link Throwable#addSuppressed(Throwable)}. If only the closing flush throws, its exception
 * propagates from the end of the block.</p>
 *
 * <p><b>Thread Safety:</b> adds, flushes and close are serialized on the session, so a close
 * issued from another thread waits for an add or flush already in progress. The buffer returned
 * by {@link #buffer()} is not guarded.</p>
 */
public class BatchSession implements AutoCloseable {

    private final BatchBuffer buffer;
    private boolean closed;

    public BatchSession(BatchBuffer buffer) {
        this.buffer = Objects.requireNonNull(buffer, "buffer cannot be null");
    }

    public synchronized void add(String body) {
        ensureOpen();
        buffer.add(body);
    }

    public synchronized void add(String body, Map<String, MessageAttribute> attributes) {
        ensureOpen();
        buffer.add(body, attributes);
    }

    public synchronized void add(String body, Map<String, MessageAttribute> attributes, String id, EntryOptions options) {
        ensureOpen();
        buffer.add(body, attributes, id, options);
    }

    public synchronized void add(OutboundMessage message) {
        ensureOpen();
        buffer.add(message);
    }

    public synchronized FlushReport flush() {
        return buffer.flush();
    }

    /**
     * Returns the underlying buffer.
     */
    public BatchBuffer buffer() {
        return buffer;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    /**
     * Flushes pending messages exactly once. Later calls do nothing.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!buffer.isEmpty()) {
            buffer.flush();
        }
    }

    /**
     * Buffers the message unless the session has already been closed.
     *
     * @return false if the session was closed and the message was not buffered
     */
    synchronized boolean offer(OutboundMessage message) {
        if (closed) {
            return false;
        }
        buffer.add(message);
        return true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("BatchSession is closed");
        }
    }
}
