package io.clype.sqsbatcher.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsbatcher.model.BatchItem;
import io.clype.sqsbatcher.model.EntryOptions;
import io.clype.sqsbatcher.model.FlushReport;
import io.clype.sqsbatcher.model.MessageAttribute;
import io.clype.sqsbatcher.model.OutboundMessage;

/**
 * Accumulates messages and flushes them as one SendMessageBatch call before either limit
 * would be crossed.
 *
 * <p>After every {@code add} returns, the buffer holds at most {@code maxBatchCount} messages
 * and at most {@code maxBatchSizeBytes} estimated bytes. The one exception is a single message
 * whose own estimate exceeds the byte limit: it is accepted into an empty buffer and left for
 * SQS to accept or reject.</p>
 *
 * <p><b>Blocking:</b> {@code add} may flush, and a flush blocks for the round trips and backoff
 * pauses of all its attempts.</p>
 *
 * <p><b>Thread Safety:</b> not thread-safe. A buffer has a single owner; callers sharing one
 * must synchronize externally.</p>
 */
public class BatchBuffer {

    private static final Logger log = LoggerFactory.getLogger(BatchBuffer.class);

    /** SQS batch entry ids: up to 80 alphanumeric, hyphen or underscore characters. */
    private static final Pattern VALID_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,80}$");

    private final BatcherSettings settings;
    private final FlushExecutor executor;
    private final List<BatchItem> pending;
    private final Set<String> pendingIds;
    private long estimatedBytes;

    public BatchBuffer(BatcherSettings settings, FlushExecutor executor) {
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.pending = new ArrayList<>(settings.maxBatchCount());
        this.pendingIds = new HashSet<>();
    }

    public void add(String body) {
        add(new OutboundMessage(null, body, null, null));
    }

    public void add(String body, Map<String, MessageAttribute> attributes) {
        add(new OutboundMessage(null, body, attributes, null));
    }

    public void add(String body, Map<String, MessageAttribute> attributes, String id, EntryOptions options) {
        add(new OutboundMessage(id, body, attributes, options));
    }

    /**
     * Buffers a message, flushing the pending batch first if the message would not fit.
     *
     * <p>A caller-supplied id only has to be unique within the batch the message joins: when
     * the message forces a flush, it may reuse an id from the batch being flushed.</p>
     *
     * <p>If that flush throws, the pending batch is discarded and {@code message} is not
     * buffered.</p>
     *
     * @param message the message to buffer
     * @throws IllegalArgumentException if the message has more than 10 attributes, or a
     *         caller-supplied id is malformed or already pending in the batch it would join
     */
    public void add(OutboundMessage message) {
        Objects.requireNonNull(message, "message cannot be null");
        MessageSizeEstimator.validateAttributeCount(message.attributes());
        if (message.id() != null) {
            validateIdFormat(message.id());
        }

        long cost = MessageSizeEstimator.estimate(message.body(), message.attributes());
        boolean flushFirst = pending.size() >= settings.maxBatchCount()
                || (!pending.isEmpty() && estimatedBytes + cost > settings.maxBatchSizeBytes());

        if (!flushFirst && message.id() != null && pendingIds.contains(message.id())) {
            throw new IllegalArgumentException("id '" + message.id() + "' is already pending in this batch");
        }
        if (flushFirst) {
            flush();
        }

        if (pending.isEmpty() && cost > settings.maxBatchSizeBytes()) {
            log.warn("Message estimated at {} bytes exceeds the {} byte batch limit; sending it alone.",
                    cost, settings.maxBatchSizeBytes());
        }

        String id = message.id() != null ? message.id() : generateId();
        pending.add(new BatchItem(id, message.body(), message.attributes(), message.options(), cost));
        pendingIds.add(id);
        estimatedBytes += cost;
    }

    /**
     * Sends everything pending. Does nothing when the buffer is empty.
     *
     * <p>The buffer is cleared once the send completes, whether it returned or threw, so a
     * batch is never sent twice.</p>
     *
     * @return what was delivered and what was given up on
     */
    public FlushReport flush() {
        if (pending.isEmpty()) {
            return FlushReport.empty();
        }
        List<BatchItem> snapshot = List.copyOf(pending);
        try {
            return executor.execute(snapshot);
        } finally {
            pending.clear();
            pendingIds.clear();
            estimatedBytes = 0;
        }
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    /**
     * Returns the running size estimate of the pending messages.
     */
    public long estimatedBytes() {
        return estimatedBytes;
    }

    /**
     * Returns a read-only view of the pending messages in insertion order.
     */
    public List<BatchItem> pending() {
        return Collections.unmodifiableList(pending);
    }

    public BatcherSettings settings() {
        return settings;
    }

    private static void validateIdFormat(String id) {
        if (!VALID_ID_PATTERN.matcher(id).matches()) {
            throw new IllegalArgumentException(
                    "id must be 1-80 characters. Allowed: alphanumeric, hyphen, underscore");
        }
    }

    private String generateId() {
        String id;
        do {
            id = UUID.randomUUID().toString().replace("-", "");
        } while (pendingIds.contains(id));
        return id;
    }
}
