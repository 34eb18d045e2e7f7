package io.clype.sqsbatcher.model;

/**
 * Per-entry SQS fields that are not part of the message itself.
 *
 * <p>These pass through to the transport without further validation; FIFO queues
 * require {@code messageGroupId} and, without content-based deduplication,
 * {@code messageDeduplicationId}. Standard queues reject both.</p>
 *
 * @param messageGroupId         FIFO message group, or null
 * @param messageDeduplicationId FIFO deduplication token, or null
 * @param delaySeconds           per-message delay (0-900), or null for the queue default
 */
public record EntryOptions(
    String messageGroupId,
    String messageDeduplicationId,
    Integer delaySeconds
) {
    private static final EntryOptions NONE = new EntryOptions(null, null, null);

    public static final int MAX_DELAY_SECONDS = 900;

    public EntryOptions {
        if (delaySeconds != null && (delaySeconds < 0 || delaySeconds > MAX_DELAY_SECONDS)) {
            throw new IllegalArgumentException("delaySeconds must be between 0 and " + MAX_DELAY_SECONDS);
        }
    }

    public static EntryOptions none() {
        return NONE;
    }

    public static EntryOptions fifo(String messageGroupId, String messageDeduplicationId) {
        return new EntryOptions(messageGroupId, messageDeduplicationId, null);
    }
}
