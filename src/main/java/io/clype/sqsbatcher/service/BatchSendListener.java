package io.clype.sqsbatcher.service;

import java.util.List;
import java.util.Objects;

import io.clype.sqsbatcher.model.FailedEntry;

/**
 * Observer of per-attempt delivery outcomes.
 *
 * <p>{@link #onSuccess(List)} receives only the ids delivered by one attempt, so a flush that
 * needed retries calls it several times. Listeners that want a cumulative view accumulate
 * across calls themselves. Exceptions thrown by a listener propagate out of the flush.</p>
 */
@FunctionalInterface
public interface BatchSendListener {

    /**
     * Called after an attempt in which at least one message was accepted.
     *
     * @param messageIds ids accepted on this attempt, in batch order
     */
    void onSuccess(List<String> messageIds);

    /**
     * Called once per flush with the messages still rejected after the last attempt.
     *
     * @param entries the rejected entries with SQS error details
     */
    default void onUndelivered(List<FailedEntry> entries) {
    }

    /**
     * Returns a listener that notifies this listener, then {@code next}.
     */
    default BatchSendListener andThen(BatchSendListener next) {
        Objects.requireNonNull(next, "next");
        BatchSendListener first = this;
        return new BatchSendListener() {
            @Override
            public void onSuccess(List<String> messageIds) {
                first.onSuccess(messageIds);
                next.onSuccess(messageIds);
            }

            @Override
            public void onUndelivered(List<FailedEntry> entries) {
                first.onUndelivered(entries);
                next.onUndelivered(entries);
            }
        };
    }

    static BatchSendListener noop() {
        return messageIds -> { };
    }
}
