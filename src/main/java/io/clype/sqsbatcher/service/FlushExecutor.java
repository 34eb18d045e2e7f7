package io.clype.sqsbatcher.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.clype.sqsbatcher.metrics.SqsBatcherMetrics;
import io.clype.sqsbatcher.model.BatchItem;
import io.clype.sqsbatcher.model.BatchSendResult;
import io.clype.sqsbatcher.model.BatchTransportException;
import io.clype.sqsbatcher.model.FailedEntry;
import io.clype.sqsbatcher.model.FlushOutcome;
import io.clype.sqsbatcher.model.FlushReport;
import io.clype.sqsbatcher.model.PartialBatchFailureException;
import io.clype.sqsbatcher.transport.BatchTransport;

/**
 * Delivers one snapshot of buffered messages, retrying only the entries SQS rejected.
 *
 * <p><b>Retry policy:</b> at most {@code maxRetries + 1} calls per flush.</p>
 * <ul>
 *   <li><b>Partial failure</b> (the call returned, some entries rejected): the rejected subset is
 *       resent after {@code backoffFactor * 2^(attempt - 1)}.</li>
 *   <li><b>Transport failure</b> (the call threw): the same subset is resent immediately, without
 *       backoff. On the last attempt the exception is rethrown to the caller.</li>
 *   <li><b>Exhausted partial failure</b>: entries still rejected after the last attempt are
 *       reported to {@link BatchSendListener#onUndelivered(List)} and in the {@link FlushReport},
 *       and not raised unless {@link BatcherSettings#failOnUndelivered()} is set.</li>
 * </ul>
 *
 * <p>The immediate retry after a thrown call keeps the behaviour existing callers were tuned
 * against. It means a connectivity outage burns through all attempts quickly.</p>
 */
public class FlushExecutor {

    private static final Logger log = LoggerFactory.getLogger(FlushExecutor.class);

    /** Largest backoff exponent; keeps the computed Duration in range for absurd retry counts. */
    private static final int MAX_BACKOFF_EXPONENT = 30;

    /** Longest representable pause; the backoff saturates here instead of overflowing. */
    static final Duration MAX_BACKOFF = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    private final BatchTransport transport;
    private final BatcherSettings settings;
    private final BatchSendListener listener;
    private final SqsBatcherMetrics metrics;
    private final Sleeper sleeper;

    /**
     * @param transport the batched send implementation
     * @param settings  queue and retry settings
     * @param listener  per-attempt outcome observer
     * @param metrics   optional metrics collector (may be null)
     * @param sleeper   pauses between partial-failure retries
     */
    public FlushExecutor(BatchTransport transport, BatcherSettings settings, BatchSendListener listener,
                         SqsBatcherMetrics metrics, Sleeper sleeper) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.metrics = metrics;
    }

    /**
     * Sends the snapshot until every entry is accepted or attempts run out.
     *
     * @param snapshot messages in the order they were buffered; not modified
     * @return delivered ids and entries given up on
     * @throws RuntimeException the transport's exception if the last attempt threw
     * @throws PartialBatchFailureException if entries remain undelivered and
     *         {@code failOnUndelivered} is set
     */
    public FlushReport execute(List<BatchItem> snapshot) {
        if (snapshot.isEmpty()) {
            return FlushReport.empty();
        }
        if (metrics != null) {
            metrics.recordFlush(snapshot.size());
        }

        long maxAttempts = settings.maxAttempts();
        List<BatchItem> working = snapshot;
        List<String> delivered = new ArrayList<>(snapshot.size());
        int attempt = 0;

        while (true) {
            attempt++;
            long startTime = System.nanoTime();
            BatchSendResult result;
            try {
                result = transport.sendBatch(settings.queueUrl(), working);
            } catch (RuntimeException e) {
                if (metrics != null) {
                    metrics.recordTransportError(attempt);
                }
                if (attempt >= maxAttempts) {
                    log.error("SendMessageBatch failed on final attempt {}/{} for {} messages: {}",
                            attempt, maxAttempts, working.size(), LogSanitizer.sanitize(e.getMessage()));
                    throw e;
                }
                log.warn("SendMessageBatch failed (attempt {}/{}), retrying immediately: {}",
                        attempt, maxAttempts, LogSanitizer.sanitize(e.getMessage()));
                continue;
            }

            FlushOutcome outcome = partition(working, result);
            if (metrics != null) {
                metrics.recordAttempt(attempt, outcome.succeededIds().size(), outcome.failedItems().size(),
                        System.nanoTime() - startTime);
            }

            if (!outcome.succeededIds().isEmpty()) {
                delivered.addAll(outcome.succeededIds());
                listener.onSuccess(outcome.succeededIds());
            }

            if (outcome.isComplete()) {
                log.debug("Delivered batch of {} messages in {} attempt(s).", snapshot.size(), attempt);
                return new FlushReport(delivered, List.of(), attempt);
            }

            if (attempt >= maxAttempts) {
                return giveUp(outcome.failedEntries(), delivered, attempt);
            }

            Duration backoff = backoffFor(attempt);
            log.warn("{} of {} messages rejected (attempt {}/{}), retrying in {}. Failed IDs: {}",
                    outcome.failedItems().size(), working.size(), attempt, maxAttempts, backoff,
                    LogSanitizer.sanitize(outcome.failedItems().stream()
                            .map(BatchItem::id)
                            .collect(Collectors.joining(", "))));
            pause(backoff);
            working = outcome.failedItems();
        }
    }

    /**
     * Splits the attempted items by the ids SQS reported as failed. Items SQS did not report
     * as failed count as delivered.
     */
    static FlushOutcome partition(List<BatchItem> attempted, BatchSendResult result) {
        Map<String, FailedEntry> failedById = new LinkedHashMap<>();
        for (FailedEntry entry : result.failed()) {
            failedById.put(entry.id(), entry);
        }

        List<String> succeeded = new ArrayList<>(attempted.size());
        List<BatchItem> failedItems = new ArrayList<>();
        List<FailedEntry> failedEntries = new ArrayList<>();
        for (BatchItem item : attempted) {
            FailedEntry failure = failedById.get(item.id());
            if (failure == null) {
                succeeded.add(item.id());
            } else {
                failedItems.add(item);
                failedEntries.add(failure);
            }
        }
        return new FlushOutcome(List.copyOf(succeeded), List.copyOf(failedItems), List.copyOf(failedEntries));
    }

    Duration backoffFor(int attempt) {
        int exponent = Math.min(attempt - 1, MAX_BACKOFF_EXPONENT);
        try {
            return settings.backoffFactor().multipliedBy(1L << exponent);
        } catch (ArithmeticException e) {
            return MAX_BACKOFF;
        }
    }

    private FlushReport giveUp(List<FailedEntry> undelivered, List<String> delivered, int attempts) {
        log.warn("Giving up on {} messages after {} attempt(s). Undelivered IDs: {}",
                undelivered.size(), attempts,
                LogSanitizer.sanitize(undelivered.stream()
                        .map(e -> e.id() + " (" + e.code() + ")")
                        .collect(Collectors.joining(", "))));
        if (metrics != null) {
            metrics.recordUndelivered(undelivered.size());
        }
        listener.onUndelivered(undelivered);
        if (settings.failOnUndelivered()) {
            throw new PartialBatchFailureException(undelivered, delivered);
        }
        return new FlushReport(delivered, undelivered, attempts);
    }

    private void pause(Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BatchTransportException("Interrupted while backing off before retry", e);
        }
    }
}
