package io.clype.sqsbatcher.service;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import io.clype.sqsbatcher.metrics.SqsBatcherMetrics;
import io.clype.sqsbatcher.model.OutboundMessage;
import io.clype.sqsbatcher.transport.BatchTransport;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point for batching messages to one SQS queue.
 *
 * <p>A batcher is shared; the buffers it hands out are not. Each {@link #openSession()} or
 * {@link #newBuffer()} call returns an independent buffer with its own pending batch, all of
 * them sending through the same {@link BatchTransport}.</p>
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * @Autowired
 * private SqsBatcher batcher;
 *
 * public void send(List<String> events) {
 *     try (BatchSession session = batcher.openSession(ids -> log.info("Sent {}", ids))) {
 *         events.forEach(session::add);
 *     }
 * }
 *
 * public Mono<Void> sendAll(Flux<OutboundMessage> events) {
 *     return batcher.publish(events);
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. Buffers it creates are not; sessions
 * serialize their own operations.</p>
 *
 * <p><b>Resource Management:</b> This class implements {@link DisposableBean} and disposes the
 * scheduler used by {@link #publish(Flux)} when the Spring context is destroyed.</p>
 *
 * @see BatchSession
 * @see io.clype.sqsbatcher.config.SqsBatcherAutoConfiguration
 */
public class SqsBatcher implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SqsBatcher.class);

    /** Default number of threads available to concurrent {@link #publish(Flux)} calls. */
    private static final int DEFAULT_PUBLISH_THREADS = 16;

    /** Tasks queued per publish thread before the scheduler rejects new work. */
    private static final int PUBLISH_QUEUE_PER_THREAD = 1_000;

    private final BatchTransport transport;
    private final BatcherSettings settings;
    private final BatchSendListener defaultListener;
    private final SqsBatcherMetrics metrics;
    private final Sleeper sleeper;
    private final Scheduler ioScheduler;

    /**
     * Creates a batcher with no default listener and no metrics.
     *
     * @param transport the batched send implementation
     * @param settings  queue, threshold and retry settings
     */
    public SqsBatcher(BatchTransport transport, BatcherSettings settings) {
        this(transport, settings, BatchSendListener.noop(), null, Sleeper.THREAD, DEFAULT_PUBLISH_THREADS);
    }

    /**
     * Creates a batcher with full configuration options.
     *
     * @param transport       the batched send implementation
     * @param settings        queue, threshold and retry settings
     * @param defaultListener listener for sessions opened without one
     * @param metrics         optional metrics collector (may be null)
     * @param sleeper         pauses between partial-failure retries
     * @param publishThreads  threads available to concurrent {@link #publish(Flux)} calls
     * @throws NullPointerException if transport, settings, defaultListener or sleeper is null
     * @throws IllegalArgumentException if publishThreads is not positive
     */
    public SqsBatcher(BatchTransport transport, BatcherSettings settings, BatchSendListener defaultListener,
                      SqsBatcherMetrics metrics, Sleeper sleeper, int publishThreads) {
        this.transport = Objects.requireNonNull(transport, "transport cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.defaultListener = Objects.requireNonNull(defaultListener, "defaultListener cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        if (publishThreads <= 0) {
            throw new IllegalArgumentException("publishThreads must be positive");
        }
        this.metrics = metrics;
        this.ioScheduler = Schedulers.newBoundedElastic(publishThreads,
                publishThreads * PUBLISH_QUEUE_PER_THREAD, "sqs-batcher-io");
    }

    public BatchBuffer newBuffer() {
        return newBuffer(defaultListener);
    }

    public BatchBuffer newBuffer(BatchSendListener listener) {
        return new BatchBuffer(settings, new FlushExecutor(transport, settings, listener, metrics, sleeper));
    }

    public BatchSession openSession() {
        return new BatchSession(newBuffer());
    }

    /**
     * Opens a session whose flushes report to the given listener instead of the default one.
     */
    public BatchSession openSession(BatchSendListener listener) {
        return new BatchSession(newBuffer(listener));
    }

    /**
     * Buffers every message of the stream in a fresh session and flushes the remainder when
     * the stream ends.
     *
     * <p>Adds run on a bounded elastic scheduler since they may block on a flush. The session
     * is closed on completion, error and cancellation, and a failing final flush is signalled
     * through the returned Mono. On cancellation the closing flush waits for an add already in
     * progress; messages that reach the session after it closed are dropped.</p>
     *
     * @param messages the messages to send (must not be null)
     * @return completes once the last batch has been flushed
     */
    public Mono<Void> publish(Flux<OutboundMessage> messages) {
        return publish(messages, defaultListener);
    }

    public Mono<Void> publish(Flux<OutboundMessage> messages, BatchSendListener listener) {
        Objects.requireNonNull(messages, "messages");
        Objects.requireNonNull(listener, "listener");
        return Mono.using(
                () -> openSession(listener),
                session -> messages
                        .publishOn(ioScheduler)
                        .doOnNext(message -> {
                            if (!session.offer(message)) {
                                log.debug("Dropping message {} that arrived after the session closed",
                                        LogSanitizer.sanitize(message.id()));
                            }
                        })
                        .then(),
                BatchSession::close);
    }

    public BatcherSettings settings() {
        return settings;
    }

    /**
     * Disposes of the internal scheduler when the Spring context is destroyed.
     */
    @Override
    public void destroy() {
        ioScheduler.dispose();
    }
}
