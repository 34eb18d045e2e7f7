package io.clype.sqsbatcher.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.clype.sqsbatcher.model.OutboundMessage;
import io.clype.sqsbatcher.transport.BatchTransport;

import static io.clype.sqsbatcher.service.TestTransports.QUEUE_URL;
import static io.clype.sqsbatcher.service.TestTransports.acceptAll;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BatchSessionTest {

    private BatchTransport transport;
    private SqsBatcher batcher;

    @BeforeEach
    void setUp() {
        transport = mock(BatchTransport.class);
        when(transport.sendBatch(eq(QUEUE_URL), anyList())).thenAnswer(acceptAll());
        batcher = new SqsBatcher(transport,
                BatcherSettings.builder(QUEUE_URL).maxRetries(0).backoffFactor(Duration.ZERO).build());
    }

    @AfterEach
    void tearDown() {
        batcher.destroy();
    }

    @Test
    void testCloseFlushesPendingMessages() {
        List<String> delivered = new ArrayList<>();

        try (BatchSession session = batcher.openSession(delivered::addAll)) {
            session.add("hello");
            session.add("world");
            verify(transport, never()).sendBatch(eq(QUEUE_URL), anyList());
        }

        verify(transport, times(1)).sendBatch(eq(QUEUE_URL), anyList());
        assertThat(delivered).hasSize(2);
    }

    @Test
    void testCloseOnEmptySessionSendsNothing() {
        try (BatchSession session = batcher.openSession()) {
            assertThat(session.buffer().isEmpty()).isTrue();
        }

        verify(transport, never()).sendBatch(eq(QUEUE_URL), anyList());
    }

    @Test
    void testCloseAfterExplicitFlushSendsNothingMore() {
        try (BatchSession session = batcher.openSession()) {
            session.add("hello");
            session.flush();
        }

        verify(transport, times(1)).sendBatch(eq(QUEUE_URL), anyList());
    }

    @Test
    void testCloseFlushesWhenBlockThrows() {
        Throwable thrown = catchThrowable(() -> {
            try (BatchSession session = batcher.openSession()) {
                session.add("hello");
                throw new IllegalStateException("caller failed");
            }
        });

        assertThat(thrown).isInstanceOf(IllegalStateException.class).hasMessage("caller failed");
        assertThat(thrown.getSuppressed()).isEmpty();
        verify(transport, times(1)).sendBatch(eq(QUEUE_URL), anyList());
    }

    @Test
    void testBlockErrorWinsOverFailingCloseFlush() {
        when(transport.sendBatch(eq(QUEUE_URL), anyList())).thenThrow(new IllegalStateException("sqs down"));

        Throwable thrown = catchThrowable(() -> {
            try (BatchSession session = batcher.openSession()) {
                session.add("hello");
                throw new IllegalArgumentException("caller failed");
            }
        });

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessage("caller failed");
        assertThat(thrown.getSuppressed()).hasSize(1);
        assertThat(thrown.getSuppressed()[0]).hasMessage("sqs down");
    }

    @Test
    void testFailingCloseFlushPropagates() {
        when(transport.sendBatch(eq(QUEUE_URL), anyList())).thenThrow(new IllegalStateException("sqs down"));

        assertThatThrownBy(() -> {
            try (BatchSession session = batcher.openSession()) {
                session.add("hello");
            }
        }).isInstanceOf(IllegalStateException.class).hasMessage("sqs down");
    }

    @Test
    void testCloseIsIdempotent() {
        BatchSession session = batcher.openSession();
        session.add("hello");

        session.close();
        session.close();

        assertThat(session.isClosed()).isTrue();
        verify(transport, times(1)).sendBatch(eq(QUEUE_URL), anyList());
    }

    @Test
    void testAddAfterCloseRejected() {
        BatchSession session = batcher.openSession();
        session.close();

        assertThatThrownBy(() -> session.add("late"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("BatchSession is closed");
    }

    @Test
    void testOfferAfterCloseDropsMessage() {
        BatchSession session = batcher.openSession();
        session.close();

        assertThat(session.offer(OutboundMessage.of("late"))).isFalse();
        assertThat(session.buffer().isEmpty()).isTrue();
        verify(transport, never()).sendBatch(eq(QUEUE_URL), anyList());
    }

    @Test
    void testOfferBuffersWhileOpen() {
        try (BatchSession session = batcher.openSession()) {
            assertThat(session.offer(OutboundMessage.of("hello"))).isTrue();
            assertThat(session.buffer().size()).isEqualTo(1);
        }

        verify(transport, times(1)).sendBatch(eq(QUEUE_URL), anyList());
    }
}
