package com.keyforge.node.transport;

import com.keyforge.core.error.PeerSendException;
import com.keyforge.core.spi.PeerAck;
import com.keyforge.core.spi.PeerMessage;
import com.keyforge.core.spi.PeerMessageType;
import com.keyforge.core.spi.PeerTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for RetryingPeerTransport backoff and retry classification.
 */
class RetryingPeerTransportTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private ScheduledExecutorService scheduler;
    private PeerMessage message;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        message = PeerMessage.of(PeerMessageType.PING, "node-a", null, "{}");
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void send_retriesDeliveryFailuresUntilSuccess() throws Exception {
        // Given
        AtomicInteger calls = new AtomicInteger();
        PeerTransport flaky = (peerId, msg, timeout) -> calls.incrementAndGet() <= 2
                ? CompletableFuture.failedFuture(new PeerSendException(peerId, "connection reset"))
                : CompletableFuture.completedFuture(PeerAck.accepted(peerId, msg.messageId()));
        RetryingPeerTransport transport = new RetryingPeerTransport(flaky, scheduler, 3, 10);

        // When
        PeerAck ack = transport.send("node-b", message, TIMEOUT).get(5, TimeUnit.SECONDS);

        // Then
        assertThat(ack.accepted()).isTrue();
        assertThat(calls).hasValue(3);
        assertThat(transport.getRetryCount()).isEqualTo(2);
    }

    @Test
    void send_givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        PeerTransport down = (peerId, msg, timeout) -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new PeerSendException(peerId, "unreachable"));
        };
        RetryingPeerTransport transport = new RetryingPeerTransport(down, scheduler, 3, 10);

        assertThatThrownBy(() -> transport.send("node-b", message, TIMEOUT).get(5, TimeUnit.SECONDS))
                .hasCauseInstanceOf(PeerSendException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void send_wrapsForeignFailuresAsPeerSendException() {
        PeerTransport broken = (peerId, msg, timeout) -> {
            throw new IllegalStateException("socket closed");
        };
        RetryingPeerTransport transport = new RetryingPeerTransport(broken, scheduler, 1, 10);

        assertThatThrownBy(() -> transport.send("node-b", message, TIMEOUT).join())
                .hasCauseInstanceOf(PeerSendException.class)
                .hasRootCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void send_doesNotRetryRefusedAck() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        PeerTransport refusing = (peerId, msg, timeout) -> {
            calls.incrementAndGet();
            return CompletableFuture.completedFuture(PeerAck.refused(peerId, msg.messageId(), "stale version"));
        };
        RetryingPeerTransport transport = new RetryingPeerTransport(refusing, scheduler, 3, 10);

        PeerAck ack = transport.send("node-b", message, TIMEOUT).get(5, TimeUnit.SECONDS);

        assertThat(ack.accepted()).isFalse();
        assertThat(ack.detail()).isEqualTo("stale version");
        assertThat(calls).hasValue(1);
        assertThat(transport.getRetryCount()).isZero();
    }

    @Test
    void constructor_rejectsZeroAttempts() {
        PeerTransport any = (peerId, msg, timeout) -> CompletableFuture.completedFuture(null);

        assertThatThrownBy(() -> new RetryingPeerTransport(any, scheduler, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ==================== Backoff Tests ====================

    /**
     * Property: Backoff doubles per attempt within ten percent jitter.
     */
    @RepeatedTest(20)
    void calculateBackoffMs_doublesWithJitter() {
        RetryingPeerTransport transport = new RetryingPeerTransport(
                (peerId, msg, timeout) -> CompletableFuture.completedFuture(null), scheduler, 5, 100);

        assertThat(transport.calculateBackoffMs(1)).isBetween(90L, 110L);
        assertThat(transport.calculateBackoffMs(3)).isBetween(360L, 440L);
    }

    @Test
    void calculateBackoffMs_isCapped() {
        RetryingPeerTransport transport = new RetryingPeerTransport(
                (peerId, msg, timeout) -> CompletableFuture.completedFuture(null), scheduler, 30, 1000);

        assertThat(transport.calculateBackoffMs(20)).isEqualTo(10_000L);
    }
}
