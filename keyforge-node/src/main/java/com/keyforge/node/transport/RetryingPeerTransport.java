package com.keyforge.node.transport;

import com.keyforge.core.error.Failures;
import com.keyforge.core.error.PeerSendException;
import com.keyforge.core.spi.PeerAck;
import com.keyforge.core.spi.PeerMessage;
import com.keyforge.core.spi.PeerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Retries failed deliveries with exponential backoff and jitter.
 * <p>
 * Only delivery failures are retried. A peer that answers with a refusing ack has
 * decided, so the refusal is returned as is. After the last attempt the caller receives
 * a {@link PeerSendException} carrying the final cause.
 */
public class RetryingPeerTransport implements PeerTransport {

    private static final Logger log = LoggerFactory.getLogger(RetryingPeerTransport.class);
    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_BASE_BACKOFF_MS = 100;
    private static final long MAX_BACKOFF_MS = 10_000;

    private final PeerTransport delegate;
    private final ScheduledExecutorService scheduler;
    private final int maxAttempts;
    private final long baseBackoffMs;
    private final AtomicLong retries = new AtomicLong();

    public RetryingPeerTransport(PeerTransport delegate, ScheduledExecutorService scheduler,
                                 int maxAttempts, long baseBackoffMs) {
        this.delegate = Objects.requireNonNull(delegate, "Delegate transport cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseBackoffMs = baseBackoffMs;
    }

    public RetryingPeerTransport(PeerTransport delegate, ScheduledExecutorService scheduler) {
        this(delegate, scheduler, DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_BACKOFF_MS);
    }

    @Override
    public CompletableFuture<PeerAck> send(String peerId, PeerMessage message, Duration timeout) {
        return attempt(peerId, message, timeout, 1);
    }

    public long getRetryCount() {
        return retries.get();
    }

    private CompletableFuture<PeerAck> attempt(String peerId, PeerMessage message, Duration timeout, int attempt) {
        CompletableFuture<PeerAck> sent;
        try {
            sent = delegate.send(peerId, message, timeout);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }
        return sent.handle((ack, error) -> {
            if (error == null) {
                return CompletableFuture.completedFuture(ack);
            }
            Throwable cause = Failures.unwrap(error);
            if (attempt >= maxAttempts) {
                return CompletableFuture.<PeerAck>failedFuture(cause instanceof PeerSendException
                        ? cause
                        : new PeerSendException(peerId, "gave up after " + attempt + " attempts", cause));
            }
            long backoffMs = calculateBackoffMs(attempt);
            retries.incrementAndGet();
            log.debug("{} to {} failed (attempt {}/{}), retrying in {}ms: {}",
                    message.type(), peerId, attempt, maxAttempts, backoffMs, cause.getMessage());
            Executor delayed = CompletableFuture.delayedExecutor(backoffMs, TimeUnit.MILLISECONDS, scheduler);
            return CompletableFuture.supplyAsync(() -> null, delayed)
                    .thenCompose(v -> attempt(peerId, message, timeout, attempt + 1));
        }).thenCompose(f -> f);
    }

    /**
     * Exponential backoff with ±10% jitter, capped.
     */
    long calculateBackoffMs(int attempt) {
        long backoff = (long) (baseBackoffMs * Math.pow(2, attempt - 1));
        double jitter = 0.9 + (ThreadLocalRandom.current().nextDouble() * 0.2);
        backoff = (long) (backoff * jitter);
        return Math.min(backoff, MAX_BACKOFF_MS);
    }
}
