package com.keyforge.core.spi;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous point-to-point delivery to replica peers.
 * <p>
 * The returned future completes with the peer's acknowledgement, or fails with a
 * {@link com.keyforge.core.error.PeerSendException} when delivery fails or the timeout
 * elapses. Failures are always reported, never swallowed.
 */
@FunctionalInterface
public interface PeerTransport {

    CompletableFuture<PeerAck> send(String peerId, PeerMessage message, Duration timeout);
}
