package com.keyforge.core.spi;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Envelope sent through a {@link PeerTransport}. The payload is a JSON document whose
 * shape depends on {@link #type()}.
 */
public record PeerMessage(
        String messageId,
        PeerMessageType type,
        String senderId,
        String resourceId,
        String payload,
        Instant sentAt
) {
    public PeerMessage {
        Objects.requireNonNull(type, "Message type cannot be null");
        Objects.requireNonNull(senderId, "Sender ID cannot be null");
    }

    public static PeerMessage of(PeerMessageType type, String senderId, String resourceId, String payload) {
        return new PeerMessage(UUID.randomUUID().toString(), type, senderId, resourceId, payload, Instant.now());
    }
}
