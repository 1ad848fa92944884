package com.keyforge.core.spi;

/**
 * Acknowledgement returned by a peer for a delivered message.
 */
public record PeerAck(
        String peerId,
        String messageId,
        boolean accepted,
        String detail
) {
    public static PeerAck accepted(String peerId, String messageId) {
        return new PeerAck(peerId, messageId, true, null);
    }

    public static PeerAck refused(String peerId, String messageId, String detail) {
        return new PeerAck(peerId, messageId, false, detail);
    }
}
