package com.keyforge.core.error;

/**
 * A message could not be delivered to a peer.
 */
public class PeerSendException extends KeyforgeException {

    private final String peerId;

    public PeerSendException(String peerId, String message) {
        super("Send to peer " + peerId + " failed: " + message);
        this.peerId = peerId;
    }

    public PeerSendException(String peerId, String message, Throwable cause) {
        super("Send to peer " + peerId + " failed: " + message, cause);
        this.peerId = peerId;
    }

    public String getPeerId() {
        return peerId;
    }
}
