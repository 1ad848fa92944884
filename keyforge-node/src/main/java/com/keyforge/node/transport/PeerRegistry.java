package com.keyforge.node.transport;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Peers this node knows about. The local node is never listed.
 */
public class PeerRegistry {

    private final String localNodeId;
    private final Set<String> peers = ConcurrentHashMap.newKeySet();

    public PeerRegistry(String localNodeId, Collection<String> initialPeers) {
        this.localNodeId = Objects.requireNonNull(localNodeId, "Local node ID cannot be null");
        if (initialPeers != null) {
            initialPeers.forEach(this::add);
        }
    }

    public PeerRegistry(String localNodeId) {
        this(localNodeId, List.of());
    }

    public String localNodeId() {
        return localNodeId;
    }

    /**
     * @return true if the peer was not known before
     */
    public boolean add(String peerId) {
        if (peerId == null || peerId.isBlank() || peerId.equals(localNodeId)) {
            return false;
        }
        return peers.add(peerId);
    }

    public boolean remove(String peerId) {
        return peers.remove(peerId);
    }

    public boolean contains(String peerId) {
        return peers.contains(peerId);
    }

    public List<String> peers() {
        return peers.stream().sorted().toList();
    }

    public int size() {
        return peers.size();
    }
}
