package io.nai.emission.consensus;

import io.nai.emission.protocol.NodeId;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable validator set used by the local node and tests.
 */
public final class InMemoryValidatorSet implements ValidatorSetSource {

    private final Map<NodeId, byte[]> members = new TreeMap<>();

    @Override
    public synchronized Map<NodeId, byte[]> currentValidators() {
        Map<NodeId, byte[]> copy = new TreeMap<>();
        for (Map.Entry<NodeId, byte[]> e : members.entrySet()) {
            copy.put(e.getKey(), e.getValue().clone());
        }
        return Collections.unmodifiableMap(copy);
    }

    public synchronized void put(NodeId nodeId, byte[] publicKey) {
        members.put(nodeId, publicKey == null ? new byte[0] : publicKey.clone());
    }

    public synchronized boolean remove(NodeId nodeId) {
        return members.remove(nodeId) != null;
    }

    public synchronized int size() {
        return members.size();
    }
}
