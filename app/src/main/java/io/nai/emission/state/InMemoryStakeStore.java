package io.nai.emission.state;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory implementation of StakeStore.
 * Not persistent: resets every process run.
 */
public final class InMemoryStakeStore implements StakeStore {

    private final Map<NodeId, ValidatorStakeRecord> validators = new HashMap<>();
    private final Map<NodeId, Map<Address, DelegatorStakeRecord>> delegations = new HashMap<>();

    @Override
    public synchronized Optional<ValidatorStakeRecord> getValidatorStake(NodeId nodeId) {
        return Optional.ofNullable(validators.get(nodeId));
    }

    @Override
    public synchronized void putValidatorStake(ValidatorStakeRecord record) {
        validators.put(record.nodeId(), record);
    }

    @Override
    public synchronized boolean removeValidatorStake(NodeId nodeId) {
        return validators.remove(nodeId) != null;
    }

    @Override
    public synchronized Optional<DelegatorStakeRecord> getDelegatorStake(Address delegator, NodeId nodeId) {
        Map<Address, DelegatorStakeRecord> byDelegator = delegations.get(nodeId);
        return byDelegator == null ? Optional.empty() : Optional.ofNullable(byDelegator.get(delegator));
    }

    @Override
    public synchronized void putDelegatorStake(DelegatorStakeRecord record) {
        delegations.computeIfAbsent(record.nodeId(), k -> new TreeMap<>()).put(record.delegator(), record);
    }

    @Override
    public synchronized boolean removeDelegatorStake(Address delegator, NodeId nodeId) {
        Map<Address, DelegatorStakeRecord> byDelegator = delegations.get(nodeId);
        if (byDelegator == null) {
            return false;
        }
        boolean removed = byDelegator.remove(delegator) != null;
        if (byDelegator.isEmpty()) {
            delegations.remove(nodeId);
        }
        return removed;
    }

    @Override
    public synchronized List<ValidatorStakeRecord> validatorStakes() {
        return List.copyOf(new TreeMap<>(validators).values());
    }

    @Override
    public synchronized List<DelegatorStakeRecord> delegations() {
        List<DelegatorStakeRecord> out = new ArrayList<>();
        for (Map<Address, DelegatorStakeRecord> byDelegator : new TreeMap<>(delegations).values()) {
            out.addAll(byDelegator.values());
        }
        return out;
    }

    @Override
    public synchronized List<DelegatorStakeRecord> delegationsTo(NodeId nodeId) {
        Map<Address, DelegatorStakeRecord> byDelegator = delegations.get(nodeId);
        return byDelegator == null ? List.of() : List.copyOf(byDelegator.values());
    }
}
