package io.nai.emission.ledger;

import io.nai.emission.protocol.NodeId;

import java.util.Map;
import java.util.TreeMap;

/**
 * Mutable ledger counters and the validator map. Guarded by the lock in
 * {@link Emission}. The map is sorted by node id so every sweep visits
 * validators in the same order on every node.
 */
final class LedgerState {
    long totalSupply;
    final long maxSupply;
    long totalStaked;
    final EmissionAccount emissionAccount;
    final EpochTracker epochTracker;
    final Map<NodeId, Validator> validators = new TreeMap<>();

    LedgerState(long totalSupply, long maxSupply, EmissionAccount emissionAccount, EpochTracker epochTracker) {
        this.totalSupply = totalSupply;
        this.maxSupply = maxSupply;
        this.emissionAccount = emissionAccount;
        this.epochTracker = epochTracker;
    }

    long headroom() {
        return maxSupply - totalSupply;
    }

    Validator require(NodeId nodeId) {
        Validator validator = validators.get(nodeId);
        if (validator == null) {
            throw new StakingException(StakingException.Kind.VALIDATOR_NOT_FOUND, nodeId.hex());
        }
        return validator;
    }

    void addStaked(long amount) {
        totalStaked = Math.addExact(totalStaked, amount);
    }

    void removeStaked(long amount) {
        long next = totalStaked - amount;
        if (next < 0) {
            throw new IllegalStateException("Total staked would become negative: " + totalStaked + " - " + amount);
        }
        totalStaked = next;
    }
}
