package io.nai.emission.state;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;

import java.util.Objects;

/**
 * Persisted delegation, keyed by (delegator, node id). This is the
 * authoritative delegated principal; the ledger only keeps the aggregate.
 */
public record DelegatorStakeRecord(
        Address delegator,
        NodeId nodeId,
        long stakeStartBlock,
        long stakedAmount,
        Address rewardAddress
) {
    public DelegatorStakeRecord {
        Objects.requireNonNull(delegator, "delegator");
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(rewardAddress, "rewardAddress");
        if (stakedAmount < 0) {
            throw new IllegalArgumentException("stakedAmount must be >= 0");
        }
    }
}
