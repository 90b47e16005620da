package io.nai.emission.state;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;

import java.util.Objects;

/**
 * Persisted registration of a validator stake, keyed by node id.
 * Stake window bounds are unix seconds.
 */
public record ValidatorStakeRecord(
        NodeId nodeId,
        Address owner,
        Address rewardAddress,
        long stakeStartTime,
        long stakeEndTime,
        long stakedAmount,
        int delegationFeeRate
) {
    public ValidatorStakeRecord {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(rewardAddress, "rewardAddress");
        if (stakedAmount < 0) {
            throw new IllegalArgumentException("stakedAmount must be >= 0");
        }
    }
}
