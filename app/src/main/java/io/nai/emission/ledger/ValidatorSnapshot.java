package io.nai.emission.ledger;

import io.nai.emission.protocol.NodeId;

import java.time.Instant;

/**
 * Point-in-time copy of a validator entry, safe to hand to RPC threads.
 * Validators that only exist in consensus membership have zero stake and
 * null stake window.
 */
public record ValidatorSnapshot(
        NodeId nodeId,
        byte[] publicKey,
        boolean active,
        long stakedAmount,
        long unclaimedStakedReward,
        int delegationFeeRate,
        long delegatedAmount,
        long unclaimedDelegatedReward,
        Instant stakeStartTime,
        Instant stakeEndTime,
        int delegatorCount
) {
    public ValidatorSnapshot {
        publicKey = publicKey == null ? new byte[0] : publicKey.clone();
    }

    static ValidatorSnapshot unstaked(NodeId nodeId, byte[] publicKey) {
        return new ValidatorSnapshot(nodeId, publicKey, false, 0L, 0L, 0, 0L, 0L, null, null, 0);
    }

    ValidatorSnapshot withPublicKey(byte[] key) {
        return new ValidatorSnapshot(nodeId, key, active, stakedAmount, unclaimedStakedReward, delegationFeeRate,
                delegatedAmount, unclaimedDelegatedReward, stakeStartTime, stakeEndTime, delegatorCount);
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    public boolean staked() {
        return stakeStartTime != null;
    }
}
