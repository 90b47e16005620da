package io.nai.emission.ledger;

import io.nai.emission.protocol.Address;
import io.nai.emission.protocol.NodeId;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Mutable validator entry. Owned by {@link LedgerState}; only touched while
 * the ledger write lock is held. Callers outside the package see
 * {@link ValidatorSnapshot}s.
 */
final class Validator {
    final NodeId nodeId;
    byte[] publicKey;
    boolean active;
    /** Set by withdrawal; keeps the activation sweep from reviving the entry. */
    boolean withdrawn;

    long stakedAmount;
    long delegatedAmount;
    int delegationFeeRate;
    long unclaimedStakedReward;
    long unclaimedDelegatedReward;

    Instant stakeStartTime;
    Instant stakeEndTime;

    final Map<Address, Long> delegatorsLastClaim = new HashMap<>();
    final Map<Long, Long> epochRewards = new HashMap<>();

    Validator(NodeId nodeId, byte[] publicKey, long stakedAmount, int delegationFeeRate,
              Instant stakeStartTime, Instant stakeEndTime) {
        this.nodeId = nodeId;
        this.publicKey = publicKey.clone();
        this.stakedAmount = stakedAmount;
        this.delegationFeeRate = delegationFeeRate;
        this.stakeStartTime = stakeStartTime;
        this.stakeEndTime = stakeEndTime;
    }

    long totalStake() {
        return Math.addExact(stakedAmount, delegatedAmount);
    }

    boolean hasDelegators() {
        return !delegatorsLastClaim.isEmpty();
    }

    ValidatorSnapshot snapshot() {
        return new ValidatorSnapshot(
                nodeId,
                publicKey,
                active,
                stakedAmount,
                unclaimedStakedReward,
                delegationFeeRate,
                delegatedAmount,
                unclaimedDelegatedReward,
                stakeStartTime,
                stakeEndTime,
                delegatorsLastClaim.size()
        );
    }
}
