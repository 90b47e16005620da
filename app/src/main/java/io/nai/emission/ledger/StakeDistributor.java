package io.nai.emission.ledger;

import java.time.Instant;
import java.util.logging.Logger;

/**
 * Activation sweep and pro-rata apportionment shared by epoch minting and
 * fee distribution.
 */
final class StakeDistributor {
    private static final Logger LOG = Logger.getLogger(StakeDistributor.class.getName());

    private final LedgerState state;

    StakeDistributor(LedgerState state) {
        this.state = state;
    }

    /**
     * Activates validators whose window has opened and deactivates those whose
     * window has closed, keeping total staked equal to the active stake.
     */
    void sweep(Instant blockTime) {
        for (Validator v : state.validators.values()) {
            if (!v.active) {
                if (!v.withdrawn && blockTime.isAfter(v.stakeStartTime) && !blockTime.isAfter(v.stakeEndTime)) {
                    v.active = true;
                    state.addStaked(v.totalStake());
                    LOG.fine(() -> "Activated validator " + v.nodeId.hex());
                }
            } else if (blockTime.isAfter(v.stakeEndTime)) {
                v.active = false;
                state.removeStaked(v.totalStake());
                LOG.fine(() -> "Deactivated validator " + v.nodeId.hex() + " (stake ended)");
            }
        }
    }

    /**
     * Splits {@code pool} across active validators by stake weight against
     * the current total staked. When {@code epoch} is non-null the delegation
     * share is recorded for that epoch.
     *
     * @return the amount actually accrued (at most {@code pool})
     */
    long apportion(long pool, Long epoch) {
        long denominator = state.totalStaked;
        if (pool <= 0 || denominator == 0) {
            return 0L;
        }
        long distributed = 0L;
        for (Validator v : state.validators.values()) {
            if (!v.active) {
                continue;
            }
            long share = RewardMath.mulDiv(pool, v.totalStake(), denominator);
            RewardSplit split = RewardSplit.of(share, v.delegationFeeRate, v.delegatedAmount);
            v.unclaimedStakedReward = Math.addExact(v.unclaimedStakedReward, split.validatorShare());
            v.unclaimedDelegatedReward = Math.addExact(v.unclaimedDelegatedReward, split.delegationShare());
            if (epoch != null) {
                v.epochRewards.put(epoch, split.delegationShare());
            }
            distributed = Math.addExact(distributed, share);
        }
        if (distributed > pool) {
            throw new IllegalStateException("Apportioned " + distributed + " from a pool of " + pool);
        }
        return distributed;
    }
}
