package io.nai.emission.ledger;

import io.nai.emission.protocol.AcceptedBlock;

import java.util.logging.Logger;

/**
 * Mints epoch rewards on epoch-boundary heights.
 */
final class EpochRewardEngine {
    private static final Logger LOG = Logger.getLogger(EpochRewardEngine.class.getName());

    private final LedgerState state;
    private final StakeDistributor distributor;

    EpochRewardEngine(LedgerState state, StakeDistributor distributor) {
        this.state = state;
        this.distributor = distributor;
    }

    long rewardsPerEpoch() {
        return RewardMath.rewardsPerEpoch(state.totalStaked, state.epochTracker, state.validators.size(), state.headroom());
    }

    long mint(AcceptedBlock block) {
        EpochTracker tracker = state.epochTracker;
        if (!tracker.isEpochBoundary(block.height())) {
            return 0L;
        }
        // sweep first so the denominator is exactly the stake being paid
        distributor.sweep(block.timestamp());

        long epoch = tracker.epochOf(block.height());
        long totalEpochRewards = rewardsPerEpoch();
        long minted = distributor.apportion(totalEpochRewards, epoch);

        state.totalSupply = Math.addExact(state.totalSupply, minted);
        if (state.totalSupply > state.maxSupply) {
            throw new IllegalStateException("Total supply " + state.totalSupply + " exceeds max supply " + state.maxSupply);
        }
        LOG.info(() -> "Epoch " + epoch + " at height " + block.height() + ": minted " + minted
                + " of " + totalEpochRewards + " (totalStaked=" + state.totalStaked + ", totalSupply=" + state.totalSupply + ")");
        return minted;
    }
}
