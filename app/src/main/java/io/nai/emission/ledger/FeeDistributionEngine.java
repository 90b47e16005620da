package io.nai.emission.ledger;

import io.nai.emission.protocol.AcceptedBlock;

import java.util.logging.Logger;

/**
 * Splits each block's fees 50/50 between the emission account and the
 * validators. Fees are circulating value, so total supply is untouched.
 */
final class FeeDistributionEngine {
    private static final Logger LOG = Logger.getLogger(FeeDistributionEngine.class.getName());

    private final LedgerState state;
    private final StakeDistributor distributor;

    FeeDistributionEngine(LedgerState state, StakeDistributor distributor) {
        this.state = state;
        this.distributor = distributor;
    }

    FeeDistribution distribute(long fee, AcceptedBlock block) {
        if (fee < 0) {
            throw new IllegalArgumentException("fee must be >= 0");
        }
        long clamped = Math.min(fee, state.headroom());
        if (clamped <= 0) {
            return FeeDistribution.NONE;
        }
        long emissionShare = clamped / 2;
        state.emissionAccount.credit(emissionShare);

        long validatorPool = clamped - emissionShare;
        if (state.totalStaked == 0 || validatorPool == 0) {
            return new FeeDistribution(clamped, emissionShare, validatorPool, 0L);
        }
        distributor.sweep(block.timestamp());
        long distributed = distributor.apportion(validatorPool, null);
        LOG.fine(() -> "Fees at height " + block.height() + ": emission=" + emissionShare
                + " validators=" + distributed + "/" + validatorPool);
        return new FeeDistribution(clamped, emissionShare, validatorPool, distributed);
    }
}
