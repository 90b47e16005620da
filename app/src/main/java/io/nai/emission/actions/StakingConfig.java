package io.nai.emission.actions;

import io.nai.emission.ledger.Emission;

/**
 * Limits enforced on staking actions. Amounts are base units, the duration
 * is seconds.
 */
public record StakingConfig(
        long minValidatorStake,
        long maxValidatorStake,
        long minDelegatorStake,
        int minDelegationFeeRate,
        int maxDelegationFeeRate,
        long minValidatorStakeDuration
) {
    public static final long DEFAULT_MIN_VALIDATOR_STAKE = 1_500_000L * Emission.ONE_NAI;
    public static final long DEFAULT_MAX_VALIDATOR_STAKE = 1_000_000_000L * Emission.ONE_NAI;
    public static final long DEFAULT_MIN_DELEGATOR_STAKE = 25L * Emission.ONE_NAI;
    public static final int DEFAULT_MIN_DELEGATION_FEE_RATE = 2;
    public static final int DEFAULT_MAX_DELEGATION_FEE_RATE = 100;
    /** 180 days. */
    public static final long DEFAULT_MIN_VALIDATOR_STAKE_DURATION = 180L * 24 * 60 * 60;

    public StakingConfig {
        if (minValidatorStake < 0 || maxValidatorStake < minValidatorStake) {
            throw new IllegalArgumentException("validator stake bounds are invalid");
        }
        if (minDelegatorStake < 0) {
            throw new IllegalArgumentException("minDelegatorStake must be >= 0");
        }
        if (minDelegationFeeRate < 0 || maxDelegationFeeRate > 100 || maxDelegationFeeRate < minDelegationFeeRate) {
            throw new IllegalArgumentException("delegation fee rate bounds must be within 0..100");
        }
        if (minValidatorStakeDuration < 0) {
            throw new IllegalArgumentException("minValidatorStakeDuration must be >= 0");
        }
    }

    public static StakingConfig defaults() {
        return new StakingConfig(
                DEFAULT_MIN_VALIDATOR_STAKE,
                DEFAULT_MAX_VALIDATOR_STAKE,
                DEFAULT_MIN_DELEGATOR_STAKE,
                DEFAULT_MIN_DELEGATION_FEE_RATE,
                DEFAULT_MAX_DELEGATION_FEE_RATE,
                DEFAULT_MIN_VALIDATOR_STAKE_DURATION);
    }
}
