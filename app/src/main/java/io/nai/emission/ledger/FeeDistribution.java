package io.nai.emission.ledger;

/**
 * Outcome of one block's fee distribution.
 *
 * @param fee           fee after clamping to the supply headroom
 * @param emissionShare credited to the emission account
 * @param validatorPool offered to validators
 * @param distributed   actually accrued to validators (floor rounding keeps this at or below the pool)
 */
public record FeeDistribution(long fee, long emissionShare, long validatorPool, long distributed) {
    public static final FeeDistribution NONE = new FeeDistribution(0L, 0L, 0L, 0L);
}
