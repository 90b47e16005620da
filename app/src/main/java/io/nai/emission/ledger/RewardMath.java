package io.nai.emission.ledger;

import java.math.BigInteger;

/**
 * Exact integer reward arithmetic. Every quotient is floored once, so all
 * nodes reproduce the same amounts bit for bit.
 */
public final class RewardMath {
    public static final long SECONDS_PER_YEAR = 365L * 24 * 60 * 60;
    public static final long BPS_DENOMINATOR = 10_000L;

    private RewardMath() {}

    /** floor(a * b / c); 0 when {@code c == 0}. Inputs must be non-negative. */
    public static long mulDiv(long a, long b, long c) {
        if (a < 0 || b < 0 || c < 0) {
            throw new IllegalArgumentException("mulDiv operands must be >= 0");
        }
        if (c == 0 || a == 0 || b == 0) {
            return 0L;
        }
        return BigInteger.valueOf(a)
                .multiply(BigInteger.valueOf(b))
                .divide(BigInteger.valueOf(c))
                .longValueExact();
    }

    /** APR in basis points for {@code validatorCount} validators, floored. */
    public static long aprBps(EpochTracker tracker, long validatorCount) {
        if (validatorCount <= tracker.baseValidators()) {
            return tracker.baseAprBps();
        }
        return mulDiv(tracker.baseAprBps(), tracker.baseValidators(), validatorCount);
    }

    /**
     * Rewards for one epoch:
     * {@code floor(totalStaked * APR(n) * epochLength * secondsPerBlock / secondsPerYear)},
     * evaluated as a single rational, then capped at {@code headroom}.
     */
    public static long rewardsPerEpoch(long totalStaked, EpochTracker tracker, long validatorCount, long headroom) {
        if (totalStaked <= 0 || headroom <= 0) {
            return 0L;
        }
        BigInteger numerator = BigInteger.valueOf(totalStaked)
                .multiply(BigInteger.valueOf(tracker.baseAprBps()))
                .multiply(BigInteger.valueOf(tracker.epochLength()))
                .multiply(BigInteger.valueOf(tracker.secondsPerBlock()));
        BigInteger denominator = BigInteger.valueOf(BPS_DENOMINATOR).multiply(BigInteger.valueOf(SECONDS_PER_YEAR));
        if (validatorCount > tracker.baseValidators()) {
            numerator = numerator.multiply(BigInteger.valueOf(tracker.baseValidators()));
            denominator = denominator.multiply(BigInteger.valueOf(validatorCount));
        }
        BigInteger reward = numerator.divide(denominator);
        BigInteger cap = BigInteger.valueOf(headroom);
        return reward.min(cap).longValueExact();
    }
}
