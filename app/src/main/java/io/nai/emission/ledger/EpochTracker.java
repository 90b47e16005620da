package io.nai.emission.ledger;

/**
 * Epoch reward configuration.
 *
 * @param baseAprBps      annual reward rate in basis points while the validator count is at or below {@code baseValidators}
 * @param baseValidators  validator count beyond which the APR decays as {@code baseApr * baseValidators / n}
 * @param epochLength     blocks per reward epoch
 * @param secondsPerBlock nominal block time used to annualise the APR
 */
public record EpochTracker(long baseAprBps, long baseValidators, long epochLength, long secondsPerBlock) {

    public static final long DEFAULT_BASE_APR_BPS = 2_500L;
    public static final long DEFAULT_BASE_VALIDATORS = 100L;
    public static final long DEFAULT_EPOCH_LENGTH = 10L;
    public static final long DEFAULT_SECONDS_PER_BLOCK = 3L;

    public EpochTracker {
        if (baseAprBps < 0) {
            throw new IllegalArgumentException("baseAprBps must be >= 0");
        }
        if (baseValidators <= 0) {
            throw new IllegalArgumentException("baseValidators must be > 0");
        }
        if (epochLength <= 0) {
            throw new IllegalArgumentException("epochLength must be > 0");
        }
        if (secondsPerBlock <= 0) {
            throw new IllegalArgumentException("secondsPerBlock must be > 0");
        }
    }

    public static EpochTracker defaults() {
        return new EpochTracker(DEFAULT_BASE_APR_BPS, DEFAULT_BASE_VALIDATORS, DEFAULT_EPOCH_LENGTH, DEFAULT_SECONDS_PER_BLOCK);
    }

    public long epochOf(long height) {
        return height / epochLength;
    }

    public boolean isEpochBoundary(long height) {
        return height % epochLength == 0;
    }
}
