package io.nai.emission.ledger;

/**
 * Split of one validator's reward (or fee) between the validator and its delegators.
 */
public record RewardSplit(long validatorShare, long delegationShare) {

    /**
     * With no delegated stake the validator keeps everything; otherwise the
     * delegation share is {@code floor(total * feeRatePercent / 100)}.
     */
    public static RewardSplit of(long total, int delegationFeeRatePercent, long delegatedAmount) {
        if (total < 0) {
            throw new IllegalArgumentException("total must be >= 0");
        }
        long delegation = 0L;
        if (delegatedAmount > 0) {
            // fee rate is applied as the delegators' cut (existing on-chain direction)
            delegation = RewardMath.mulDiv(total, delegationFeeRatePercent, 100L);
        }
        return new RewardSplit(total - delegation, delegation);
    }

    public long total() {
        return validatorShare + delegationShare;
    }
}
