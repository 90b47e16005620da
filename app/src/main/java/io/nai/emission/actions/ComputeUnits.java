package io.nai.emission.actions;

/** Compute units charged per staking action. */
public final class ComputeUnits {
    public static final long REGISTER_VALIDATOR_STAKE = 5;
    public static final long WITHDRAW_VALIDATOR_STAKE = 1;
    public static final long DELEGATE_USER_STAKE = 5;
    public static final long UNDELEGATE_USER_STAKE = 1;
    public static final long CLAIM_STAKING_REWARD = 2;

    private ComputeUnits() {}
}
