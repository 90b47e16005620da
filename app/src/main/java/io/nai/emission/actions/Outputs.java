package io.nai.emission.actions;

/** Failure outputs returned to the transaction author. */
public final class Outputs {
    public static final String STAKE_MISSING = "stake is missing";
    public static final String UNAUTHORIZED = "unauthorized";
    public static final String STAKED_AMOUNT_INVALID = "staked amount must be between 1.5 million and 1 billion";
    public static final String INVALID_STAKE_START_TIME = "invalid stake start time";
    public static final String INVALID_STAKE_END_TIME = "invalid stake end time";
    public static final String INVALID_STAKE_DURATION = "invalid stake duration";
    public static final String INVALID_DELEGATION_FEE_RATE = "delegation fee rate must be over 2 and under 100";
    public static final String VALIDATOR_ALREADY_REGISTERED = "validator already registered";
    public static final String DELEGATOR_STAKE_INVALID = "staked amount is invalid";
    public static final String DELEGATOR_ALREADY_STAKED = "delegator already staked";

    private Outputs() {}
}
