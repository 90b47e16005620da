package io.nai.emission.ledger;

/**
 * Business-rule rejection raised by the emission ledger. Deterministic for a
 * given ledger state and input, so callers fail the triggering transaction
 * rather than retry.
 */
public class StakingException extends RuntimeException {

    public enum Kind {
        VALIDATOR_NOT_FOUND("validator not found"),
        VALIDATOR_ALREADY_REGISTERED("validator already registered"),
        DELEGATOR_NOT_FOUND("delegator not found"),
        DELEGATOR_ALREADY_STAKED("delegator already staked"),
        STAKE_NOT_FOUND("stake not found"),
        UNAUTHORIZED("unauthorized");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Kind kind;

    public StakingException(Kind kind) {
        super(kind.message());
        this.kind = kind;
    }

    public StakingException(Kind kind, String detail) {
        super(detail == null || detail.isBlank() ? kind.message() : kind.message() + ": " + detail);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
