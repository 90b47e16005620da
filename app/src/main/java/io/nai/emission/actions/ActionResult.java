package io.nai.emission.actions;

/**
 * Result of one staking action.
 *
 * @param output  empty on success, otherwise the failure message
 * @param payout  amount the caller must credit to the reward address (principal and rewards)
 */
public record ActionResult(boolean success, String output, long computeUnits, long payout) {

    static ActionResult ok(long computeUnits, long payout) {
        return new ActionResult(true, "", computeUnits, payout);
    }

    static ActionResult fail(long computeUnits, String output) {
        return new ActionResult(false, output, computeUnits, 0L);
    }
}
