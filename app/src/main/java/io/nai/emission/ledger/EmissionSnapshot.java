package io.nai.emission.ledger;

/** Aggregate counters of the ledger at one instant. */
public record EmissionSnapshot(
        long totalSupply,
        long maxSupply,
        long totalStaked,
        EmissionAccount emissionAccount,
        EpochTracker epochTracker,
        int validatorCount
) {
}
