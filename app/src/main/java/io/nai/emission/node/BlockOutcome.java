package io.nai.emission.node;

import io.nai.emission.ledger.FeeDistribution;

/** What one accepted block did to the ledger. */
public record BlockOutcome(long height, FeeDistribution fees, long minted) {
}
