package io.nai.emission.consensus;

import io.nai.emission.protocol.AcceptedBlock;

/**
 * The ledger's only clock: height and timestamp of the last accepted block.
 * No wall-clock reads happen inside the ledger.
 */
@FunctionalInterface
public interface AcceptedBlockSource {
    AcceptedBlock lastAccepted();
}
