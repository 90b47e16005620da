package io.nai.emission.consensus;

import io.nai.emission.protocol.AcceptedBlock;

import java.time.Instant;
import java.util.Objects;

/**
 * Block source advanced explicitly by the block driver (or a test).
 * Heights must never go backwards.
 */
public final class ManualBlockSource implements AcceptedBlockSource {

    private volatile AcceptedBlock last;

    public ManualBlockSource(AcceptedBlock initial) {
        this.last = Objects.requireNonNull(initial, "initial");
    }

    public static ManualBlockSource atGenesis(Instant timestamp) {
        return new ManualBlockSource(AcceptedBlock.genesis(timestamp));
    }

    @Override
    public AcceptedBlock lastAccepted() {
        return last;
    }

    public synchronized void accept(AcceptedBlock block) {
        Objects.requireNonNull(block, "block");
        if (block.height() < last.height()) {
            throw new IllegalArgumentException("Block height went backwards: " + last.height() + " -> " + block.height());
        }
        if (block.timestamp().isBefore(last.timestamp())) {
            throw new IllegalArgumentException("Block timestamp went backwards at height " + block.height());
        }
        last = block;
    }

    public void accept(long height, Instant timestamp) {
        accept(new AcceptedBlock(height, timestamp));
    }
}
