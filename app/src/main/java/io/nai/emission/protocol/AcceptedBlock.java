package io.nai.emission.protocol;

import java.time.Instant;
import java.util.Objects;

/** Height and UTC timestamp of the last block accepted by the VM. */
public record AcceptedBlock(long height, Instant timestamp) {
    public AcceptedBlock {
        if (height < 0) {
            throw new IllegalArgumentException("height must be >= 0");
        }
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static AcceptedBlock genesis(Instant timestamp) {
        return new AcceptedBlock(0L, timestamp);
    }
}
