package io.nai.emission.protocol;

import org.bitcoinj.core.Sha256Hash;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Fixed-size (20 byte) identifier of a network node.
 * {@link #EMPTY} is the all-zero id; queries treat it as "every validator".
 */
public final class NodeId implements Comparable<NodeId> {
    public static final int LENGTH = 20;
    public static final NodeId EMPTY = new NodeId(new byte[LENGTH]);

    private final byte[] bytes;

    public NodeId(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("NodeId must be " + LENGTH + " bytes");
        }
        this.bytes = bytes.clone();
    }

    public static NodeId fromHex(String hex) {
        return new NodeId(Hex.decode(hex));
    }

    /** Deterministic id derived from a seed, for tests and the local demo. */
    public static NodeId derive(String seed) {
        return new NodeId(Arrays.copyOf(Sha256Hash.hash(seed.getBytes(StandardCharsets.UTF_8)), LENGTH));
    }

    public byte[] bytes() { return bytes.clone(); }
    public String hex() { return Hex.encode(bytes); }
    public boolean isEmpty() { return equals(EMPTY); }

    @Override
    public int compareTo(NodeId other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof NodeId && Arrays.equals(bytes, ((NodeId)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "NodeId("+hex().substring(0,8)+"…)"; }
}
