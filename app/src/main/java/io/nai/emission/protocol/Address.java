package io.nai.emission.protocol;

import org.bitcoinj.core.Sha256Hash;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Account address: one type byte followed by a 32 byte key hash.
 * Rendered as bech32 only at the RPC/CLI boundary, see {@link AddressFormat}.
 */
public final class Address implements Comparable<Address> {
    public static final int LENGTH = 33;
    public static final Address EMPTY = new Address(new byte[LENGTH]);

    private final byte[] bytes;

    public Address(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be " + LENGTH + " bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Address of(byte typeId, byte[] keyHash) {
        if (keyHash == null || keyHash.length != LENGTH - 1) {
            throw new IllegalArgumentException("key hash must be " + (LENGTH - 1) + " bytes");
        }
        byte[] raw = new byte[LENGTH];
        raw[0] = typeId;
        System.arraycopy(keyHash, 0, raw, 1, keyHash.length);
        return new Address(raw);
    }

    /** Deterministic address derived from a seed string (type byte 0). */
    public static Address derive(String seed) {
        return of((byte) 0, Sha256Hash.hash(seed.getBytes(StandardCharsets.UTF_8)));
    }

    public byte[] bytes() { return bytes.clone(); }
    public byte typeId() { return bytes[0]; }
    public boolean isEmpty() { return equals(EMPTY); }

    @Override
    public int compareTo(Address other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override public boolean equals(Object o){ return o instanceof Address && Arrays.equals(bytes, ((Address)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Address("+Hex.encode(bytes).substring(0,10)+"…)"; }
}
