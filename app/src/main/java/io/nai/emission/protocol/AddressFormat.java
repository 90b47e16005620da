package io.nai.emission.protocol;

import org.bitcoinj.core.Bech32;

import java.io.ByteArrayOutputStream;

/**
 * Human readable address rendering used by RPC, config files and the CLI:
 * bech32 (not bech32m) with the {@code nai} prefix over the 33 raw bytes.
 */
public final class AddressFormat {
    public static final String HRP = "nai";

    private AddressFormat() {}

    public static String format(Address address) {
        return Bech32.encode(Bech32.Encoding.BECH32, HRP, convertBits(address.bytes(), 8, 5, true));
    }

    /** @throws IllegalArgumentException on a bad checksum, prefix or length */
    public static Address parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("address required");
        }
        Bech32.Bech32Data decoded = Bech32.decode(text.trim());
        if (decoded.encoding != Bech32.Encoding.BECH32 || !HRP.equalsIgnoreCase(decoded.hrp)) {
            throw new IllegalArgumentException("expected a bech32 address with prefix " + HRP + ": " + text);
        }
        byte[] raw = convertBits(decoded.data, 5, 8, false);
        if (raw.length != Address.LENGTH) {
            throw new IllegalArgumentException("address must decode to " + Address.LENGTH + " bytes, got " + raw.length);
        }
        return new Address(raw);
    }

    // bitcoinj keeps its regrouping private to SegwitAddress
    static byte[] convertBits(byte[] in, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxValue = (1 << toBits) - 1;
        int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream(in.length * fromBits / toBits + 1);
        for (byte b : in) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new IllegalArgumentException("value " + value + " does not fit in " + fromBits + " bits");
            }
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxValue);
            }
        }
        if (pad) {
            if (bits > 0) {
                out.write((acc << (toBits - bits)) & maxValue);
            }
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxValue) != 0) {
            throw new IllegalArgumentException("invalid padding in address data");
        }
        return out.toByteArray();
    }
}
