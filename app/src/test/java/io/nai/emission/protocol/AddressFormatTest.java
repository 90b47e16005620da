package io.nai.emission.protocol;

import org.bitcoinj.core.Bech32;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class AddressFormatTest {

    private final Address alice = Address.derive("alice");

    @Test
    void addressesRenderWithNaiPrefix() {
        String text = AddressFormat.format(alice);

        assertTrue(text.startsWith("nai1"));
        assertEquals(alice, AddressFormat.parse(text));
        assertEquals(alice, AddressFormat.parse(text.toUpperCase(Locale.ROOT)));
        assertEquals(alice, AddressFormat.parse("  " + text + " "));
    }

    @Test
    void rejectsBadChecksum() {
        String text = AddressFormat.format(alice);
        char last = text.charAt(text.length() - 1);
        String corrupted = text.substring(0, text.length() - 1) + (last == 'q' ? 'p' : 'q');

        assertThrows(IllegalArgumentException.class, () -> AddressFormat.parse(corrupted));
    }

    @Test
    void rejectsForeignPrefixVariantAndLength() {
        byte[] words = Bech32.decode(AddressFormat.format(alice)).data;

        assertThrows(IllegalArgumentException.class,
                () -> AddressFormat.parse(Bech32.encode(Bech32.Encoding.BECH32, "btc", words)));
        assertThrows(IllegalArgumentException.class,
                () -> AddressFormat.parse(Bech32.encode(Bech32.Encoding.BECH32M, "nai", words)));
        assertThrows(IllegalArgumentException.class, () -> AddressFormat.parse("nai1qqqqqq"));
        assertThrows(IllegalArgumentException.class, () -> AddressFormat.parse(" "));
    }

    @Test
    void regroupsBitsBothWays() {
        byte[] raw = {(byte) 0xff, 0x00, 0x7f};
        byte[] words = AddressFormat.convertBits(raw, 8, 5, true);

        assertEquals(5, words.length);
        for (byte w : words) {
            assertTrue(w >= 0 && w < 32);
        }
        assertArrayEquals(raw, AddressFormat.convertBits(words, 5, 8, false));
    }

    @Test
    void nodeIdsRoundTripThroughHex() {
        NodeId id = NodeId.derive("validator-1");
        assertEquals(id, NodeId.fromHex(id.hex()));
        assertEquals(40, id.hex().length());
        assertTrue(NodeId.EMPTY.isEmpty());
        assertFalse(id.isEmpty());
        assertThrows(IllegalArgumentException.class, () -> NodeId.fromHex("abcd"));
    }

    @Test
    void derivedIdsAreSha256OfTheSeed() {
        String abc = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

        assertEquals(abc.substring(0, 40), NodeId.derive("abc").hex());
        assertEquals("00" + abc, Hex.encode(Address.derive("abc").bytes()));
        assertEquals(0, Address.derive("abc").typeId());
    }
}
