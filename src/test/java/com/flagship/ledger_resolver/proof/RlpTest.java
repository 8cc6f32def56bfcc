package com.flagship.ledger_resolver.proof;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static org.junit.jupiter.api.Assertions.*;

class RlpTest {

    private static final HexFormat HEX = HexFormat.of();

    @Test
    @DisplayName("Known encodings of strings and lists")
    void knownEncodings() {
        assertEquals("83646f67", HEX.formatHex(Rlp.encode(RlpItem.of("dog".getBytes(StandardCharsets.US_ASCII)))));
        assertEquals("80", HEX.formatHex(Rlp.encode(RlpItem.of(new byte[0]))));
        assertEquals("0f", HEX.formatHex(Rlp.encode(RlpItem.of(new byte[]{0x0f}))));
        assertEquals("c0", HEX.formatHex(Rlp.encode(RlpItem.list())));
        assertEquals("c88363617483646f67", HEX.formatHex(Rlp.encode(RlpItem.list(
                RlpItem.of("cat".getBytes(StandardCharsets.US_ASCII)),
                RlpItem.of("dog".getBytes(StandardCharsets.US_ASCII))))));
    }

    @Test
    @DisplayName("Long strings use a length-of-length header")
    void longString() {
        byte[] value = new byte[60];
        byte[] encoded = Rlp.encode(RlpItem.of(value));

        assertEquals((byte) 0xb8, encoded[0]);
        assertEquals(60, encoded[1]);
        assertEquals(62, encoded.length);
        assertArrayEquals(value, Rlp.decode(encoded).bytes());
    }

    @Test
    @DisplayName("Nested lists decode back to the same structure")
    void nestedList() {
        byte[] encoded = HEX.parseHex("c7c0c1c0c3c0c1c0");
        RlpItem item = Rlp.decode(encoded);

        assertTrue(item.isList());
        assertEquals(3, item.size());
        assertArrayEquals(encoded, Rlp.encode(item));
    }

    @Test
    @DisplayName("Truncated, trailing and non-canonical input is rejected")
    void malformedInput() {
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(HEX.parseHex("83646f")));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(HEX.parseHex("83646f6700")));
        // single byte below 0x80 must not carry a header
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(HEX.parseHex("810f")));
        assertThrows(IllegalArgumentException.class, () -> Rlp.decode(new byte[0]));
    }
}
