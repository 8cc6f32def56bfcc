package com.flagship.ledger_resolver.proof;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Recursive Length Prefix encoding, the serialization of state trie nodes.
 */
public final class Rlp {

    private static final int SHORT_STRING = 0x80;
    private static final int LONG_STRING = 0xb7;
    private static final int SHORT_LIST = 0xc0;
    private static final int LONG_LIST = 0xf7;

    private Rlp() {
    }

    /**
     * Decodes exactly one item spanning the whole input.
     *
     * @throws IllegalArgumentException on truncated, trailing or non-canonical input
     */
    public static RlpItem decode(byte[] input) {
        int[] end = new int[1];
        RlpItem item = decode(input, 0, input.length, end);
        if (end[0] != input.length) {
            throw new IllegalArgumentException("Trailing bytes after RLP item");
        }
        return item;
    }

    public static byte[] encode(RlpItem item) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        encode(item, out);
        return out.toByteArray();
    }

    private static void encode(RlpItem item, ByteArrayOutputStream out) {
        if (!item.isList()) {
            byte[] bytes = item.bytes();
            if (bytes.length == 1 && (bytes[0] & 0xFF) < SHORT_STRING) {
                out.write(bytes[0]);
                return;
            }
            writeHeader(bytes.length, SHORT_STRING, LONG_STRING, out);
            out.writeBytes(bytes);
            return;
        }
        ByteArrayOutputStream payload = new ByteArrayOutputStream();
        for (RlpItem child : item.items()) {
            encode(child, payload);
        }
        writeHeader(payload.size(), SHORT_LIST, LONG_LIST, out);
        out.writeBytes(payload.toByteArray());
    }

    private static void writeHeader(int length, int shortOffset, int longOffset, ByteArrayOutputStream out) {
        if (length < 56) {
            out.write(shortOffset + length);
            return;
        }
        byte[] lengthBytes = toMinimalBytes(length);
        out.write(longOffset + lengthBytes.length);
        out.writeBytes(lengthBytes);
    }

    private static byte[] toMinimalBytes(int value) {
        int size = 0;
        for (int v = value; v != 0; v >>>= 8) {
            size++;
        }
        byte[] bytes = new byte[size];
        for (int i = size - 1, v = value; i >= 0; i--, v >>>= 8) {
            bytes[i] = (byte) v;
        }
        return bytes;
    }

    private static RlpItem decode(byte[] input, int offset, int limit, int[] end) {
        if (offset >= limit) {
            throw new IllegalArgumentException("Truncated RLP input");
        }
        int prefix = input[offset] & 0xFF;

        if (prefix < SHORT_STRING) {
            end[0] = offset + 1;
            return RlpItem.of(new byte[]{(byte) prefix});
        }
        if (prefix <= LONG_STRING) {
            int length = prefix - SHORT_STRING;
            int start = offset + 1;
            checkBounds(start, length, limit);
            if (length == 1 && (input[start] & 0xFF) < SHORT_STRING) {
                throw new IllegalArgumentException("Non-canonical RLP single byte");
            }
            end[0] = start + length;
            return RlpItem.of(Arrays.copyOfRange(input, start, start + length));
        }
        if (prefix < SHORT_LIST) {
            int lengthOfLength = prefix - LONG_STRING;
            int length = readLength(input, offset + 1, lengthOfLength, limit);
            int start = offset + 1 + lengthOfLength;
            checkBounds(start, length, limit);
            end[0] = start + length;
            return RlpItem.of(Arrays.copyOfRange(input, start, start + length));
        }

        int start;
        int length;
        if (prefix <= LONG_LIST) {
            length = prefix - SHORT_LIST;
            start = offset + 1;
        } else {
            int lengthOfLength = prefix - LONG_LIST;
            length = readLength(input, offset + 1, lengthOfLength, limit);
            start = offset + 1 + lengthOfLength;
        }
        checkBounds(start, length, limit);

        List<RlpItem> items = new ArrayList<>();
        int position = start;
        int listEnd = start + length;
        while (position < listEnd) {
            items.add(decode(input, position, listEnd, end));
            position = end[0];
        }
        end[0] = listEnd;
        return RlpItem.list(items);
    }

    private static int readLength(byte[] input, int offset, int lengthOfLength, int limit) {
        if (lengthOfLength > 4) {
            throw new IllegalArgumentException("RLP length too large");
        }
        checkBounds(offset, lengthOfLength, limit);
        if (input[offset] == 0) {
            throw new IllegalArgumentException("Non-canonical RLP length");
        }
        int length = 0;
        for (int i = 0; i < lengthOfLength; i++) {
            length = (length << 8) | (input[offset + i] & 0xFF);
        }
        if (length < 56) {
            throw new IllegalArgumentException("Non-canonical RLP length");
        }
        return length;
    }

    private static void checkBounds(int start, int length, int limit) {
        if (length < 0 || start + length > limit || start + length < start) {
            throw new IllegalArgumentException("Truncated RLP input");
        }
    }
}
