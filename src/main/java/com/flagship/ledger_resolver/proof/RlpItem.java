package com.flagship.ledger_resolver.proof;

import java.util.Arrays;
import java.util.List;

/**
 * A decoded RLP item: either a byte string or a list of items.
 */
public final class RlpItem {

    private final byte[] bytes;
    private final List<RlpItem> items;

    private RlpItem(byte[] bytes, List<RlpItem> items) {
        this.bytes = bytes;
        this.items = items;
    }

    public static RlpItem of(byte[] bytes) {
        return new RlpItem(bytes.clone(), null);
    }

    public static RlpItem list(List<RlpItem> items) {
        return new RlpItem(null, List.copyOf(items));
    }

    public static RlpItem list(RlpItem... items) {
        return list(Arrays.asList(items));
    }

    public boolean isList() {
        return items != null;
    }

    public byte[] bytes() {
        if (isList()) {
            throw new IllegalStateException("RLP item is a list");
        }
        return bytes.clone();
    }

    public List<RlpItem> items() {
        if (!isList()) {
            throw new IllegalStateException("RLP item is a byte string");
        }
        return items;
    }

    public int size() {
        return isList() ? items.size() : bytes.length;
    }
}
