package com.flagship.ledger_resolver.resolution;

import com.flagship.ledger_resolver.util.Base58;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * A DID is self-certified when it is derived from its own verification key:
 * either the key is in abbreviated form ({@code ~} followed by the key tail),
 * or the DID is the base58 of the key's first 16 bytes.
 */
public final class SelfCertification {

    private static final Pattern ABBREVIATED_VERKEY = Pattern.compile("^~[1-9A-HJ-NP-Za-km-z]{21,22}$");
    private static final int DID_LENGTH_BYTES = 16;

    private SelfCertification() {
    }

    public static boolean isSelfCertified(String did, String verkey) {
        if (did == null || verkey == null || verkey.isEmpty()) {
            return false;
        }
        if (ABBREVIATED_VERKEY.matcher(verkey).matches()) {
            return true;
        }
        byte[] key;
        try {
            key = Base58.decode(verkey);
        } catch (IllegalArgumentException e) {
            return false;
        }
        byte[] head = Arrays.copyOf(key, Math.min(DID_LENGTH_BYTES, key.length));
        return did.equals(Base58.encode(head));
    }
}
