package com.flagship.ledger_resolver.proof;

import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Merkle-Patricia proof check.
 *
 * The proof is an RLP list of trie nodes. Nodes are addressed by the SHA3-256
 * of their RLP encoding; nodes shorter than 32 bytes are embedded in their
 * parent. Branch nodes have 17 items (16 children and a value), leaf and
 * extension nodes have 2 (hex-prefix path, value or child). Leaf values hold
 * {@code rlp([value])}.
 */
@Slf4j
public class PatriciaTrieProofValidator implements TrieProofValidator {

    private static final int HASH_LENGTH = 32;
    private static final int BRANCH_SIZE = 17;

    @Override
    public boolean verify(byte[] rootHash, byte[] key, byte[] expectedValue, byte[] proofNodes) {
        if (rootHash == null || rootHash.length != HASH_LENGTH || key == null
                || expectedValue == null || proofNodes == null) {
            return false;
        }
        try {
            RlpItem proof = Rlp.decode(proofNodes);
            if (!proof.isList()) {
                return false;
            }
            Map<ByteBuffer, RlpItem> nodesByHash = new HashMap<>();
            for (RlpItem node : proof.items()) {
                nodesByHash.put(ByteBuffer.wrap(sha3(Rlp.encode(node))), node);
            }
            return walk(nodesByHash.get(ByteBuffer.wrap(rootHash)), toNibbles(key), nodesByHash, expectedValue);
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.debug("Malformed trie proof: {}", e.getMessage());
            return false;
        }
    }

    private boolean walk(RlpItem node, int[] nibbles, Map<ByteBuffer, RlpItem> nodesByHash, byte[] expectedValue) {
        int position = 0;
        while (node != null && node.isList()) {
            if (node.size() == BRANCH_SIZE) {
                if (position == nibbles.length) {
                    return valueMatches(node.items().get(16), expectedValue);
                }
                node = resolve(node.items().get(nibbles[position++]), nodesByHash);
            } else if (node.size() == 2) {
                byte[] encodedPath = node.items().get(0).bytes();
                if (encodedPath.length == 0) {
                    return false;
                }
                boolean leaf = (encodedPath[0] & 0x20) != 0;
                int[] path = decodeHexPrefix(encodedPath);
                int[] remaining = Arrays.copyOfRange(nibbles, position, nibbles.length);
                if (leaf) {
                    return Arrays.equals(remaining, path) && valueMatches(node.items().get(1), expectedValue);
                }
                if (remaining.length < path.length
                        || !Arrays.equals(Arrays.copyOf(remaining, path.length), path)) {
                    return false;
                }
                position += path.length;
                node = resolve(node.items().get(1), nodesByHash);
            } else {
                return false;
            }
        }
        return false;
    }

    private RlpItem resolve(RlpItem reference, Map<ByteBuffer, RlpItem> nodesByHash) {
        if (reference.isList()) {
            return reference;
        }
        byte[] hash = reference.bytes();
        if (hash.length != HASH_LENGTH) {
            return null;
        }
        return nodesByHash.get(ByteBuffer.wrap(hash));
    }

    private boolean valueMatches(RlpItem stored, byte[] expectedValue) {
        if (stored.isList() || stored.size() == 0) {
            return false;
        }
        RlpItem wrapped = Rlp.decode(stored.bytes());
        if (!wrapped.isList() || wrapped.size() != 1 || wrapped.items().get(0).isList()) {
            return false;
        }
        return MessageDigest.isEqual(wrapped.items().get(0).bytes(), expectedValue);
    }

    static int[] toNibbles(byte[] key) {
        int[] nibbles = new int[key.length * 2];
        for (int i = 0; i < key.length; i++) {
            nibbles[2 * i] = (key[i] >> 4) & 0x0F;
            nibbles[2 * i + 1] = key[i] & 0x0F;
        }
        return nibbles;
    }

    /**
     * Hex-prefix decoding: the first nibble carries the leaf flag (2) and the odd-length flag (1).
     */
    static int[] decodeHexPrefix(byte[] encoded) {
        int[] nibbles = toNibbles(encoded);
        boolean odd = (nibbles[0] & 1) != 0;
        return Arrays.copyOfRange(nibbles, odd ? 1 : 2, nibbles.length);
    }

    static byte[] sha3(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA3-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA3-256 not available", e);
        }
    }
}
