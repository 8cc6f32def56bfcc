package com.flagship.ledger_resolver.proof;

/**
 * Checks that a value is committed under a key in a state trie with a given root.
 */
public interface TrieProofValidator {

    /**
     * @param rootHash the root the reply claims was current
     * @param key the state key
     * @param expectedValue the value the reply claims is stored under the key
     * @param proofNodes the serialized proof nodes carried by the reply
     * @return true only if the proof links the value to the root; false on any malformed input
     */
    boolean verify(byte[] rootHash, byte[] key, byte[] expectedValue, byte[] proofNodes);
}
