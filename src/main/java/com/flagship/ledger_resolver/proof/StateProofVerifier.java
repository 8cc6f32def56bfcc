package com.flagship.ledger_resolver.proof;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.ledger_resolver.ledger.LedgerReply;
import com.flagship.ledger_resolver.ledger.TransactionTypes;
import com.flagship.ledger_resolver.util.Base58;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Optional;

/**
 * Decides whether a read reply is backed by a valid state proof.
 *
 * The reply's {@code result.state_proof} carries a base58 root hash and base64
 * proof nodes. The state key and value are rebuilt from the reply itself and
 * checked against the proof with a {@link TrieProofValidator}.
 *
 * Never throws: a malformed reply, a missing proof or an unsupported
 * transaction type all verify as false.
 */
@Slf4j
public class StateProofVerifier {

    private static final String STATE_PROOF = "state_proof";
    private static final String ROOT_HASH = "root_hash";
    private static final String PROOF_NODES = "proof_nodes";

    private final TrieProofValidator trieProofValidator;
    private final ObjectMapper objectMapper;

    public StateProofVerifier(TrieProofValidator trieProofValidator, ObjectMapper objectMapper) {
        this.trieProofValidator = trieProofValidator;
        this.objectMapper = objectMapper;
    }

    public boolean verifyReply(LedgerReply reply) {
        if (reply == null || reply.isRejected()) {
            return false;
        }
        try {
            JsonNode result = reply.result();
            JsonNode stateProof = result.get(STATE_PROOF);
            if (stateProof == null || !stateProof.isObject()) {
                log.debug("Reply of type {} carries no state proof", reply.type());
                return false;
            }
            String rootHash = stateProof.path(ROOT_HASH).asText("");
            String proofNodes = stateProof.path(PROOF_NODES).asText("");
            if (rootHash.isEmpty() || proofNodes.isEmpty()) {
                return false;
            }

            Optional<StateEntry> entry = stateEntry(reply);
            if (entry.isEmpty()) {
                return false;
            }
            return trieProofValidator.verify(
                    Base58.decode(rootHash),
                    entry.get().key(),
                    entry.get().value(),
                    Base64.getDecoder().decode(proofNodes));
        } catch (JsonProcessingException | RuntimeException e) {
            log.debug("State proof check failed for reply of type {}: {}", reply.type(), e.getMessage());
            return false;
        }
    }

    /**
     * Builds the state key and expected state value for the reply, if its type is supported.
     */
    Optional<StateEntry> stateEntry(LedgerReply reply) throws JsonProcessingException {
        String type = reply.type();
        if (type == null) {
            return Optional.empty();
        }
        JsonNode result = reply.result();
        Optional<JsonNode> data = reply.data();
        if (data.isEmpty()) {
            return Optional.empty();
        }

        switch (type) {
            case TransactionTypes.GET_NYM:
                return nymEntry(result, data.get());
            case TransactionTypes.GET_SCHEMA:
                return schemaEntry(result, data.get());
            case TransactionTypes.GET_CLAIM_DEF:
                return claimDefEntry(result, data.get());
            case TransactionTypes.GET_REVOC_REG_DEF:
                return revocRegDefEntry(result, data.get());
            default:
                log.debug("No state proof support for transaction type {}", type);
                return Optional.empty();
        }
    }

    private Optional<StateEntry> nymEntry(JsonNode result, JsonNode data) throws JsonProcessingException {
        String dest = textOrNull(data, "dest");
        if (dest == null) {
            dest = textOrNull(result, "dest");
        }
        if (dest == null || !data.isObject()) {
            return Optional.empty();
        }
        ObjectNode value = ((ObjectNode) data).deepCopy();
        value.remove("dest");
        return Optional.of(new StateEntry(sha256(dest), utf8(objectMapper.writeValueAsString(value))));
    }

    private Optional<StateEntry> schemaEntry(JsonNode result, JsonNode data) throws JsonProcessingException {
        String dest = textOrNull(result, "dest");
        String name = textOrNull(data, "name");
        String version = textOrNull(data, "version");
        JsonNode attrNames = data.get("attr_names");
        if (dest == null || name == null || version == null || attrNames == null || attrNames.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode value = objectMapper.createObjectNode();
        value.set("attr_names", attrNames);
        String key = String.join(":", dest, TransactionTypes.MARKER_SCHEMA, name, version);
        return Optional.of(new StateEntry(utf8(key), utf8(encodeStateValue(value, result))));
    }

    private Optional<StateEntry> claimDefEntry(JsonNode result, JsonNode data) throws JsonProcessingException {
        JsonNode ref = result.get("ref");
        String origin = textOrNull(result, "origin");
        if (ref == null || ref.isNull() || origin == null) {
            return Optional.empty();
        }
        String signatureType = result.path("signature_type").asText("CL");
        String tag = result.path("tag").asText("tag");
        String key = String.join(":", origin, TransactionTypes.MARKER_CLAIM_DEF, signatureType, ref.asText(), tag);
        return Optional.of(new StateEntry(utf8(key), utf8(encodeStateValue(data, result))));
    }

    private Optional<StateEntry> revocRegDefEntry(JsonNode result, JsonNode data) throws JsonProcessingException {
        String id = textOrNull(result, "id");
        if (id == null) {
            return Optional.empty();
        }
        return Optional.of(new StateEntry(utf8(id), utf8(encodeStateValue(data, result))));
    }

    /**
     * {@code {"lsn": seqNo, "lut": txnTime, "val": value}} in compact JSON.
     */
    String encodeStateValue(JsonNode value, JsonNode result) throws JsonProcessingException {
        ObjectNode encoded = objectMapper.createObjectNode();
        encoded.set("lsn", result.get("seqNo") == null ? objectMapper.nullNode() : result.get("seqNo"));
        encoded.set("lut", result.get("txnTime") == null ? objectMapper.nullNode() : result.get("txnTime"));
        encoded.set("val", value);
        return objectMapper.writeValueAsString(encoded);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static byte[] utf8(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(utf8(value));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    record StateEntry(byte[] key, byte[] value) {
    }
}
