package com.flagship.ledger_resolver.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * A parsed reply envelope:
 * {@code {op: REPLY|REQNACK|REJECT, result?: {data, seqNo, txnTime, state_proof?, ...}, reason?}}.
 *
 * REQNACK, REJECT and a missing {@code result.data} all mean the ledger has no
 * record; none of them is an error for resolution.
 */
public final class LedgerReply {

    public static final String OP_REQNACK = "REQNACK";
    public static final String OP_REJECT = "REJECT";

    private final JsonNode envelope;
    private final ObjectMapper objectMapper;

    private LedgerReply(JsonNode envelope, ObjectMapper objectMapper) {
        this.envelope = envelope;
        this.objectMapper = objectMapper;
    }

    public static LedgerReply parse(String raw, ObjectMapper objectMapper) throws JsonProcessingException {
        JsonNode envelope = objectMapper.readTree(raw);
        if (envelope == null || !envelope.isObject()) {
            throw new IllegalArgumentException("Ledger reply is not a JSON object");
        }
        return new LedgerReply(envelope, objectMapper);
    }

    public static LedgerReply of(JsonNode envelope, ObjectMapper objectMapper) {
        return new LedgerReply(envelope, objectMapper);
    }

    public Optional<String> op() {
        JsonNode op = envelope.get("op");
        return op != null && op.isTextual() ? Optional.of(op.asText()) : Optional.empty();
    }

    public boolean isRejected() {
        return op().map(op -> OP_REQNACK.equals(op) || OP_REJECT.equals(op)).orElse(false);
    }

    public Optional<String> reason() {
        JsonNode reason = envelope.get("reason");
        return reason != null && !reason.isNull() ? Optional.of(reason.asText()) : Optional.empty();
    }

    /**
     * The {@code result} object, or the envelope itself for replies that are not wrapped.
     */
    public JsonNode result() {
        JsonNode result = envelope.get("result");
        return result != null && result.isObject() ? result : envelope;
    }

    public String type() {
        return result().path("type").asText(null);
    }

    /**
     * The record carried by the reply; {@code data} may arrive as a JSON string or inline.
     */
    public Optional<JsonNode> data() throws JsonProcessingException {
        if (isRejected()) {
            return Optional.empty();
        }
        JsonNode data = result().get("data");
        if (data == null || data.isNull()) {
            return Optional.empty();
        }
        if (data.isTextual()) {
            if (data.asText().isBlank()) {
                return Optional.empty();
            }
            JsonNode parsed = objectMapper.readTree(data.asText());
            return parsed == null || parsed.isNull() ? Optional.empty() : Optional.of(parsed);
        }
        return Optional.of(data);
    }
}
