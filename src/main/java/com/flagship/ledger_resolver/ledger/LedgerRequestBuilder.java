package com.flagship.ledger_resolver.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Builds read requests in the ledger client's wire format.
 */
@Component
public class LedgerRequestBuilder {

    private final ObjectMapper objectMapper;

    public LedgerRequestBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * {@code {"submitterDID": <did|null>, "operation": {"type": "105", "dest": <nym>}}}
     *
     * @param submitterDid submitter, may be null
     * @param nym the bare identifier, without any {@code did:} prefix
     */
    public String buildGetNymRequest(String submitterDid, String nym) {
        if (nym == null || nym.isBlank()) {
            throw new IllegalArgumentException("Nym cannot be null or blank");
        }
        ObjectNode request = objectMapper.createObjectNode();
        if (submitterDid == null) {
            request.putNull("submitterDID");
        } else {
            request.put("submitterDID", submitterDid);
        }
        ObjectNode operation = request.putObject("operation");
        operation.put("type", TransactionTypes.GET_NYM);
        operation.put("dest", nym);
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize GET_NYM request", e);
        }
    }
}
