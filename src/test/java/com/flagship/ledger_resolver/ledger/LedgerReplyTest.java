package com.flagship.ledger_resolver.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerReplyTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("GET_NYM requests carry a null submitter and the bare nym")
    void getNymRequest() throws Exception {
        LedgerRequestBuilder builder = new LedgerRequestBuilder(mapper);

        JsonNode request = mapper.readTree(builder.buildGetNymRequest(null, "Th7MpTaRZVRYnPiabds81Y"));

        assertTrue(request.get("submitterDID").isNull());
        assertEquals("105", request.get("operation").get("type").asText());
        assertEquals("Th7MpTaRZVRYnPiabds81Y", request.get("operation").get("dest").asText());
        assertThrows(IllegalArgumentException.class, () -> builder.buildGetNymRequest(null, " "));
    }

    @Test
    @DisplayName("String-encoded data is parsed into a JSON object")
    void stringData() throws Exception {
        LedgerReply reply = LedgerReply.parse(
                "{\"op\":\"REPLY\",\"result\":{\"type\":\"105\",\"data\":\"{\\\"verkey\\\":\\\"~abc\\\"}\"}}", mapper);

        assertEquals("105", reply.type());
        assertEquals("~abc", reply.data().orElseThrow().get("verkey").asText());
        assertFalse(reply.isRejected());
    }

    @Test
    @DisplayName("Null data, blank data and rejections all mean no record")
    void noRecord() throws Exception {
        assertTrue(LedgerReply.parse("{\"op\":\"REPLY\",\"result\":{\"data\":null}}", mapper).data().isEmpty());
        assertTrue(LedgerReply.parse("{\"op\":\"REPLY\",\"result\":{\"data\":\"\"}}", mapper).data().isEmpty());

        LedgerReply rejected = LedgerReply.parse("{\"op\":\"REJECT\",\"reason\":\"bad\"}", mapper);
        assertTrue(rejected.isRejected());
        assertEquals("bad", rejected.reason().orElseThrow());
        assertTrue(rejected.data().isEmpty());
    }

    @Test
    @DisplayName("Unwrapped replies expose the envelope as their result")
    void unwrappedReply() throws Exception {
        LedgerReply reply = LedgerReply.parse("{\"type\":\"105\",\"data\":{\"verkey\":\"k\"}}", mapper);

        assertEquals("105", reply.type());
        assertEquals("k", reply.data().orElseThrow().get("verkey").asText());
        assertThrows(IllegalArgumentException.class, () -> LedgerReply.parse("[1,2]", mapper));
    }
}
