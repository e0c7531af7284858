package com.suipatreon.indexer.sui;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sui fullnode JSON-RPC client
 * Pages through Move events with {@code suix_queryEvents}
 */
@Slf4j
public class SuiRpcClient implements EventSource {

    private static final String QUERY_EVENTS = "suix_queryEvents";

    private final String rpcUrl;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestIds = new AtomicLong();

    public SuiRpcClient(String rpcUrl, RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.rpcUrl = rpcUrl;
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    @Override
    public EventPage queryEvents(String moveEventType, EventId cursor, int limit) {
        Map<String, Object> filter = Map.of("MoveEventType", moveEventType);
        Map<String, Object> cursorParam = null;
        if (cursor != null) {
            cursorParam = new LinkedHashMap<>();
            cursorParam.put("txDigest", cursor.getTxDigest());
            cursorParam.put("eventSeq", cursor.getEventSeq().toString());
        }
        // descending_order = false
        JsonNode result = call(QUERY_EVENTS, Arrays.asList(filter, cursorParam, limit, false));
        return parsePage(result);
    }

    /**
     * Executes one JSON-RPC call and returns its {@code result} node
     */
    JsonNode call(String method, List<Object> params) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("jsonrpc", "2.0");
        requestBody.put("id", requestIds.incrementAndGet());
        requestBody.put("method", method);
        requestBody.put("params", params);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(requestBody, headers);

        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(rpcUrl, HttpMethod.POST, request, String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new SuiRpcException(null, "HTTP request failed: " + response.getStatusCode());
            }
            body = response.getBody();
        } catch (RestClientException e) {
            throw new SuiRpcException("Sui RPC request failed: " + method, e);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (Exception e) {
            throw new SuiRpcException("Malformed Sui RPC response for " + method, e);
        }

        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            int code = error.path("code").asInt();
            String message = error.path("message").asText("unknown error");
            log.debug("Sui RPC error: method={}, code={}, message={}", method, code, message);
            throw new SuiRpcException(code, message);
        }

        JsonNode result = root.get("result");
        if (result == null || result.isNull()) {
            throw new SuiRpcException(null, "Sui RPC response has no result for " + method);
        }
        return result;
    }

    private EventPage parsePage(JsonNode result) {
        List<SuiEvent> events = new ArrayList<>();
        for (JsonNode node : result.path("data")) {
            events.add(parseEvent(node));
        }
        JsonNode next = result.get("nextCursor");
        EventId nextCursor = next == null || next.isNull() ? null : parseEventId(next);
        return new EventPage(events, nextCursor, result.path("hasNextPage").asBoolean(false));
    }

    private SuiEvent parseEvent(JsonNode node) {
        JsonNode timestamp = node.get("timestampMs");
        return SuiEvent.builder()
                .id(parseEventId(node.get("id")))
                .type(node.path("type").asText(null))
                .sender(node.path("sender").asText(null))
                .parsedJson(node.path("parsedJson").isMissingNode()
                        ? objectMapper.createObjectNode()
                        : node.get("parsedJson"))
                .timestampMs(timestamp == null || timestamp.isNull() ? null : Long.parseLong(timestamp.asText()))
                .build();
    }

    private EventId parseEventId(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new SuiRpcException(null, "Event without id");
        }
        return new EventId(node.path("txDigest").asText(), new BigInteger(node.path("eventSeq").asText()));
    }
}
