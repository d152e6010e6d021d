package com.agentrelay.gateway.protocol;

import com.agentrelay.gateway.buffer.BufferedRecord;
import com.agentrelay.gateway.protocol.RelayProtocol.*;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;

/**
 * JSON encoding and decoding of relay frames.
 * <p>
 * Decoders throw {@link JsonProcessingException} for text that is not a JSON
 * object; callers drop such frames and keep the connection open.
 */
public class RelayCodec {

    private final ObjectMapper objectMapper;

    public RelayCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    // --- Decoding ---

    /**
     * Parse a frame, requiring a JSON object.
     */
    public JsonNode readFrame(String text) throws JsonProcessingException {
        if (text == null || text.isBlank()) {
            throw JsonMappingException.from((JsonParser) null, "empty frame");
        }
        JsonNode node = objectMapper.readTree(text);
        if (node == null || !node.isObject()) {
            throw JsonMappingException.from((JsonParser) null, "frame is not a JSON object");
        }
        return node;
    }

    /**
     * The frame's {@code type} field, or {@code null} when absent or not textual.
     */
    public static String typeOf(JsonNode frame) {
        JsonNode type = frame.get("type");
        return type != null && type.isTextual() ? type.asText() : null;
    }

    /**
     * Kind recorded in the buffer for an upstream frame.
     */
    public static String kindOf(JsonNode frame) {
        String type = typeOf(frame);
        return type != null && !type.isEmpty() ? type : RelayProtocol.DEFAULT_KIND;
    }

    public ReplayRequest readReplayRequest(JsonNode frame) throws JsonProcessingException {
        return objectMapper.treeToValue(frame, ReplayRequest.class);
    }

    public RelayFrame readRelayFrame(JsonNode frame) throws JsonProcessingException {
        return objectMapper.treeToValue(frame, RelayFrame.class);
    }

    public ReplayResponse readReplayResponse(JsonNode frame) throws JsonProcessingException {
        return objectMapper.treeToValue(frame, ReplayResponse.class);
    }

    // --- Encoding ---

    public String encodeRecord(BufferedRecord record) {
        return write(RelayFrame.of(record));
    }

    public String encodeReplay(long currentId, List<BufferedRecord> records) {
        return write(ReplayResponse.of(currentId, records));
    }

    public String encodeReplayRequest(ReplayRequest request) {
        return write(request);
    }

    public String encodePong() {
        return write(Pong.create());
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }
}
