package com.example.clustermonitor.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;

/**
 * Encodes requests to, and decodes responses from, newline-delimited JSON frames.
 *
 * Outbound: {@code {"jsonrpc":"2.0","method":...,"params":{...},"id":N}\n}
 * Inbound: {@code {"id":N,"result":...}} or {@code {"id":N,"error":{"code":...,"message":...}}}
 */
public class McpMessageCodec {

    private final ObjectMapper objectMapper;
    private final ObjectWriter writer;
    private final ObjectReader reader;

    public McpMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.writer = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Encode one request as a single newline-terminated frame.
     *
     * @throws IllegalArgumentException if a parameter value cannot be serialized
     */
    public String encode(String method, Map<String, ?> params, long id) {
        return encode(McpRequest.of(method, params, id));
    }

    public String encode(McpRequest request) {
        try {
            return writer.writeValueAsString(request) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Cannot serialize parameters of " + request.getMethod() + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode one response frame (with or without its trailing newline).
     *
     * @throws MalformedFrameException if the frame is empty, not JSON, or not a valid envelope
     */
    public McpResponse decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new MalformedFrameException(MalformedFrameException.Reason.EMPTY, "Empty response frame");
        }

        JsonNode root;
        try {
            root = reader.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException(MalformedFrameException.Reason.UNPARSEABLE,
                    "Invalid JSON response from server: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedFrameException(MalformedFrameException.Reason.UNPARSEABLE,
                    "Response frame is not a JSON object: " + abbreviate(frame));
        }

        boolean hasResult = root.has("result");
        boolean hasError = root.has("error");
        if (!hasResult && !hasError) {
            throw new MalformedFrameException(MalformedFrameException.Reason.MISSING_RESULT_AND_ERROR,
                    "Response has neither result nor error: " + abbreviate(frame));
        }
        if (hasResult && hasError) {
            throw new MalformedFrameException(MalformedFrameException.Reason.BOTH_RESULT_AND_ERROR,
                    "Response has both result and error: " + abbreviate(frame));
        }

        Long id = readId(root.get("id"));
        if (hasResult) {
            return McpResponse.success(id, root.get("result"));
        }
        return McpResponse.error(id, readError(root.get("error"), frame));
    }

    private McpError readError(JsonNode node, String frame) {
        if (node == null || !node.isObject()) {
            throw new MalformedFrameException(MalformedFrameException.Reason.UNPARSEABLE,
                    "Error member is not an object: " + abbreviate(frame));
        }
        JsonNode data = node.get("data");
        return McpError.builder()
                .code(node.path("code").asInt(0))
                .message(node.path("message").asText(""))
                .data(data != null && !data.isNull() ? objectMapper.convertValue(data, Object.class) : null)
                .build();
    }

    private static Long readId(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static String abbreviate(String frame) {
        String trimmed = frame.strip();
        return trimmed.length() <= 200 ? trimmed : trimmed.substring(0, 200) + "...";
    }
}
