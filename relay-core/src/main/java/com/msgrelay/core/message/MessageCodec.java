package com.msgrelay.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * UTF-8 JSON codec for the socket hop between the HTTP front and the socket listener.
 * <p>
 * The sender encodes a {@link Message}; the receiver decodes into a plain document map so
 * that any JSON object is accepted and persisted as-is.
 */
public final class MessageCodec {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private MessageCodec() {
    }

    /**
     * Serializes a message to its wire form, {@code {"username": ..., "message": ...}}.
     *
     * @param message the message to send
     * @return UTF-8 encoded JSON
     * @throws JsonProcessingException if Jackson cannot serialize the message
     */
    public static byte[] encode(Message message) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsBytes(message);
    }

    /**
     * Parses one received payload into a mutable document.
     *
     * @param payload the raw bytes of a single receive
     * @return the JSON object as an insertion-ordered map
     * @throws MessageDecodingException if the payload is not valid JSON or not a JSON object
     */
    public static Map<String, Object> decode(byte[] payload) throws MessageDecodingException {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(payload);
        } catch (IOException e) {
            throw new MessageDecodingException("Payload is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            String kind = root == null || root.isMissingNode() ? "empty" : root.getNodeType().name().toLowerCase();
            throw new MessageDecodingException("Expected a JSON object but got " + kind + " payload");
        }
        return OBJECT_MAPPER.convertValue(root, DOCUMENT_TYPE);
    }
}
