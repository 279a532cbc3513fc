package com.chathub.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

/**
 * JSON text frame ⇄ envelope conversion.
 */
public class MessageCodec {

    static final String INVALID_JSON = "Bericht moet geldig JSON zijn.";
    public static final String UNKNOWN_TYPE = "Onbekend of onvolledig berichttype.";

    private final ObjectMapper objectMapper;
    private final ObjectWriter outgoingWriter;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.outgoingWriter = objectMapper.writerFor(Outgoing.class);
    }

    /**
     * Parse one inbound text frame.
     *
     * @throws ChatException.ProtocolError for invalid JSON, a non-object frame, an
     *                                     unknown {@code type}, or a missing/mistyped field
     */
    public Incoming decode(String frame) {
        JsonNode node;
        try {
            node = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new ChatException.ProtocolError(INVALID_JSON);
        }
        if (node == null || !node.isObject()) {
            throw new ChatException.ProtocolError(INVALID_JSON);
        }

        String type = node.path("type").isTextual() ? node.get("type").asText() : null;
        if (type == null) {
            throw new ChatException.ProtocolError(UNKNOWN_TYPE);
        }

        return switch (type) {
            case "chat" -> new Incoming.Chat(requiredText(node, "text"));
            case "setName" -> new Incoming.SetName(requiredText(node, "name"));
            case "status" -> new Incoming.Status();
            case "listUsers" -> new Incoming.ListUsers();
            case "ping" -> new Incoming.Ping(optionalText(node, "token"));
            case "ai" -> new Incoming.Ai(requiredText(node, "prompt"));
            default -> throw new ChatException.ProtocolError(UNKNOWN_TYPE);
        };
    }

    /**
     * Serialize an outbound envelope, including its {@code type} discriminator.
     */
    public String encode(Outgoing payload) throws JsonProcessingException {
        return outgoingWriter.writeValueAsString(payload);
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ChatException.ProtocolError(UNKNOWN_TYPE);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new ChatException.ProtocolError(UNKNOWN_TYPE);
        }
        return value.asText();
    }
}
