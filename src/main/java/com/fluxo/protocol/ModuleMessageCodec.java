package com.fluxo.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/** JSON text form of {@link ModuleMessage}, with per-type field validation. */
public final class ModuleMessageCodec {

    private final ObjectMapper mapper;

    public ModuleMessageCodec() {
        this(new ObjectMapper());
    }

    public ModuleMessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(ModuleMessage message) {
        validate(message);
        try {
            return mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Cannot encode " + message, e);
        }
    }

    public ModuleMessage decode(String json) {
        if (json == null) throw new MalformedMessageException("Empty message");
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Message is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return decode(node);
    }

    public ModuleMessage decode(JsonNode node) {
        if (node == null || !node.isObject()) throw new MalformedMessageException("Message must be a JSON object");
        JsonNode type = node.get("type");
        if (type == null || !type.isTextual()) throw new MalformedMessageException("Message has no type");
        MessageType t;
        try {
            t = MessageType.fromWire(type.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage(), e);
        }
        ModuleMessage m = new ModuleMessage(t, text(node, "path"), text(node, "code"), text(node, "error"));
        validate(m);
        return m;
    }

    /** Checks that {@code m} carries the fields its type requires. */
    public static void validate(ModuleMessage m) {
        if (m.type() == null) throw new MalformedMessageException("Message has no type");
        switch (m.type()) {
            case MODULE_REQUEST:
                require(m, m.path(), "path");
                break;
            case MODULE_RESPONSE:
                require(m, m.path(), "path");
                require(m, m.code(), "code");
                break;
            case MODULE_ERROR:
                require(m, m.path(), "path");
                require(m, m.error(), "error");
                break;
            case EXECUTE:
                require(m, m.code(), "code");
                break;
            default:
                throw new MalformedMessageException("Unhandled message type " + m.type());
        }
    }

    private static void require(ModuleMessage m, String value, String field) {
        if (value == null) {
            throw new MalformedMessageException(m.type().wireName() + " message requires '" + field + "'");
        }
        if (!"code".equals(field) && value.isEmpty()) {
            throw new MalformedMessageException(m.type().wireName() + " message has an empty '" + field + "'");
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) throw new MalformedMessageException("Field '" + field + "' must be a string");
        return v.asText();
    }
}
