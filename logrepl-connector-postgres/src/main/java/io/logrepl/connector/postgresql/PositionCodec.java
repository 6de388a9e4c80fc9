/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.logrepl.annotation.ThreadSafe;
import io.logrepl.connector.postgresql.connection.Lsn;

/**
 * Writes and reads the opaque position tokens attached to change records, e.g.
 * <pre>{"type":"CDC","lastLSN":"0/16B3748"}</pre>
 */
@ThreadSafe
public class PositionCodec {

    static final String TYPE_KEY = "type";
    static final String LAST_LSN_KEY = "lastLSN";

    private final ObjectMapper mapper;

    public PositionCodec() {
        this(new ObjectMapper());
    }

    public PositionCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @return the token of the streaming position at the given LSN
     */
    public String encode(Lsn lsn) {
        return format(Position.cdc(lsn));
    }

    public String format(Position position) {
        ObjectNode node = mapper.createObjectNode()
                .put(TYPE_KEY, position.type().name())
                .put(LAST_LSN_KEY, position.lastLsn().asString());
        return node.toString();
    }

    /**
     * Read the LSN of a streaming position token.
     *
     * @throws PositionFormatException if the token is malformed, is not a streaming position or has no valid LSN
     */
    public Lsn decode(String token) {
        Position position = parse(token);
        if (position.type() != Position.Type.CDC) {
            throw new PositionFormatException("Position '" + token + "' is not a " + Position.Type.CDC + " position");
        }
        return position.lastLsn();
    }

    /**
     * Read a position token of any type.
     *
     * @throws PositionFormatException if the token is malformed or its LSN is missing or invalid
     */
    public Position parse(String token) {
        if (token == null || token.isEmpty()) {
            throw new PositionFormatException("Position is empty");
        }
        final JsonNode node;
        try {
            node = mapper.readTree(token);
        }
        catch (IOException e) {
            throw new PositionFormatException("Position '" + token + "' is not valid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new PositionFormatException("Position '" + token + "' is not a JSON object");
        }

        final Position.Type type = readType(token, node.get(TYPE_KEY));
        final JsonNode lsnNode = node.get(LAST_LSN_KEY);
        if (lsnNode == null || !lsnNode.isTextual()) {
            throw new PositionFormatException("Position '" + token + "' has no " + LAST_LSN_KEY);
        }
        final Lsn lsn = Lsn.valueOf(lsnNode.asText());
        if (!lsn.isValid()) {
            throw new PositionFormatException("Position '" + token + "' has an invalid " + LAST_LSN_KEY);
        }
        return Position.of(type, lsn);
    }

    private static Position.Type readType(String token, JsonNode typeNode) {
        if (typeNode == null || !typeNode.isTextual()) {
            throw new PositionFormatException("Position '" + token + "' has no " + TYPE_KEY);
        }
        for (Position.Type type : Position.Type.values()) {
            if (type.name().equals(typeNode.asText())) {
                return type;
            }
        }
        throw new PositionFormatException("Position '" + token + "' has unknown type '" + typeNode.asText() + "'");
    }
}
