/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import io.logrepl.annotation.Immutable;

/**
 * A message whose content is not needed for change capture, e.g. a truncate, type, origin or logical decoding
 * message, or one with an unknown tag.
 */
@Immutable
public final class OtherMessage implements ReplicationMessage {

    private final Type type;
    private final char tag;

    public OtherMessage(char tag) {
        this.type = Type.forTag(tag);
        this.tag = tag;
    }

    @Override
    public Type type() {
        return type;
    }

    public char tag() {
        return tag;
    }

    @Override
    public String toString() {
        return "OtherMessage [type=" + type + ", tag=" + tag + "]";
    }
}
