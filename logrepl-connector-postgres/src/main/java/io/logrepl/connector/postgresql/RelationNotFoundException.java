/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import io.logrepl.LogreplException;

/**
 * Raised when a data message references a relation that was not announced by a relation message earlier in the
 * same session. This indicates a protocol ordering violation upstream and is fatal to the session.
 */
public class RelationNotFoundException extends LogreplException {

    private static final long serialVersionUID = 4389217590372281337L;

    private final int relationId;

    public RelationNotFoundException(int relationId) {
        super("Relation " + relationId + " not found");
        this.relationId = relationId;
    }

    public RelationNotFoundException(String message, RelationNotFoundException cause) {
        super(message, cause);
        this.relationId = cause.relationId();
    }

    public int relationId() {
        return relationId;
    }
}
