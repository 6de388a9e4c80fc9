/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import io.logrepl.annotation.Immutable;
import io.logrepl.connector.postgresql.PostgresConnectorConfig;

/**
 * The content of a publication: the tables it publishes and the parameters of its {@code WITH} clause.
 */
@Immutable
public final class PublicationOptions {

    private final List<String> tables;
    private final List<String> params;

    private PublicationOptions(List<String> tables, List<String> params) {
        this.tables = Collections.unmodifiableList(new ArrayList<>(tables));
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static PublicationOptions of(List<String> tables, List<String> params) {
        return new PublicationOptions(tables, params);
    }

    public static PublicationOptions forTables(List<String> tables) {
        return new PublicationOptions(tables, Collections.emptyList());
    }

    public static PublicationOptions from(PostgresConnectorConfig config) {
        return new PublicationOptions(config.publicationTables(), config.publicationParams());
    }

    public List<String> tables() {
        return tables;
    }

    /**
     * @return parameters such as {@code publish = 'insert, update'}
     */
    public List<String> params() {
        return params;
    }

    @Override
    public String toString() {
        return "PublicationOptions [tables=" + tables + ", params=" + params + "]";
    }
}
