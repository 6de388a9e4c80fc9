/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.kafka.connect.source.SourceRecord;

import io.logrepl.annotation.ThreadSafe;
import io.logrepl.data.Envelope;

/**
 * Converts {@link ChangeRecord}s into schemaless Kafka Connect {@link SourceRecord}s.
 * <p>
 * Records of table {@code schema.table} go to topic {@code <prefix>.<schema>.<table>}. The source partition identifies
 * the logical server by the topic prefix, and the source offset holds the record's position token, e.g.
 *
 * <pre>
 * {
 *     "op": "u",
 *     "before": { "id": 1, "name": "old" },
 *     "after": { "id": 1, "name": "new" },
 *     "source": { "schema": "public", "table": "users", "position": "{\"type\":\"CDC\",\"lastLSN\":\"0/16B3748\"}" },
 *     "ts_ms": 1700000000000
 * }
 * </pre>
 */
@ThreadSafe
public class ChangeRecordConverter {

    static final String SERVER_PARTITION_KEY = "server";
    static final String POSITION_OFFSET_KEY = "position";

    static final String SOURCE_SCHEMA = "schema";
    static final String SOURCE_TABLE = "table";
    static final String SOURCE_POSITION = "position";

    private final String topicPrefix;
    private final Map<String, String> sourcePartition;

    public ChangeRecordConverter(PostgresConnectorConfig config) {
        this(config.topicPrefix());
    }

    public ChangeRecordConverter(String topicPrefix) {
        this.topicPrefix = topicPrefix;
        this.sourcePartition = Collections.singletonMap(SERVER_PARTITION_KEY, topicPrefix);
    }

    public Map<String, String> sourcePartition() {
        return sourcePartition;
    }

    public String topicFor(ChangeRecord record) {
        String schema = record.metadata().get(ChangeRecord.Metadata.SCHEMA);
        return schema != null
                ? topicPrefix + "." + schema + "." + record.collection()
                : topicPrefix + "." + record.collection();
    }

    public SourceRecord convert(ChangeRecord record) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put(Envelope.FieldName.OPERATION, record.operation().code());
        value.put(Envelope.FieldName.BEFORE, record.before());
        value.put(Envelope.FieldName.AFTER, record.after());
        value.put(Envelope.FieldName.SOURCE, source(record));
        value.put(Envelope.FieldName.TIMESTAMP, readAt(record));

        Map<String, ?> offset = Collections.singletonMap(POSITION_OFFSET_KEY, record.position());
        Map<String, Object> key = record.key().isEmpty() ? null : record.key();

        return new SourceRecord(sourcePartition, offset, topicFor(record), null, null, key, null, value);
    }

    private static Map<String, Object> source(ChangeRecord record) {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put(SOURCE_SCHEMA, record.metadata().get(ChangeRecord.Metadata.SCHEMA));
        source.put(SOURCE_TABLE, record.collection());
        source.put(SOURCE_POSITION, record.position());
        return source;
    }

    private static Long readAt(ChangeRecord record) {
        String readAt = record.metadata().get(ChangeRecord.Metadata.READ_AT);
        return readAt != null ? Long.valueOf(readAt) : null;
    }
}
