/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.kafka.connect.source.SourceRecord;
import org.junit.Test;

import io.logrepl.config.Configuration;
import io.logrepl.connector.postgresql.connection.Lsn;

public class ChangeRecordConverterTest {

    private final PositionCodec positionCodec = new PositionCodec();
    private final ChangeRecordConverter converter = new ChangeRecordConverter(new PostgresConnectorConfig(
            Configuration.create().with(PostgresConnectorConfig.TOPIC_PREFIX, "inventory").build()));

    private static Map<String, String> metadata() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(ChangeRecord.Metadata.COLLECTION, "users");
        metadata.put(ChangeRecord.Metadata.SCHEMA, "public");
        metadata.put(ChangeRecord.Metadata.READ_AT, "1700000000000");
        return metadata;
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldConvertUpdate() {
        String position = positionCodec.encode(Lsn.valueOf("0/16B3748"));
        ChangeRecord record = ChangeRecord.update(position, metadata(),
                Collections.singletonMap("id", 1),
                Collections.singletonMap("name", "old"),
                Collections.singletonMap("name", "new"));

        SourceRecord sourceRecord = converter.convert(record);

        assertThat(sourceRecord.topic()).isEqualTo("inventory.public.users");
        assertThat(sourceRecord.sourcePartition()).isEqualTo(Collections.singletonMap("server", "inventory"));
        assertThat(sourceRecord.sourceOffset()).isEqualTo(Collections.singletonMap("position", position));
        assertThat(sourceRecord.keySchema()).isNull();
        assertThat(sourceRecord.valueSchema()).isNull();
        assertThat((Map<String, Object>) sourceRecord.key()).containsEntry("id", 1);

        Map<String, Object> value = (Map<String, Object>) sourceRecord.value();
        assertThat(value).containsEntry("op", "u")
                .containsEntry("before", Collections.singletonMap("name", "old"))
                .containsEntry("after", Collections.singletonMap("name", "new"))
                .containsEntry("ts_ms", 1700000000000L);
        assertThat((Map<String, Object>) value.get("source"))
                .containsEntry("schema", "public")
                .containsEntry("table", "users")
                .containsEntry("position", position);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldConvertDeleteWithoutKey() {
        ChangeRecord record = ChangeRecord.delete(positionCodec.encode(Lsn.valueOf("0/1")), metadata(), Collections.emptyMap());

        SourceRecord sourceRecord = converter.convert(record);

        assertThat(sourceRecord.key()).isNull();
        Map<String, Object> value = (Map<String, Object>) sourceRecord.value();
        assertThat(value.get("op")).isEqualTo("d");
        assertThat(value.get("before")).isNull();
        assertThat(value.get("after")).isNull();
    }

    @Test
    public void shouldOmitMissingSchemaFromTopic() {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(ChangeRecord.Metadata.COLLECTION, "users");
        ChangeRecord record = ChangeRecord.create("{}", metadata, Collections.emptyMap(), Collections.singletonMap("id", 1));

        assertThat(converter.topicFor(record)).isEqualTo("inventory.users");
        assertThat(new ChangeRecordConverter(new PostgresConnectorConfig(Configuration.empty())).topicFor(record)).isEqualTo("logrepl.users");
    }
}
