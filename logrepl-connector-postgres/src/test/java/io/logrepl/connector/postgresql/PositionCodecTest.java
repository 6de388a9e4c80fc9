/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import io.logrepl.connector.postgresql.connection.Lsn;

public class PositionCodecTest {

    private final PositionCodec codec = new PositionCodec();

    @Test
    public void shouldEncodeStreamingPosition() {
        assertThat(codec.encode(Lsn.valueOf("0/16B3748"))).isEqualTo("{\"type\":\"CDC\",\"lastLSN\":\"0/16B3748\"}");
    }

    @Test
    public void shouldDecodeWhatItEncodes() {
        for (String value : new String[]{ "0/1", "0/16B3748", "16/B374D848", "FFFFFFFF/FFFFFFFF" }) {
            Lsn lsn = Lsn.valueOf(value);
            assertThat(codec.decode(codec.encode(lsn))).isEqualTo(lsn);
        }
    }

    @Test
    public void shouldIgnoreUnknownProperties() {
        assertThat(codec.decode("{\"lastLSN\":\"1/A\",\"type\":\"CDC\",\"extra\":42}")).isEqualTo(Lsn.valueOf("1/A"));
    }

    @Test
    public void shouldParseSnapshotPositionButNotDecodeIt() {
        String token = "{\"type\":\"INITIAL\",\"lastLSN\":\"0/10\"}";

        Position position = codec.parse(token);
        assertThat(position.type()).isEqualTo(Position.Type.INITIAL);
        assertThat(codec.format(position)).isEqualTo(token);

        assertThatThrownBy(() -> codec.decode(token))
                .isInstanceOf(PositionFormatException.class)
                .hasMessageContaining("not a CDC position");
    }

    @Test
    public void shouldRejectMalformedTokens() {
        assertThatThrownBy(() -> codec.decode(null)).isInstanceOf(PositionFormatException.class);
        assertThatThrownBy(() -> codec.decode("")).isInstanceOf(PositionFormatException.class);
        assertThatThrownBy(() -> codec.decode("{not json")).isInstanceOf(PositionFormatException.class);
        assertThatThrownBy(() -> codec.decode("[1,2]")).isInstanceOf(PositionFormatException.class);
        assertThatThrownBy(() -> codec.decode("{\"type\":\"CDC\"}")).isInstanceOf(PositionFormatException.class);
        assertThatThrownBy(() -> codec.decode("{\"type\":\"CDC\",\"lastLSN\":\"garbage\"}"))
                .isInstanceOf(PositionFormatException.class)
                .hasMessageContaining("invalid lastLSN");
        assertThatThrownBy(() -> codec.decode("{\"type\":\"SNAPSHOT\",\"lastLSN\":\"0/1\"}"))
                .isInstanceOf(PositionFormatException.class)
                .hasMessageContaining("unknown type");
        assertThatThrownBy(() -> codec.decode("{\"lastLSN\":\"0/1\"}")).isInstanceOf(PositionFormatException.class);
    }

    @Test
    public void shouldOrderPositionsByLsn() {
        Position earlier = codec.parse(codec.encode(Lsn.valueOf("0/FF")));
        Position later = codec.parse(codec.encode(Lsn.valueOf("1/0")));

        assertThat(earlier).isLessThan(later);
        assertThat(Position.initial(Lsn.valueOf("1/0"))).isEqualByComparingTo(later);
    }
}
