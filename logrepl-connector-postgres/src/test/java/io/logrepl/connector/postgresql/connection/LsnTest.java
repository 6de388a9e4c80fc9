/*
 * Copyright Logrepl Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.logrepl.connector.postgresql.connection;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

public class LsnTest {

    @Test
    public void shouldParseAndFormatTextualForm() {
        Lsn lsn = Lsn.valueOf("16/B374D848");
        assertThat(lsn.asLong()).isEqualTo(0x16B374D848L);
        assertThat(lsn.asString()).isEqualTo("16/B374D848");
        assertThat(lsn.isValid()).isTrue();
        assertThat(Lsn.valueOf("0/16b3748")).isEqualTo(Lsn.valueOf(0x16B3748L));
    }

    @Test
    public void shouldTreatMalformedValuesAsInvalid() {
        assertThat(Lsn.valueOf((String) null).isValid()).isFalse();
        assertThat(Lsn.valueOf("").isValid()).isFalse();
        assertThat(Lsn.valueOf("16B3748").isValid()).isFalse();
        assertThat(Lsn.valueOf("/1").isValid()).isFalse();
        assertThat(Lsn.valueOf("0/").isValid()).isFalse();
        assertThat(Lsn.valueOf("0/xyz").isValid()).isFalse();
        assertThat(Lsn.valueOf("1/2/3").isValid()).isFalse();
        assertThat(Lsn.valueOf("123456789/0").isValid()).isFalse();
        assertThat(Lsn.valueOf("0/0").isValid()).isFalse();
    }

    @Test
    public void shouldOrderAsUnsigned() {
        Lsn low = Lsn.valueOf("0/16B3748");
        Lsn high = Lsn.valueOf("1/0");
        Lsn highest = Lsn.valueOf("FFFFFFFF/FFFFFFFF");

        assertThat(low).isLessThan(high);
        assertThat(high).isLessThan(highest);
        assertThat(highest.asString()).isEqualTo("FFFFFFFF/FFFFFFFF");
    }
}
