package io.ietfdata.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampsTest {

    @Test
    void parseTreatsLocalTimeAsUtc() {
        assertThat(Timestamps.parse("2012-02-26T00:03:54")).isEqualTo(Instant.parse("2012-02-26T00:03:54Z"));
    }

    @Test
    void parseAcceptsFractionalSeconds() {
        assertThat(Timestamps.parse("2019-03-01T10:15:30.123456"))
                .isEqualTo(Instant.parse("2019-03-01T10:15:30.123456Z"));
    }

    @Test
    void parseRejectsGarbage() {
        assertThatThrownBy(() -> Timestamps.parse("yesterday")).isInstanceOf(DateTimeParseException.class);
        assertThatThrownBy(() -> Timestamps.parse("2019-03-01")).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    void formatDropsFractionAndOffset() {
        assertThat(Timestamps.format(Instant.parse("2019-03-01T10:15:30.987Z"))).isEqualTo("2019-03-01T10:15:30");
    }
}
