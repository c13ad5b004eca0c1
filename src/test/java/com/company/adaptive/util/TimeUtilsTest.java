package com.company.adaptive.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void formatsUptime() {
        assertThat(TimeUtils.formatUptime(0)).isEqualTo("0s");
        assertThat(TimeUtils.formatUptime(183_845)).isEqualTo("2d 3h 4m 5s");
        assertThat(TimeUtils.formatUptime(3600)).isEqualTo("1h 0s");
    }

    @Test
    void formatsDurations() {
        assertThat(TimeUtils.formatDuration(Duration.ofMillis(250))).isEqualTo("250ms");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(42))).isEqualTo("42s");
        assertThat(TimeUtils.formatDuration(Duration.ofSeconds(125))).isEqualTo("2m 5s");
        assertThat(TimeUtils.formatDuration(Duration.ofMinutes(90))).isEqualTo("1h 30m");
    }
}
