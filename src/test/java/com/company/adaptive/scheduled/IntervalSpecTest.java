package com.company.adaptive.scheduled;

import com.company.adaptive.exception.InvalidRequestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntervalSpecTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void parsesNamedAndShortForms() {
        assertThat(IntervalSpec.parse("hourly").getPeriod()).isEqualTo(Duration.ofHours(1));
        assertThat(IntervalSpec.parse("daily").getPeriod()).isEqualTo(Duration.ofDays(1));
        assertThat(IntervalSpec.parse("weekly").getPeriod()).isEqualTo(Duration.ofDays(7));
        assertThat(IntervalSpec.parse("60s").getPeriod()).isEqualTo(Duration.ofSeconds(60));
        assertThat(IntervalSpec.parse("5m").getPeriod()).isEqualTo(Duration.ofMinutes(5));
        assertThat(IntervalSpec.parse("250ms").getPeriod()).isEqualTo(Duration.ofMillis(250));
        assertThat(IntervalSpec.parse("every_30_minutes").getPeriod()).isEqualTo(Duration.ofMinutes(30));
        assertThat(IntervalSpec.parse("PT10M").getPeriod()).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void parsesCronExpressions() {
        IntervalSpec spec = IntervalSpec.parse("0 0 3 * * *");

        assertThat(spec.isCron()).isTrue();
        assertThat(spec.firstRunAt(T0, ZoneOffset.UTC)).isEqualTo(Instant.parse("2024-01-01T03:00:00Z"));
        assertThat(spec.nextRunAt(Instant.parse("2024-01-01T03:00:00Z"),
                Instant.parse("2024-01-01T03:00:02Z"), ZoneOffset.UTC))
                .isEqualTo(Instant.parse("2024-01-02T03:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "sometimes", "0s", "every_0_seconds", "-5m", "* * *",
            "99999999999999999999s", "9999999999999999d", "every_9999999999999999_days"})
    void rejectsUnusableSpecs(String spec) {
        assertThatThrownBy(() -> IntervalSpec.parse(spec)).isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void fixedPeriodStaysAnchored() {
        IntervalSpec spec = IntervalSpec.every(Duration.ofSeconds(60));
        Instant first = spec.firstRunAt(T0, ZoneOffset.UTC);

        assertThat(first).isEqualTo(T0.plusSeconds(60));
        // a run that finished late does not shift the grid
        assertThat(spec.nextRunAt(first, first.plusSeconds(5), ZoneOffset.UTC)).isEqualTo(T0.plusSeconds(120));
    }

    @Test
    void fixedPeriodSkipsMissedSlots() {
        IntervalSpec spec = IntervalSpec.every(Duration.ofSeconds(60));

        Instant next = spec.nextRunAt(T0.plusSeconds(60), T0.plusSeconds(250), ZoneOffset.UTC);

        assertThat(next).isEqualTo(T0.plusSeconds(300));
    }

    @Test
    void equalSpecsCompareEqual() {
        assertThat(IntervalSpec.parse("1h")).isEqualTo(IntervalSpec.parse("hourly"));
        assertThat(IntervalSpec.parse("5m").toString()).isEqualTo("every 5m 0s");
    }
}
