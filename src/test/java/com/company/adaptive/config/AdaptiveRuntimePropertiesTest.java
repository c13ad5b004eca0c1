package com.company.adaptive.config;

import com.company.adaptive.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdaptiveRuntimePropertiesTest {

    @Test
    void defaultsAreConsistent() {
        assertThatCode(() -> new AdaptiveRuntimeProperties().validate()).doesNotThrowAnyException();
    }

    @Test
    void rejectsNonPositiveIntervals() {
        AdaptiveRuntimeProperties properties = new AdaptiveRuntimeProperties();
        properties.getScheduler().setTickInterval(Duration.ZERO);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("adaptive.scheduler.tick-interval");
    }

    @Test
    void rejectsInvertedThresholds() {
        AdaptiveRuntimeProperties properties = new AdaptiveRuntimeProperties();
        properties.getHealth().setResourceSoftPercent(96);

        assertThatThrownBy(properties::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void rejectsPruneFloorAtCeiling() {
        AdaptiveRuntimeProperties properties = new AdaptiveRuntimeProperties();
        properties.getTrail().setPruneFloor(1.0);

        assertThatThrownBy(properties::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("prune-floor");
    }
}
