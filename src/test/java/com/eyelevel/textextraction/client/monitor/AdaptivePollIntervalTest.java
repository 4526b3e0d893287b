package com.eyelevel.textextraction.client.monitor;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class AdaptivePollIntervalTest {

    private final AdaptivePollInterval interval = new AdaptivePollInterval(StatusMonitorSettings.defaults());

    @Test
    void fastIntervalUpToAndIncludingThreshold() {
        assertThat(interval.next(Duration.ZERO)).isEqualTo(Duration.ofSeconds(3));
        assertThat(interval.next(Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(3));
        assertThat(interval.isSwitched()).isFalse();
    }

    @Test
    void switchToSlowIntervalIsPermanent() {
        assertThat(interval.next(Duration.ofSeconds(61))).isEqualTo(Duration.ofSeconds(8));

        assertThat(interval.next(Duration.ofSeconds(5))).isEqualTo(Duration.ofSeconds(8));
        assertThat(interval.isSwitched()).isTrue();
    }
}
