package com.eyelevel.textextraction.client.monitor.progress;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageProfilesTest {

    private static final long MEGABYTE = 1024L * 1024L;

    @Test
    void profileIsChosenByFormatFamily() {
        assertThat(StageProfiles.forFormat("pdf", 0)).isEqualTo(StageProfiles.OCR);
        assertThat(StageProfiles.forFormat("tiff", 0)).isEqualTo(StageProfiles.OCR);
        assertThat(StageProfiles.forFormat("docx", 0)).isEqualTo(StageProfiles.OFFICE);
        assertThat(StageProfiles.forFormat("rtf", 0)).isEqualTo(StageProfiles.OFFICE);
        assertThat(StageProfiles.forFormat("txt", 0)).isEqualTo(StageProfiles.PLAIN_TEXT);
        assertThat(StageProfiles.forFormat("markdown", 0)).isEqualTo(StageProfiles.PLAIN_TEXT);
        assertThat(StageProfiles.forFormat("zip", 0)).isEqualTo(StageProfiles.DEFAULT);
        assertThat(StageProfiles.forFormat(null, 0)).isEqualTo(StageProfiles.DEFAULT);
    }

    @Test
    void ocrProfileStretchesWithSize() {
        StageProfile fourMegabytes = StageProfiles.forFormat("pdf", 4 * MEGABYTE);

        assertThat(fourMegabytes.total()).isEqualTo(StageProfiles.OCR.total().multipliedBy(2));
        assertThat(fourMegabytes.stageDurations().get(0)).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void stretchIsCappedAtFourfold() {
        StageProfile huge = StageProfiles.forFormat("png", 500 * MEGABYTE);

        assertThat(huge.total()).isEqualTo(StageProfiles.OCR.total().multipliedBy(4));
    }

    @Test
    void officeProfileIgnoresSize() {
        assertThat(StageProfiles.forFormat("docx", 50 * MEGABYTE)).isEqualTo(StageProfiles.OFFICE);
    }

    @Test
    void profileNeedsOneDurationPerRunningStage() {
        assertThatThrownBy(() -> new StageProfile("broken", List.of(Duration.ofSeconds(1)), false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
