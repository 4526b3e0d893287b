package com.eyelevel.textextraction.client.monitor.progress;

import java.time.Duration;
import java.util.List;

/**
 * Nominal duration of each {@link ProcessingStage#RUNNING_STAGES running stage} for a family of formats.
 *
 * @param stageDurations one entry per running stage, in order
 * @param scalesWithSize whether larger artifacts stretch the durations
 */
public record StageProfile(String name, List<Duration> stageDurations, boolean scalesWithSize) {

    private static final double SCALE_PER_MEGABYTE = 0.25;
    private static final double MAX_SCALE = 4.0;
    private static final long MEGABYTE = 1024L * 1024L;

    public StageProfile {
        if (stageDurations.size() != ProcessingStage.RUNNING_STAGES.size()) {
            throw new IllegalArgumentException("Expected one duration per running stage, got " + stageDurations.size());
        }
        stageDurations = List.copyOf(stageDurations);
    }

    /**
     * Returns this profile stretched by 25% per megabyte of artifact, at most fourfold. Profiles that do not
     * scale with size are returned as they are.
     */
    public StageProfile scaledFor(final long sizeBytes) {
        if (!scalesWithSize || sizeBytes <= 0) {
            return this;
        }
        final double factor = Math.min(MAX_SCALE, 1.0 + SCALE_PER_MEGABYTE * sizeBytes / MEGABYTE);
        final List<Duration> scaled = stageDurations.stream()
                                                    .map(d -> Duration.ofMillis(Math.round(d.toMillis() * factor)))
                                                    .toList();
        return new StageProfile(name, scaled, false);
    }

    public Duration total() {
        return stageDurations.stream().reduce(Duration.ZERO, Duration::plus);
    }
}
