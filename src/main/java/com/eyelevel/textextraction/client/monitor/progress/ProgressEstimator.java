package com.eyelevel.textextraction.client.monitor.progress;

import com.eyelevel.textextraction.model.DocumentStatus;

import java.time.Duration;
import java.util.List;

/**
 * Maps elapsed time to an estimated stage and percentage for one monitoring session.
 *
 * <p>The percentage never decreases across calls and stays at or below {@value #CAP} until COMPLETED is
 * observed. Within the nominal profile duration it grows linearly up to {@value #NOMINAL_CEILING}; past it,
 * it creeps toward the cap without reaching it.
 */
public class ProgressEstimator {

    static final int CAP = 99;
    static final int NOMINAL_CEILING = 95;

    private final StageProfile profile;
    private int lastPercent;
    private ProcessingStage lastStage = ProcessingStage.QUEUED;

    public ProgressEstimator(final StageProfile profile) {
        this.profile = profile;
    }

    public synchronized Estimate estimate(final DocumentStatus status, final Duration elapsed) {
        if (status == DocumentStatus.COMPLETED) {
            lastPercent = 100;
            lastStage = ProcessingStage.DONE;
            return new Estimate(lastStage, lastPercent);
        }
        if (status != null && status.isTerminal()) {
            return new Estimate(lastStage, lastPercent);
        }

        final long totalMillis = Math.max(1, profile.total().toMillis());
        final long elapsedMillis = Math.max(0, elapsed.toMillis());
        int percent;
        ProcessingStage stage;
        if (elapsedMillis <= totalMillis) {
            percent = (int) (NOMINAL_CEILING * elapsedMillis / totalMillis);
            stage = stageAt(elapsedMillis);
        } else {
            final double overrun = (double) (elapsedMillis - totalMillis) / totalMillis;
            percent = NOMINAL_CEILING + (int) ((CAP - NOMINAL_CEILING) * (1 - Math.exp(-overrun)));
            stage = ProcessingStage.FINALIZING;
        }
        if (status == DocumentStatus.PENDING) {
            // Not picked up yet: stay within the first stage.
            final int firstStageCeiling = (int) (NOMINAL_CEILING * profile.stageDurations().get(0).toMillis()
                                                 / totalMillis);
            percent = Math.min(percent, firstStageCeiling);
            stage = ProcessingStage.QUEUED;
        }

        lastPercent = Math.min(CAP, Math.max(lastPercent, percent));
        if (stage.ordinal() > lastStage.ordinal()) {
            lastStage = stage;
        }
        return new Estimate(lastStage, lastPercent);
    }

    private ProcessingStage stageAt(final long elapsedMillis) {
        final List<Duration> durations = profile.stageDurations();
        long boundary = 0;
        for (int i = 0; i < durations.size(); i++) {
            boundary += durations.get(i).toMillis();
            if (elapsedMillis < boundary) {
                return ProcessingStage.RUNNING_STAGES.get(i);
            }
        }
        return ProcessingStage.FINALIZING;
    }

    public record Estimate(ProcessingStage stage, int percent) {
    }
}
