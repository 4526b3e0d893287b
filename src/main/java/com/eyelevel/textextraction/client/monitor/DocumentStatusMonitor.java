package com.eyelevel.textextraction.client.monitor;

import com.eyelevel.textextraction.client.error.ErrorTranslator;
import com.eyelevel.textextraction.client.monitor.progress.ProgressEstimator;
import com.eyelevel.textextraction.client.monitor.progress.StageProfile;
import com.eyelevel.textextraction.client.monitor.progress.StageProfiles;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Starts independent {@link MonitoringSession}s that follow documents until they finish.
 *
 * <p>Sessions share the status source and settings but no state, so any number of documents can be
 * monitored at the same time.
 */
@Slf4j
public class DocumentStatusMonitor {

    private final StatusSource statusSource;
    private final StatusMonitorSettings settings;
    private final ErrorTranslator errorTranslator;
    private final Scheduler scheduler;

    public DocumentStatusMonitor(final StatusSource statusSource, final StatusMonitorSettings settings,
                                 final ErrorTranslator errorTranslator) {
        this(statusSource, settings, errorTranslator, Schedulers.parallel());
    }

    public DocumentStatusMonitor(final StatusSource statusSource, final StatusMonitorSettings settings,
                                 final ErrorTranslator errorTranslator, final Scheduler scheduler) {
        this.statusSource = statusSource;
        this.settings = settings;
        this.errorTranslator = errorTranslator;
        this.scheduler = scheduler;
    }

    /**
     * Starts monitoring a document. The first poll is issued immediately.
     *
     * @param documentId        id returned by the upload
     * @param formatCode        format of the document, used to pick the progress profile; may be null
     * @param sizeBytes         size of the document, or 0 when unknown
     * @param cancellationToken stops the session when cancelled
     */
    public MonitoringSession start(final String documentId, final String formatCode, final long sizeBytes,
                                   final CancellationToken cancellationToken) {
        final StageProfile profile = StageProfiles.forFormat(formatCode, sizeBytes);
        log.info("Starting status monitoring for document {} with the '{}' progress profile.", documentId,
                 profile.name());
        final MonitoringSession session = new MonitoringSession(documentId, statusSource, settings, errorTranslator,
                                                                scheduler, new ProgressEstimator(profile),
                                                                new AdaptivePollInterval(settings));
        session.begin(cancellationToken);
        return session;
    }

    public MonitoringSession start(final String documentId, final String formatCode, final long sizeBytes) {
        return start(documentId, formatCode, sizeBytes, new CancellationToken());
    }
}
