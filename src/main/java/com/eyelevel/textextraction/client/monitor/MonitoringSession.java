package com.eyelevel.textextraction.client.monitor;

import com.eyelevel.textextraction.client.error.ErrorTranslator;
import com.eyelevel.textextraction.client.error.UserFacingError;
import com.eyelevel.textextraction.client.monitor.progress.ProgressEstimator;
import com.eyelevel.textextraction.dto.document.DocumentStatusResponse;
import com.eyelevel.textextraction.model.DocumentStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls the status of one document until it is terminal, the session times out or it is cancelled.
 *
 * <p>Polls never overlap within a session: the next one is scheduled only after the previous response
 * or error arrived. Nothing blocks while waiting; delays run on the monitor's {@link Scheduler}.
 */
@Slf4j
public class MonitoringSession {

    private final String documentId;
    private final StatusSource statusSource;
    private final StatusMonitorSettings settings;
    private final ErrorTranslator errorTranslator;
    private final Scheduler scheduler;
    private final ProgressEstimator progressEstimator;
    private final AdaptivePollInterval pollInterval;

    private final Sinks.Many<StatusUpdate> updates = Sinks.many().replay().all();
    private final CompletableFuture<MonitorOutcome> outcome = new CompletableFuture<>();
    private final Disposable.Swap subscription = Disposables.swap();
    private final Disposable.Swap cancelRegistration = Disposables.swap();

    private volatile MonitorState state = MonitorState.NOT_STARTED;
    private volatile DocumentStatus lastStatus = DocumentStatus.PENDING;
    private long startedAtMillis;

    MonitoringSession(final String documentId, final StatusSource statusSource, final StatusMonitorSettings settings,
                      final ErrorTranslator errorTranslator, final Scheduler scheduler,
                      final ProgressEstimator progressEstimator, final AdaptivePollInterval pollInterval) {
        this.documentId = documentId;
        this.statusSource = statusSource;
        this.settings = settings;
        this.errorTranslator = errorTranslator;
        this.scheduler = scheduler;
        this.progressEstimator = progressEstimator;
        this.pollInterval = pollInterval;
    }

    synchronized void begin(final CancellationToken cancellationToken) {
        if (state != MonitorState.NOT_STARTED) {
            throw new IllegalStateException("Session for document " + documentId + " was already started.");
        }
        startedAtMillis = scheduler.now(TimeUnit.MILLISECONDS);
        state = MonitorState.POLLING;
        log.debug("Monitoring document {}.", documentId);

        subscription.update(Mono.defer(this::pollOnce)
                                .expand(step -> step.isFinal()
                                                ? Mono.empty()
                                                : Mono.delay(step.delay(), scheduler).then(Mono.defer(this::pollOnce)))
                                .subscribe(this::onStep, this::onLoopError));
        final Disposable registration = cancellationToken.onCancel(this::cancel);
        if (state.isFinished()) {
            registration.dispose();
        } else {
            cancelRegistration.update(registration);
        }
    }

    public String getDocumentId() {
        return documentId;
    }

    public MonitorState getState() {
        return state;
    }

    /**
     * Every update of this session. Replays past updates to late subscribers and completes when the
     * session ends.
     */
    public Flux<StatusUpdate> updates() {
        return updates.asFlux();
    }

    public CompletableFuture<MonitorOutcome> outcome() {
        return outcome;
    }

    /**
     * Stops polling. Has no effect on a session that already ended.
     */
    public void cancel() {
        finish(MonitorOutcome.cancelled(documentId, elapsed()));
    }

    private Mono<Step> pollOnce() {
        if (state != MonitorState.POLLING) {
            return Mono.empty();
        }
        final Duration elapsed = elapsed();
        if (elapsed.compareTo(settings.maxSessionDuration()) >= 0) {
            log.info("Monitoring of document {} stopped after {} without a final status.", documentId, elapsed);
            return Mono.just(Step.finish(null, MonitorOutcome.clientTimeout(
                    documentId, errorTranslator.clientTimeout(settings.maxSessionDuration()), elapsed)));
        }
        return statusSource.fetchStatus(documentId)
                           .switchIfEmpty(Mono.error(() -> new StatusFetchException(
                                   "No status returned for document " + documentId, null, true, null)))
                           .map(this::onStatus)
                           .onErrorResume(error -> Mono.just(onFetchError(error)));
    }

    private Step onStatus(final DocumentStatusResponse response) {
        final Duration elapsed = elapsed();
        final DocumentStatus status = response.status();
        lastStatus = status;
        final ProgressEstimator.Estimate estimate = progressEstimator.estimate(status, elapsed);

        if (status == DocumentStatus.COMPLETED) {
            final StatusUpdate update = new StatusUpdate(documentId, status, estimate.stage(), estimate.percent(),
                                                         elapsed, null, null);
            return Step.finish(update, MonitorOutcome.completed(documentId, response.extractedText(), elapsed));
        }
        if (status.isTerminal()) {
            final UserFacingError error = errorTranslator.translate(response.errorInfo());
            final StatusUpdate update = new StatusUpdate(documentId, status, estimate.stage(), estimate.percent(),
                                                         elapsed, null, null);
            return Step.finish(update, MonitorOutcome.failed(documentId, error, elapsed));
        }
        final Duration interval = pollInterval.next(elapsed);
        return Step.next(new StatusUpdate(documentId, status, estimate.stage(), estimate.percent(), elapsed,
                                          interval, null), delayWithinSession(interval, elapsed));
    }

    private Step onFetchError(final Throwable error) {
        final Duration elapsed = elapsed();
        final UserFacingError translated = errorTranslator.translateTransport(error);
        if (!(error instanceof StatusFetchException fetchError) || !fetchError.isTransientFailure()) {
            log.warn("Monitoring of document {} failed: {}", documentId, error.getMessage());
            return Step.finish(null, MonitorOutcome.failed(documentId, translated, elapsed));
        }
        log.debug("Status poll for document {} failed, polling again: {}", documentId, error.getMessage());
        final ProgressEstimator.Estimate estimate = progressEstimator.estimate(lastStatus, elapsed);
        final Duration interval = pollInterval.next(elapsed);
        return Step.next(new StatusUpdate(documentId, lastStatus, estimate.stage(), estimate.percent(), elapsed,
                                          interval, translated), delayWithinSession(interval, elapsed));
    }

    private synchronized void onStep(final Step step) {
        if (state != MonitorState.POLLING) {
            return;
        }
        if (step.update() != null) {
            updates.tryEmitNext(step.update());
        }
        if (step.isFinal()) {
            finish(step.outcome());
        }
    }

    private void onLoopError(final Throwable error) {
        log.error("Monitoring loop of document {} terminated unexpectedly.", documentId, error);
        finish(MonitorOutcome.failed(documentId, errorTranslator.translateTransport(error), elapsed()));
    }

    private synchronized void finish(final MonitorOutcome result) {
        if (state.isFinished()) {
            return;
        }
        state = switch (result.type()) {
            case COMPLETED -> MonitorState.DONE;
            case FAILED, CLIENT_TIMEOUT -> MonitorState.ERRORED;
            case CANCELLED -> MonitorState.CANCELLED;
        };
        subscription.dispose();
        cancelRegistration.dispose();
        updates.tryEmitComplete();
        outcome.complete(result);
        log.debug("Monitoring of document {} ended with {}.", documentId, result.type());
    }

    // The last delay is shortened so the session timeout is noticed on time.
    private Duration delayWithinSession(final Duration interval, final Duration elapsed) {
        final Duration remaining = settings.maxSessionDuration().minus(elapsed);
        if (remaining.isNegative()) {
            return Duration.ZERO;
        }
        return remaining.compareTo(interval) < 0 ? remaining : interval;
    }

    private Duration elapsed() {
        if (state == MonitorState.NOT_STARTED) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(scheduler.now(TimeUnit.MILLISECONDS) - startedAtMillis);
    }

    private record Step(StatusUpdate update, Duration delay, MonitorOutcome outcome) {

        static Step next(final StatusUpdate update, final Duration delay) {
            return new Step(update, delay, null);
        }

        static Step finish(final StatusUpdate update, final MonitorOutcome outcome) {
            return new Step(update, null, outcome);
        }

        boolean isFinal() {
            return outcome != null;
        }
    }
}
