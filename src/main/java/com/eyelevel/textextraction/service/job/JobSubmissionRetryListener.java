package com.eyelevel.textextraction.service.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component("jobSubmissionRetryListener")
@Slf4j
public class JobSubmissionRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("OCR job submission failed on attempt {}: {}", context.getRetryCount(), throwable.getMessage());
    }

    @Override
    public <T, E extends Throwable> void close(RetryContext context, RetryCallback<T, E> callback,
                                               Throwable throwable) {
        if (throwable != null && context.getRetryCount() > 1) {
            log.error("OCR job submission gave up after {} attempts.", context.getRetryCount());
        }
    }
}
