package com.eyelevel.invoicetransformer.service.file;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class FileLockRetryListener implements RetryListener {

    static final String FILE_NAME_ATTRIBUTE = "invoice.fileName";

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("File '{}' is in use (attempt {}). Retrying...", context.getAttribute(FILE_NAME_ATTRIBUTE),
                 context.getRetryCount());
    }
}
