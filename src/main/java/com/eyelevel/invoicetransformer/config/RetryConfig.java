package com.eyelevel.invoicetransformer.config;

import com.eyelevel.invoicetransformer.exception.FileLockedException;
import com.eyelevel.invoicetransformer.service.file.FileLockRetryListener;
import com.eyelevel.invoicetransformer.service.file.LinearBackOffPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

/**
 * Builds the retry template used while waiting for a writer to release an incoming invoice file.
 */
@Configuration
public class RetryConfig {

    @Bean("fileLockRetryTemplate")
    public RetryTemplate fileLockRetryTemplate(final InvoiceProcessingConfig config,
                                               final FileLockRetryListener fileLockRetryListener) {
        final InvoiceProcessingConfig.RetryConfig lockRetry = config.getLockRetry();

        final RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(lockRetry.getAttempts(),
                                                      Map.of(FileLockedException.class, true)));
        template.setBackOffPolicy(new LinearBackOffPolicy(lockRetry.getDelayMs()));
        template.registerListener(fileLockRetryListener);
        return template;
    }
}
