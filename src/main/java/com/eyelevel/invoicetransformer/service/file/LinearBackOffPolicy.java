package com.eyelevel.invoicetransformer.service.file;

import lombok.Setter;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

/**
 * Waits {@code attempt × delay} between attempts: one delay after the first failure, two after the
 * second, and so on.
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long delayMs;

    @Setter
    private Sleeper sleeper = new ThreadWaitSleeper();

    public LinearBackOffPolicy(final long delayMs) {
        this.delayMs = delayMs;
    }

    @Override
    public BackOffContext start(final RetryContext context) {
        return new LinearBackOffContext();
    }

    @Override
    public void backOff(final BackOffContext backOffContext) throws BackOffInterruptedException {
        final LinearBackOffContext context = (LinearBackOffContext) backOffContext;
        context.attempt++;
        try {
            sleeper.sleep(context.attempt * delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while sleeping", e);
        }
    }

    private static final class LinearBackOffContext implements BackOffContext {
        private int attempt;
    }
}
