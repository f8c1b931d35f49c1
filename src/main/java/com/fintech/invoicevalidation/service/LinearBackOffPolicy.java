package com.fintech.invoicevalidation.service;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Duration;

/**
 * Back-off that waits {@code step × n} before the n-th retry.
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final long stepMs;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(Duration step) {
        this(step, new ThreadWaitSleeper());
    }

    public LinearBackOffPolicy(Duration step, Sleeper sleeper) {
        this.stepMs = step.toMillis();
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new LinearBackOffContext();
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        LinearBackOffContext context = (LinearBackOffContext) backOffContext;
        long delay = stepMs * ++context.retries;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("Thread interrupted while sleeping", e);
        }
    }

    private static class LinearBackOffContext implements BackOffContext {
        private int retries;
    }
}
