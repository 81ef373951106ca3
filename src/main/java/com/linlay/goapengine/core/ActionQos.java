package com.linlay.goapengine.core;

import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry settings for one action.
 */
public record ActionQos(
        int maxAttempts,
        long backoffMillis,
        double backoffMultiplier,
        long backoffMaxInterval,
        boolean idempotent
) {

    private static final int DEFAULT_MAX_ATTEMPTS = 5;
    private static final long DEFAULT_BACKOFF_MILLIS = 10_000L;
    private static final double DEFAULT_MULTIPLIER = 5.0;
    private static final long DEFAULT_MAX_INTERVAL = 60_000L;

    public static final ActionQos DEFAULT = new ActionQos(
            DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF_MILLIS, DEFAULT_MULTIPLIER, DEFAULT_MAX_INTERVAL, false);

    public ActionQos {
        maxAttempts = maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        backoffMillis = Math.max(1L, backoffMillis);
        backoffMultiplier = backoffMultiplier >= 1.0 ? backoffMultiplier : DEFAULT_MULTIPLIER;
        backoffMaxInterval = Math.max(backoffMillis, backoffMaxInterval);
    }

    public static ActionQos of(int maxAttempts, long backoffMillis) {
        return new ActionQos(maxAttempts, backoffMillis, DEFAULT_MULTIPLIER, DEFAULT_MAX_INTERVAL, false);
    }

    /**
     * A fresh template per call so retry state is never shared between invocations.
     */
    public RetryTemplate retryTemplate() {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(maxAttempts));
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(backoffMillis);
        backOff.setMultiplier(backoffMultiplier);
        backOff.setMaxInterval(backoffMaxInterval);
        template.setBackOffPolicy(backOff);
        return template;
    }
}
