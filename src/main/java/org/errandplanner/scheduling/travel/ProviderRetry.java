package org.errandplanner.scheduling.travel;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry policy shared by every collaborator call of a planning pass.
 *
 * <p>Only {@link ProviderException} is retried, up to the configured number of attempts,
 * with the wait doubling after each failure. Any other exception propagates on the first
 * attempt. Backoff below one millisecond is raised to one millisecond.</p>
 */
public final class ProviderRetry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRetry.class);

    static final double BACKOFF_MULTIPLIER = 2.0d;

    private ProviderRetry() {
    }

    /**
     * Builds a registry whose default configuration is the provider policy.
     *
     * @param maxAttempts attempts per call; must be {@code >= 1}.
     * @param backoffMillis wait before the first retry; must be {@code >= 0}.
     */
    public static RetryRegistry registry(int maxAttempts, long backoffMillis) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMillis < 0) {
            throw new IllegalArgumentException("backoffMillis must be >= 0");
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Math.max(1L, backoffMillis), BACKOFF_MULTIPLIER))
                .retryExceptions(ProviderException.class)
                .build();
        return RetryRegistry.of(config);
    }

    /**
     * Returns the named retry from {@code registry} with retry attempts logged at debug level.
     * Call once per name; each call adds another listener.
     */
    public static Retry named(RetryRegistry registry, String name) {
        Retry retry = registry.retry(name);
        retry.getEventPublisher().onRetry(event -> log.debug(
                "Provider: {} failed (attempt {}), retrying in {} ms: {}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()
        ));
        return retry;
    }
}
