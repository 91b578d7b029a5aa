package org.errandplanner.scheduling.travel;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.Value;
import org.errandplanner.scheduling.model.AccessType;
import org.errandplanner.scheduling.model.LocationSpec;
import org.errandplanner.scheduling.model.Place;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Pass-scoped access point to the travel collaborators.
 *
 * <p>Responsibilities:</p>
 * <ul>
 * <li>Bounded retry with exponential backoff for {@link ProviderException}, through the
 *     {@link ProviderRetry} policy.</li>
 * <li>Exhausted retries degrade to "infeasible" (or no candidates) instead of failing the pass.</li>
 * <li>Memoization of estimates for the lifetime of one pass so repeated cascade attempts
 *     see identical answers.</li>
 * </ul>
 *
 * <p>Reads are safe from multiple threads; the memo is a {@link ConcurrentHashMap}.</p>
 */
public final class TravelGateway {
    private static final Logger log = LoggerFactory.getLogger(TravelGateway.class);

    private final TravelTimeProvider travelTimeProvider;
    private final LocationResolver locationResolver;
    private final int maxAttempts;
    private final Retry estimateRetry;
    private final Retry candidateRetry;

    private final ConcurrentHashMap<EstimateKey, TravelEstimate> estimates = new ConcurrentHashMap<>();
    private final AtomicInteger providerCalls = new AtomicInteger();
    private final AtomicInteger providerFailures = new AtomicInteger();
    private final AtomicInteger exhaustedQueries = new AtomicInteger();

    /**
     * Creates a gateway.
     *
     * @param travelTimeProvider directions collaborator.
     * @param locationResolver places collaborator (nullable when no open locations are used).
     * @param maxAttempts attempts per query; must be {@code >= 1}.
     * @param backoffMillis base backoff; doubled after each failed attempt.
     */
    public TravelGateway(
            TravelTimeProvider travelTimeProvider,
            LocationResolver locationResolver,
            int maxAttempts,
            long backoffMillis
    ) {
        RetryRegistry registry = ProviderRetry.registry(maxAttempts, backoffMillis);
        this.travelTimeProvider = Objects.requireNonNull(travelTimeProvider, "travelTimeProvider");
        this.locationResolver = locationResolver;
        this.maxAttempts = maxAttempts;
        this.estimateRetry = ProviderRetry.named(registry, "travelEstimate");
        this.candidateRetry = ProviderRetry.named(registry, "locationCandidates");
    }

    /**
     * Estimates travel between two places; identical places cost nothing.
     *
     * @return provider estimate, or {@link TravelEstimate#infeasible()} when retries are exhausted.
     */
    public TravelEstimate estimate(Place origin, Place destination, AccessType accessType, LocalDateTime departure) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
        if (origin.equals(destination)) {
            return TravelEstimate.noTravel();
        }
        EstimateKey key = new EstimateKey(origin, destination, accessType, departure);
        TravelEstimate cached = estimates.get(key);
        if (cached != null) {
            return cached;
        }
        TravelEstimate estimate = withRetry(
                estimateRetry,
                "estimate " + origin.getLabel() + " -> " + destination.getLabel(),
                () -> Objects.requireNonNull(
                        travelTimeProvider.estimate(origin, destination, accessType, departure),
                        "travel estimate"
                ),
                TravelEstimate.infeasible()
        );
        TravelEstimate previous = estimates.putIfAbsent(key, estimate);
        return previous == null ? estimate : previous;
    }

    /**
     * Lists candidate branches for an open location.
     *
     * @return resolver candidates, or an empty list when retries are exhausted.
     */
    public List<LocationCandidate> candidates(LocationSpec spec, Place origin, int radiusBudgetMinutes) {
        if (locationResolver == null) {
            throw new IllegalStateException("open location " + spec.getStoreCategory() + " requires a LocationResolver");
        }
        return withRetry(
                candidateRetry,
                "candidates " + spec.getStoreCategory() + " near " + origin.getLabel(),
                () -> List.copyOf(locationResolver.candidates(spec, origin, radiusBudgetMinutes)),
                List.of()
        );
    }

    public int providerCalls() {
        return providerCalls.get();
    }

    public int providerFailures() {
        return providerFailures.get();
    }

    public int exhaustedQueries() {
        return exhaustedQueries.get();
    }

    private <T> T withRetry(Retry retry, String description, Supplier<T> call, T fallback) {
        Supplier<T> counted = () -> {
            providerCalls.incrementAndGet();
            try {
                return call.get();
            } catch (ProviderException ex) {
                providerFailures.incrementAndGet();
                throw ex;
            }
        };
        try {
            return Retry.decorateSupplier(retry, counted).get();
        } catch (ProviderException ex) {
            exhaustedQueries.incrementAndGet();
            log.warn("Provider: {} failed after {} attempts ({}: {}), treating as infeasible",
                    description, maxAttempts, ex.reasonCode(), ex.getMessage());
            return fallback;
        }
    }

    @Value
    private static class EstimateKey {
        Place origin;
        Place destination;
        AccessType accessType;
        LocalDateTime departure;
    }
}
