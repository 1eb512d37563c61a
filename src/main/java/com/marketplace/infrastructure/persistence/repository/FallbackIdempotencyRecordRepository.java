package com.marketplace.infrastructure.persistence.repository;

import com.marketplace.infrastructure.persistence.entity.IdempotencyRecordEntity;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Shared cache first, process-local map when the cache is unavailable.
 *
 * Calls to the cache go through a circuit breaker so an unreachable cache costs one
 * fast rejection per call instead of a connect timeout. While degraded, records live
 * only in this process: idempotency then holds per instance, not across the fleet.
 * Records written while degraded are not copied back once the cache recovers.
 */
@Slf4j
public class FallbackIdempotencyRecordRepository implements IdempotencyRecordRepository {

    private final IdempotencyRecordRepository primary;
    private final IdempotencyRecordRepository fallback;
    private final CircuitBreaker circuitBreaker;
    private final Counter fallbackCounter;
    private final AtomicBoolean degraded = new AtomicBoolean();

    public FallbackIdempotencyRecordRepository(IdempotencyRecordRepository primary,
                                               IdempotencyRecordRepository fallback,
                                               CircuitBreaker circuitBreaker,
                                               MeterRegistry meterRegistry) {
        this.primary = primary;
        this.fallback = fallback;
        this.circuitBreaker = circuitBreaker;
        this.fallbackCounter = Counter.builder("queue.idempotency.fallback")
                .description("Idempotency operations served by the in-process store")
                .register(meterRegistry);
    }

    @Override
    public Optional<IdempotencyRecordEntity> saveIfAbsent(IdempotencyRecordEntity record, Duration ttl) {
        return withFallback(
                () -> primary.saveIfAbsent(record, ttl),
                () -> fallback.saveIfAbsent(record, ttl));
    }

    @Override
    public boolean deleteIfMatches(String key, String fingerprint) {
        return withFallback(
                () -> primary.deleteIfMatches(key, fingerprint),
                () -> {
                    boolean deleted = fallback.deleteIfMatches(key, fingerprint);
                    if (!deleted) {
                        log.warn("Cannot release idempotency key {} while the cache is unavailable; "
                                + "a cached record outlives this call until its TTL", key);
                    }
                    return deleted;
                });
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    private <R> R withFallback(Supplier<R> primaryCall, Supplier<R> fallbackCall) {
        try {
            R result = circuitBreaker.executeSupplier(primaryCall);
            if (degraded.compareAndSet(true, false)) {
                log.info("Idempotency cache reachable again, leaving in-process fallback");
            }
            return result;
        } catch (DataAccessException | CallNotPermittedException e) {
            if (degraded.compareAndSet(false, true)) {
                log.warn("Idempotency cache unavailable, using in-process store "
                        + "(duplicates are only detected within this instance): {}", e.getMessage());
            }
            fallbackCounter.increment();
            return fallbackCall.get();
        }
    }
}
