package com.company.adaptive.service;

import com.company.adaptive.cache.CacheKeyGenerator;
import com.company.adaptive.domain.PatternSignature;
import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.request.StoreRequest;
import com.company.adaptive.dto.response.StoreResult;
import com.company.adaptive.event.DocumentsChangedEvent;
import com.company.adaptive.exception.InvalidRequestException;
import com.company.adaptive.repository.DocumentStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Store operations with the adaptive layer around them. Queries are served from the
 * result cache when possible; writes go straight to the store and then clear the
 * scope's cached results. Every call, failed or not, is reported to the runtime.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StoreOperationService {

    private final DocumentStore documentStore;
    private final AdaptiveRuntimeService runtimeService;
    private final CacheKeyGenerator cacheKeyGenerator;
    private final SmellMonitor smellMonitor;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    public StoreResult execute(String scope, OperationKind kind, String collection, StoreRequest request) {
        if (scope == null || scope.isBlank()) {
            throw new InvalidRequestException("Scope must not be blank");
        }
        if (kind == null) {
            throw new InvalidRequestException("Operation kind is required");
        }
        if (collection == null || collection.isBlank()) {
            throw new InvalidRequestException("Collection name must not be blank");
        }

        PatternSignature signature = PatternSignature.of(kind, collection, request);
        smellMonitor.inspect(scope, kind, collection, request);

        long started = System.nanoTime();
        boolean success = false;
        try {
            StoreResult result = kind.isRead()
                    ? cachedRead(scope, kind, collection, request)
                    : write(scope, kind, collection, request);
            success = true;
            return result;
        } catch (RuntimeException e) {
            runtimeService.reportError(kind.tagValue() + " on " + collection + " failed: " + e.getMessage());
            log.warn("Store {} on {} failed in scope {}: {}", kind.tagValue(), collection, scope, e.getMessage());
            throw e;
        } finally {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            runtimeService.recordOperation(scope, kind, durationMs, success, signature);
            meterRegistry.counter("adaptive.store.operations",
                    "kind", kind.tagValue(),
                    "success", String.valueOf(success)
            ).increment();
        }
    }

    private StoreResult cachedRead(String scope, OperationKind kind, String collection, StoreRequest request) {
        Duration ttl = null;
        if (request != null && request.getTtlSeconds() != null) {
            if (request.getTtlSeconds() <= 0) {
                throw new InvalidRequestException("ttlSeconds must be positive, got " + request.getTtlSeconds());
            }
            ttl = Duration.ofSeconds(request.getTtlSeconds());
        }
        String key = cacheKeyGenerator.keyFor(scope, kind, collection, request);

        AtomicBoolean computed = new AtomicBoolean(false);
        // the cache holds its own copy; callers always get a detached one
        StoreResult result = runtimeService.cacheLookupOrCompute(scope, key, ttl, () -> {
            computed.set(true);
            return documentStore.execute(scope, kind, collection, request).copy(false);
        });
        if (computed.get()) {
            return result.copy(false);
        }
        log.debug("Cache hit for {} on {} in scope {}", kind.tagValue(), collection, scope);
        return result.copy(true);
    }

    private StoreResult write(String scope, OperationKind kind, String collection, StoreRequest request) {
        StoreResult result = documentStore.execute(scope, kind, collection, request);
        eventPublisher.publishEvent(new DocumentsChangedEvent(scope, collection, kind, result.getAffected()));
        return result;
    }
}
