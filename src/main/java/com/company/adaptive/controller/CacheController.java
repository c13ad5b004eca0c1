package com.company.adaptive.controller;

import com.company.adaptive.dto.response.CacheStatsResponse;
import com.company.adaptive.service.AdaptiveRuntimeService;
import com.company.adaptive.web.ScopeResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
@Tag(name = "Result Cache", description = "Inspect and invalidate cached read results")
@RequiredArgsConstructor
@Slf4j
public class CacheController {

    private final AdaptiveRuntimeService runtimeService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/stats")
    @Operation(summary = "Cache statistics for the caller's scope")
    public ResponseEntity<CacheStatsResponse> stats(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader) {
        return ResponseEntity.ok(runtimeService.getCacheStats(ScopeResolver.resolve(scopeHeader)));
    }

    @DeleteMapping
    @Operation(summary = "Invalidate one cached entry, or every entry of the scope")
    public ResponseEntity<Map<String, Object>> invalidate(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader,
            @Parameter(description = "Cache key; omit to clear the whole scope")
            @RequestParam(required = false) String key) {

        String scope = ScopeResolver.resolve(scopeHeader);
        meterRegistry.counter("api.cache.invalidate.requests",
                "mode", key == null ? "scope" : "key"
        ).increment();

        int removed = runtimeService.invalidateCache(scope, key);
        log.info("Invalidated {} cache entries in scope {}", removed, scope);
        return ResponseEntity.ok(Map.of("scope", scope, "removed", removed));
    }
}
