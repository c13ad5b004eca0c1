package com.company.adaptive.controller;

import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.request.StoreRequest;
import com.company.adaptive.dto.response.StoreResult;
import com.company.adaptive.service.StoreOperationService;
import com.company.adaptive.web.ScopeResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/collections/{collection}")
@Tag(name = "Documents", description = "Store operations routed through the adaptive runtime")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

    private final StoreOperationService storeOperationService;
    private final MeterRegistry meterRegistry;

    @PostMapping("/query")
    @Operation(summary = "Query documents", description = "Served from the result cache when possible")
    public ResponseEntity<StoreResult> query(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader,
            @PathVariable String collection,
            @Valid @RequestBody StoreRequest request) {
        return ResponseEntity.ok(execute(scopeHeader, OperationKind.QUERY, collection, request));
    }

    @PostMapping("/documents")
    @Operation(summary = "Insert documents")
    public ResponseEntity<StoreResult> insert(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader,
            @PathVariable String collection,
            @Valid @RequestBody StoreRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(execute(scopeHeader, OperationKind.INSERT, collection, request));
    }

    @PutMapping("/documents")
    @Operation(summary = "Update documents by id")
    public ResponseEntity<StoreResult> update(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader,
            @PathVariable String collection,
            @Valid @RequestBody StoreRequest request) {
        return ResponseEntity.ok(execute(scopeHeader, OperationKind.UPDATE, collection, request));
    }

    @DeleteMapping("/documents")
    @Operation(summary = "Delete documents by id or metadata filter")
    public ResponseEntity<StoreResult> delete(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader,
            @PathVariable String collection,
            @Valid @RequestBody StoreRequest request) {
        return ResponseEntity.ok(execute(scopeHeader, OperationKind.DELETE, collection, request));
    }

    private StoreResult execute(String scopeHeader, OperationKind kind, String collection, StoreRequest request) {
        String scope = ScopeResolver.resolve(scopeHeader);

        meterRegistry.counter("api.collections.requests",
                "operation", kind.tagValue()
        ).increment();
        log.debug("{} on {} in scope {}", kind.tagValue(), collection, scope);

        return storeOperationService.execute(scope, kind, collection, request);
    }
}
