package com.company.adaptive.controller;

import com.company.adaptive.dto.response.HotTrail;
import com.company.adaptive.dto.response.ScopeSummary;
import com.company.adaptive.dto.response.SmellReport;
import com.company.adaptive.service.AdaptiveRuntimeService;
import com.company.adaptive.web.ScopeResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/trails")
@Tag(name = "Trails", description = "Learned access patterns and usage smells")
@RequiredArgsConstructor
@Validated
public class TrailController {

    private final AdaptiveRuntimeService runtimeService;

    @GetMapping("/hot")
    @Operation(summary = "Hottest patterns of the scope, strongest first")
    public ResponseEntity<List<HotTrail>> hotTrails(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader,
            @RequestParam(defaultValue = "10") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(runtimeService.getHotTrails(ScopeResolver.resolve(scopeHeader), limit));
    }

    @GetMapping("/smells")
    @Operation(summary = "Thrashing patterns and expensive request shapes seen in the scope")
    public ResponseEntity<SmellReport> smells(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader) {
        return ResponseEntity.ok(runtimeService.getSmells(ScopeResolver.resolve(scopeHeader)));
    }

    @GetMapping("/summary")
    @Operation(summary = "Trail counts per operation kind and collection")
    public ResponseEntity<ScopeSummary> summary(
            @RequestHeader(value = ScopeResolver.SCOPE_HEADER, required = false) String scopeHeader) {
        return ResponseEntity.ok(runtimeService.getScopeSummary(ScopeResolver.resolve(scopeHeader)));
    }
}
