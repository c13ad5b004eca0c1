package com.company.adaptive.controller;

import com.company.adaptive.domain.enums.HealthState;
import com.company.adaptive.dto.response.HealthReport;
import com.company.adaptive.service.AdaptiveRuntimeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/health")
@Tag(name = "Health", description = "Runtime health and resource status")
@RequiredArgsConstructor
public class HealthController {

    private final AdaptiveRuntimeService runtimeService;

    /**
     * 200 while healthy or degraded, 503 once unhealthy; the body is the same either way.
     */
    @GetMapping
    @Operation(summary = "Health status with rolling-window counters and host resources")
    public ResponseEntity<HealthReport> health() {
        HealthReport report = runtimeService.getHealth();
        HttpStatus status = report.getStatus() == HealthState.UNHEALTHY
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }
}
