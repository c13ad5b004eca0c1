package com.company.adaptive.controller;

import com.company.adaptive.domain.ScalingRecommendation;
import com.company.adaptive.service.AdaptiveRuntimeService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/scaling")
@Tag(name = "Scaling", description = "Scaling advice derived from health and volume")
@RequiredArgsConstructor
public class ScalingController {

    private final AdaptiveRuntimeService runtimeService;
    private final MeterRegistry meterRegistry;

    @GetMapping("/recommendation")
    @Operation(summary = "Fresh scaling recommendation", description = "Recomputed on every call")
    public ResponseEntity<ScalingRecommendation> recommendation() {
        ScalingRecommendation recommendation = runtimeService.getScalingRecommendation();

        meterRegistry.counter("api.scaling.recommendations",
                "direction", recommendation.getDirection().name()
        ).increment();

        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(recommendation);
    }

    @GetMapping("/history")
    @Operation(summary = "Recently issued recommendations, oldest first")
    public ResponseEntity<List<ScalingRecommendation>> history() {
        return ResponseEntity.ok(runtimeService.getScalingHistory());
    }
}
