package com.company.adaptive.controller;

import com.company.adaptive.dto.response.JobSnapshot;
import com.company.adaptive.service.AdaptiveRuntimeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Inspection and control of maintenance jobs. New jobs can only be scheduled in-process.
 */
@RestController
@RequestMapping("/api/v1/jobs")
@Tag(name = "Maintenance Jobs", description = "List, trigger and remove maintenance jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final AdaptiveRuntimeService runtimeService;

    @GetMapping
    @Operation(summary = "Snapshot of every scheduled job")
    public ResponseEntity<List<JobSnapshot>> listJobs() {
        return ResponseEntity.ok(runtimeService.listJobs());
    }

    @PostMapping("/{name}/run")
    @Operation(summary = "Make a job due on the next tick")
    public ResponseEntity<JobSnapshot> trigger(@PathVariable String name) {
        log.info("Manual trigger requested for job {}", name);
        return ResponseEntity.accepted().body(runtimeService.triggerJob(name));
    }

    @DeleteMapping("/{name}")
    @Operation(summary = "Unschedule a job; succeeds whether or not it exists")
    public ResponseEntity<Void> unschedule(@PathVariable String name) {
        runtimeService.unscheduleJob(name);
        return ResponseEntity.noContent().build();
    }
}
