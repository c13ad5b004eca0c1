package com.company.adaptive.service;

import com.company.adaptive.cache.CacheKeyGenerator;
import com.company.adaptive.config.AdaptiveRuntimeProperties;
import com.company.adaptive.domain.SmellFinding;
import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.domain.enums.Severity;
import com.company.adaptive.domain.enums.SmellType;
import com.company.adaptive.dto.request.StoreRequest;
import com.company.adaptive.dto.response.SmellReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Flags request shapes that are expensive regardless of how often they occur:
 * oversized result limits, huge insert batches and sprawling metadata filters.
 * Findings are kept in a bounded history, oldest dropped first.
 */
@Component
@Slf4j
public class SmellMonitor {

    private static final int RECENT_LIMIT = 20;

    private final AdaptiveRuntimeProperties.Smells settings;
    private final CacheKeyGenerator cacheKeyGenerator;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<SmellFinding> history = new ArrayDeque<>();

    public SmellMonitor(AdaptiveRuntimeProperties properties, CacheKeyGenerator cacheKeyGenerator, Clock clock) {
        this.settings = properties.getSmells();
        this.cacheKeyGenerator = cacheKeyGenerator;
        this.clock = clock;
    }

    public List<SmellFinding> inspect(String scope, OperationKind kind, String collection, StoreRequest request) {
        if (request == null) {
            return List.of();
        }
        Instant now = clock.instant();
        List<SmellFinding> findings = new ArrayList<>();

        if (kind == OperationKind.QUERY && request.getLimit() != null
                && request.getLimit() > settings.getMaxQueryResults()) {
            findings.add(finding(SmellType.EXCESSIVE_RESULTS, Severity.WARNING, scope, kind, collection,
                    "Query requests " + request.getLimit() + " results", now));
        }
        if (kind == OperationKind.INSERT && request.getDocuments() != null
                && request.getDocuments().size() > settings.getMaxBatchSize()) {
            findings.add(finding(SmellType.LARGE_BATCH, Severity.WARNING, scope, kind, collection,
                    "Insert of " + request.getDocuments().size() + " documents", now));
        }
        if (request.getWhere() != null && !request.getWhere().isEmpty()) {
            int length = cacheKeyGenerator.canonicalJson(request.getWhere()).length();
            if (length > settings.getMaxFilterLength()) {
                findings.add(finding(SmellType.COMPLEX_FILTER, Severity.INFO, scope, kind, collection,
                        "Filter spans " + length + " characters", now));
            }
        }

        if (!findings.isEmpty()) {
            lock.lock();
            try {
                for (SmellFinding finding : findings) {
                    history.addLast(finding);
                    if (history.size() > settings.getHistorySize()) {
                        history.removeFirst();
                    }
                }
            } finally {
                lock.unlock();
            }
            findings.forEach(f -> log.debug("Smell {} on {} in scope {}: {}",
                    f.getType(), collection, scope, f.getDescription()));
        }
        return findings;
    }

    /**
     * Combines the retained shape findings of a scope with the given thrashing findings.
     */
    public SmellReport report(String scope, List<SmellFinding> thrashing) {
        List<SmellFinding> shapeFindings = new ArrayList<>();
        lock.lock();
        try {
            Iterator<SmellFinding> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext()) {
                SmellFinding finding = newestFirst.next();
                if (finding.getScope().equals(scope)) {
                    shapeFindings.add(finding);
                }
            }
        } finally {
            lock.unlock();
        }

        Map<String, Long> byType = new TreeMap<>();
        Map<String, Long> bySeverity = new TreeMap<>();
        List<SmellFinding> all = new ArrayList<>(thrashing);
        all.addAll(shapeFindings);
        for (SmellFinding finding : all) {
            byType.merge(finding.getType().name(), 1L, Long::sum);
            bySeverity.merge(finding.getSeverity().name(), 1L, Long::sum);
        }

        return SmellReport.builder()
                .scope(scope)
                .totalSmells(all.size())
                .byType(byType)
                .bySeverity(bySeverity)
                .thrashing(List.copyOf(thrashing))
                .recent(List.copyOf(shapeFindings.subList(0, Math.min(RECENT_LIMIT, shapeFindings.size()))))
                .build();
    }

    private static SmellFinding finding(SmellType type, Severity severity, String scope, OperationKind kind,
                                        String collection, String description, Instant now) {
        return SmellFinding.builder()
                .type(type)
                .severity(severity)
                .scope(scope)
                .operationKind(kind)
                .collection(collection)
                .description(description)
                .suggestion(type.getSuggestion())
                .detectedAt(now)
                .build();
    }
}
