package com.company.adaptive.service;

import com.company.adaptive.event.DocumentsChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Drops cached read results of a scope once a write lands in it. Runs on the
 * publishing thread, so the write call only returns after the scope is clean.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheEvictionService {

    private final AdaptiveRuntimeService runtimeService;

    @EventListener
    public void onDocumentsChanged(DocumentsChangedEvent event) {
        int evicted = runtimeService.invalidateCache(event.getScope(), null);
        log.debug("Evicted {} cached results in scope {} after {} on {}",
                evicted, event.getScope(), event.getKind().tagValue(), event.getCollection());
    }
}
