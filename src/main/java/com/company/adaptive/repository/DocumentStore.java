package com.company.adaptive.repository;

import com.company.adaptive.domain.enums.OperationKind;
import com.company.adaptive.dto.request.StoreRequest;
import com.company.adaptive.dto.response.StoreResult;

/**
 * The backing document store as seen by the adaptive runtime. Calls are synchronous;
 * the runtime only calls {@link #execute} to serve an operation or fill a cache miss.
 */
public interface DocumentStore {

    StoreResult execute(String scope, OperationKind kind, String collection, StoreRequest request);

    /**
     * Liveness check used by the watchdog. Must not throw.
     */
    boolean isReachable();

    /**
     * Attempts to restore connectivity.
     *
     * @throws com.company.adaptive.exception.StoreUnavailableException if the attempt fails
     */
    void reconnect();
}
