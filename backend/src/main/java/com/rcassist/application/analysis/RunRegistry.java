package com.rcassist.application.analysis;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Cancellation tokens of in-flight runs, keyed by the caller's request id. Holds nothing once a
 * run has finished.
 */
@Slf4j
@Component
public class RunRegistry {

    private final ConcurrentMap<String, RunCancellation> active = new ConcurrentHashMap<>();

    /**
     * @throws IllegalArgumentException when a run with the same request id is still in flight
     */
    public RunCancellation register(String requestId) {
        RunCancellation cancellation = new RunCancellation();
        if (active.putIfAbsent(requestId, cancellation) != null) {
            throw new IllegalArgumentException("A run with request id '" + requestId + "' is already in progress");
        }
        return cancellation;
    }

    public void release(String requestId, RunCancellation cancellation) {
        active.remove(requestId, cancellation);
    }

    /**
     * @return false when no run with this request id is in flight
     */
    public boolean cancel(String requestId) {
        RunCancellation cancellation = active.get(requestId);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel();
        log.info("[Registry] Cancellation requested for {}", requestId);
        return true;
    }
}
