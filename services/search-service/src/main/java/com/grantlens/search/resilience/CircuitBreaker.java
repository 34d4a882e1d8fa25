package com.grantlens.search.resilience;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public class CircuitBreaker {
    private final String name;
    private final int failureThreshold;
    private final long openDurationMs;
    private final AtomicInteger failureCount = new AtomicInteger(0);
    private final AtomicLong openUntilMs = new AtomicLong(0L);

    public CircuitBreaker(String name, int failureThreshold, long openDurationMs) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDurationMs = Math.max(1L, openDurationMs);
    }

    public String getName() {
        return name;
    }

    public boolean allowRequest() {
        return System.currentTimeMillis() >= openUntilMs.get();
    }

    public void recordSuccess() {
        failureCount.set(0);
    }

    public boolean recordFailure() {
        int failures = failureCount.incrementAndGet();
        if (failures >= failureThreshold) {
            openUntilMs.set(System.currentTimeMillis() + openDurationMs);
            failureCount.set(0);
            return true;
        }
        return false;
    }
}
