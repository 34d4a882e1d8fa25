package com.grantlens.search.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SearchDegradationRecorder {
    public static final String METRIC_NAME = "grantlens.search.degraded";

    private static final Logger log = LoggerFactory.getLogger(SearchDegradationRecorder.class);

    private final MeterRegistry meterRegistry;

    public SearchDegradationRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void record(String stage, String reason) {
        record(stage, reason, null);
    }

    public void record(String stage, String reason, String detail) {
        String safeReason = reason == null || reason.isBlank() ? "unknown" : reason;
        meterRegistry.counter(METRIC_NAME, "stage", stage, "reason", safeReason).increment();
        if (detail == null) {
            log.warn("search stage degraded stage={} reason={}", stage, safeReason);
        } else {
            log.warn("search stage degraded stage={} reason={} detail={}", stage, safeReason, detail);
        }
    }
}
