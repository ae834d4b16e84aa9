package com.mediacache.application;

import com.mediacache.domain.model.RelocationMethod;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Counters for relocation outcomes. No paths or user ids are used as tags.
 */
@Slf4j
public class RelocationMetrics {

    private final MeterRegistry meterRegistry;

    public RelocationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("Initialized relocation metrics");
    }

    public void recordCommitted(RelocationMethod method) {
        meterRegistry.counter("mediacache.relocations.committed", "method", method.getDbValue()).increment();
    }

    public void recordFailed(RelocationMethod method) {
        meterRegistry.counter("mediacache.relocations.failed",
            "method", method == null ? "none" : method.getDbValue()).increment();
    }

    public void recordRolledBack(RelocationMethod method, boolean complete) {
        meterRegistry.counter("mediacache.relocations.rolled_back",
            "method", method == null ? "none" : method.getDbValue(),
            "complete", String.valueOf(complete)).increment();
    }

    public void recordReleased(RelocationMethod method) {
        meterRegistry.counter("mediacache.releases.completed", "method", method.getDbValue()).increment();
    }

    public void recordRateLimited() {
        meterRegistry.counter("mediacache.rate_limit.rejected").increment();
    }

    public void recordIntegrityMismatch(String status) {
        meterRegistry.counter("mediacache.integrity.mismatches", "status", status).increment();
    }
}
