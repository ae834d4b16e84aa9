package com.mediacache.application;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of one integrity pass. Lists every record checked; nothing is repaired.
 */
@Value
public class IntegrityReport {
    Instant checkedAt;
    List<IntegrityFinding> findings;

    public int getChecked() {
        return findings.size();
    }

    public List<IntegrityFinding> getInconsistencies() {
        return findings.stream().filter(f -> !f.isConsistent()).collect(Collectors.toList());
    }

    public boolean isClean() {
        return findings.stream().allMatch(IntegrityFinding::isConsistent);
    }
}
