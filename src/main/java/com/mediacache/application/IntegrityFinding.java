package com.mediacache.application;

import com.mediacache.domain.model.RecordState;
import lombok.Value;

import java.nio.file.Path;

@Value
public class IntegrityFinding {
    String recordId;
    Path originalPath;
    RecordState state;
    boolean checksumValid;
    PathStatus pathStatus;

    public boolean isConsistent() {
        return checksumValid && pathStatus.isConsistent();
    }
}
