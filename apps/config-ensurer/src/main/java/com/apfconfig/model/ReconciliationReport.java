package com.apfconfig.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record ReconciliationReport(
        String id,
        Status status,
        Instant startedAt,
        Instant finishedAt,
        Map<String, List<String>> removed,
        String error
) {

    public enum Status {
        SUCCEEDED,
        FAILED
    }

    public static ReconciliationReport success(String id, Instant startedAt, Instant finishedAt,
            Map<String, List<String>> removed) {
        return new ReconciliationReport(id, Status.SUCCEEDED, startedAt, finishedAt, Map.copyOf(removed), null);
    }

    public static ReconciliationReport failure(String id, Instant startedAt, Instant finishedAt, String error) {
        return new ReconciliationReport(id, Status.FAILED, startedAt, finishedAt, Map.of(), error);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
