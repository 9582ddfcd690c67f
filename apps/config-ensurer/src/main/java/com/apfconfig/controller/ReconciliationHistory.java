package com.apfconfig.controller;

import com.apfconfig.model.ReconciliationReport;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class ReconciliationHistory {

    static final int DEFAULT_MAX_ENTRIES = 50;

    @ConfigProperty(name = "apf.bootstrap.history-size", defaultValue = "50")
    int maxEntries;

    private final Deque<ReconciliationReport> history = new ArrayDeque<>();

    public synchronized void record(ReconciliationReport report) {
        int limit = maxEntries > 0 ? maxEntries : DEFAULT_MAX_ENTRIES;
        while (history.size() >= limit) {
            history.removeFirst();
        }
        history.addLast(report);
    }

    public synchronized List<ReconciliationReport> export() {
        return new ArrayList<>(history);
    }

    public synchronized Optional<ReconciliationReport> latest() {
        return Optional.ofNullable(history.peekLast());
    }
}
