package com.mock.resource.diagnostics;

import com.mock.resource.serialize.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scenario-scoped log of dispatched requests, filled only while diagnostics are on.
 * Either the process-wide {@link Diagnostics} toggle or the per-context flag enables it.
 */
public class DispatchRecorder {
    private static final Logger log = LoggerFactory.getLogger(DispatchRecorder.class);

    private final boolean alwaysEnabled;
    private final List<DispatchRecord> records = new ArrayList<>();

    public DispatchRecorder() {
        this(false);
    }

    public DispatchRecorder(boolean alwaysEnabled) {
        this.alwaysEnabled = alwaysEnabled;
    }

    public boolean isRecording() {
        return alwaysEnabled || Diagnostics.isEnabled();
    }

    public void record(String verb, String path, Document response) {
        if (!isRecording()) {
            return;
        }
        records.add(new DispatchRecord(verb, path, response, Instant.now()));
        log.debug("Recorded {} {} -> {}", verb, path, response.content());
    }

    /**
     * Recorded dispatches in order.
     */
    public List<DispatchRecord> records() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public List<String> recordedPaths() {
        return records.stream().map(DispatchRecord::path).toList();
    }

    public void clear() {
        records.clear();
    }
}
