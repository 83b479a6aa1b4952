package work.lcod.pipeline.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-action outcomes of one run, keyed by status key and kept in insertion order. Safe to update
 * from parallel actions.
 */
public final class StatusReport {
    private final Map<String, ActionOutcome> outcomes = new LinkedHashMap<>();

    public synchronized void put(ActionOutcome outcome) {
        outcomes.put(outcome.key(), outcome);
    }

    public void putAll(StatusReport other) {
        if (other == null || other == this) {
            return;
        }
        var entries = other.snapshot();
        synchronized (this) {
            outcomes.putAll(entries);
        }
    }

    public synchronized ActionOutcome get(String key) {
        return outcomes.get(key);
    }

    public synchronized int size() {
        return outcomes.size();
    }

    public synchronized boolean isEmpty() {
        return outcomes.isEmpty();
    }

    public synchronized Map<String, ActionOutcome> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public Map<String, Object> toSerializableMap() {
        var map = new LinkedHashMap<String, Object>();
        snapshot().forEach((key, outcome) -> map.put(key, outcome.toSerializableMap()));
        return map;
    }
}
