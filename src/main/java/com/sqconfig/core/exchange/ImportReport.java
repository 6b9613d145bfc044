package com.sqconfig.core.exchange;

import com.sqconfig.core.model.ObjectType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-object outcome of an import.
 */
public class ImportReport {

    public record Entry(ObjectType type, String key, ImportStatus status, String reason) {
        @Override
        public String toString() {
            return reason == null ? status.name() : status + "/" + reason;
        }
    }

    private final List<Entry> entries = new ArrayList<>();
    private final List<ObjectType> skippedTypes = new ArrayList<>();

    public synchronized void record(ObjectType type, String key, ImportStatus status, String reason) {
        entries.add(new Entry(type, key, status, reason));
    }

    public synchronized void skipType(ObjectType type) {
        skippedTypes.add(type);
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    public synchronized List<ObjectType> skippedTypes() {
        return List.copyOf(skippedTypes);
    }

    public synchronized Map<ImportStatus, Integer> counts() {
        var counts = new EnumMap<ImportStatus, Integer>(ImportStatus.class);
        entries.forEach(e -> counts.merge(e.status(), 1, Integer::sum));
        return Collections.unmodifiableMap(counts);
    }

    public synchronized int count(ImportStatus status) {
        return (int) entries.stream().filter(e -> e.status() == status).count();
    }

    public synchronized List<Entry> failures() {
        return entries.stream().filter(e -> e.status() == ImportStatus.FAILED).toList();
    }

    public synchronized ImportStatus statusOf(ObjectType type, String key) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            var e = entries.get(i);
            if (e.type() == type && e.key().equals(key)) {
                return e.status();
            }
        }
        return null;
    }
}
