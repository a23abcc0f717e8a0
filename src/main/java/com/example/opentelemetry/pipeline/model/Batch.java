package com.example.opentelemetry.pipeline.model;

import com.google.common.base.MoreObjects;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An immutable, ordered group of records of mixed signal types, bound for a fixed set of exporters.
 */
public final class Batch {

    private final long sequence;
    private final long createdUnixNano;
    private final List<TelemetryRecord> records;
    private final Set<String> destinations;

    public Batch(long sequence, long createdUnixNano, List<TelemetryRecord> records, Set<String> destinations) {
        this.sequence = sequence;
        this.createdUnixNano = createdUnixNano;
        this.records = List.copyOf(records);
        this.destinations = Set.copyOf(destinations);
    }

    public long sequence() {
        return sequence;
    }

    public long createdUnixNano() {
        return createdUnixNano;
    }

    public List<TelemetryRecord> records() {
        return records;
    }

    public Set<String> destinations() {
        return destinations;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Splits the batch per signal type, keeping the arrival order inside each group and ordering the groups by
     * the first appearance of their signal.
     */
    public Map<SignalType, List<TelemetryRecord>> recordsBySignal() {
        Map<SignalType, List<TelemetryRecord>> groups = new LinkedHashMap<>();
        for (TelemetryRecord record : records) {
            groups.computeIfAbsent(record.signalType(), signal -> new ArrayList<>()).add(record);
        }
        groups.replaceAll((signal, group) -> Collections.unmodifiableList(group));
        return Collections.unmodifiableMap(groups);
    }

    public Map<SignalType, Integer> countsBySignal() {
        Map<SignalType, Integer> counts = new EnumMap<>(SignalType.class);
        for (TelemetryRecord record : records) {
            counts.merge(record.signalType(), 1, Integer::sum);
        }
        return counts;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("sequence", sequence)
                .add("size", records.size())
                .add("destinations", destinations)
                .toString();
    }
}
