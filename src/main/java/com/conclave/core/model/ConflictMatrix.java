package com.conclave.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, symmetric table of pairwise conflicts. Only conflicting pairs are stored.
 * Safe to share across threads without locking.
 */
public final class ConflictMatrix implements Serializable {

    /**
     * Unordered pair of task IDs, normalised so that {@code first < second}.
     */
    public record TaskPair(String first, String second) implements Serializable {
        public static TaskPair of(String a, String b) {
            return a.compareTo(b) <= 0 ? new TaskPair(a, b) : new TaskPair(b, a);
        }
    }

    /**
     * Serialisable form of one conflicting pair.
     */
    public record Entry(String first, String second, ConflictDescriptor descriptor) implements Serializable {}

    public static final ConflictMatrix EMPTY = new ConflictMatrix(Map.of());

    private final Map<TaskPair, ConflictDescriptor> conflicts;

    private ConflictMatrix(Map<TaskPair, ConflictDescriptor> conflicts) {
        this.conflicts = Map.copyOf(conflicts);
    }

    public static ConflictMatrix fromEntries(Collection<Entry> entries) {
        var map = new HashMap<TaskPair, ConflictDescriptor>();
        if (entries != null) {
            for (var entry : entries) {
                if (entry.descriptor() != null && entry.descriptor().hasConflict()) {
                    map.put(TaskPair.of(entry.first(), entry.second()), entry.descriptor());
                }
            }
        }
        return new ConflictMatrix(map);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Descriptor for the pair, {@link ConflictDescriptor#NONE} when they do not conflict. */
    public ConflictDescriptor get(String a, String b) {
        if (a.equals(b)) {
            return ConflictDescriptor.NONE;
        }
        return conflicts.getOrDefault(TaskPair.of(a, b), ConflictDescriptor.NONE);
    }

    public boolean conflicts(String a, String b) {
        return get(a, b).hasConflict();
    }

    public boolean conflictsWithAny(String taskId, Collection<String> others) {
        for (String other : others) {
            if (conflicts(taskId, other)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return conflicts.size();
    }

    /** Entries sorted by pair, for checkpoints and display. */
    public List<Entry> entries() {
        var entries = new ArrayList<Entry>(conflicts.size());
        conflicts.forEach((pair, descriptor) -> entries.add(new Entry(pair.first(), pair.second(), descriptor)));
        entries.sort(Comparator.comparing(Entry::first).thenComparing(Entry::second));
        return entries;
    }

    public static final class Builder {
        private final Map<TaskPair, ConflictDescriptor> conflicts = new HashMap<>();

        public Builder put(String a, String b, ConflictDescriptor descriptor) {
            if (!a.equals(b) && descriptor.hasConflict()) {
                conflicts.put(TaskPair.of(a, b), descriptor);
            }
            return this;
        }

        public ConflictMatrix build() {
            return new ConflictMatrix(conflicts);
        }
    }
}
