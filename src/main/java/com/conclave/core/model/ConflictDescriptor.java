package com.conclave.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Result of comparing two tasks for conflicts.
 *
 * @param dimensions the dimensions on which the tasks conflict
 * @param reasons    human-readable explanation per detected conflict
 */
public record ConflictDescriptor(
    Set<ConflictDimension> dimensions,
    List<String> reasons
) implements Serializable {

    public static final ConflictDescriptor NONE = new ConflictDescriptor(Set.of(), List.of());

    public ConflictDescriptor {
        dimensions = dimensions == null || dimensions.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(dimensions));
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    @JsonIgnore
    public boolean hasConflict() {
        return !dimensions.isEmpty();
    }

    /** Number of dimensions on which the pair conflicts. */
    public int severity() {
        return dimensions.size();
    }
}
