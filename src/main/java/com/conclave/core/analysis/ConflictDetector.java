package com.conclave.core.analysis;

import com.conclave.core.model.ConflictDescriptor;
import com.conclave.core.model.ConflictDimension;
import com.conclave.core.model.ConflictMatrix;
import com.conclave.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects whether two tasks may not run concurrently, across six dimensions: files,
 * components, exclusive resources, interfaces, data models and test environments.
 * Detection is symmetric and a task never conflicts with itself.
 */
@Component
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    public ConflictDescriptor detect(Task a, Task b) {
        if (a.id().equals(b.id())) {
            return ConflictDescriptor.NONE;
        }
        // Order the pair so reasons read the same whichever way round the call is made
        if (a.id().compareTo(b.id()) > 0) {
            Task swap = a;
            a = b;
            b = swap;
        }

        var dimensions = EnumSet.noneOf(ConflictDimension.class);
        var reasons = new ArrayList<String>();

        if (fileConflict(a, b, reasons)) {
            dimensions.add(ConflictDimension.FILE);
        }
        if (overlap("component", a.components(), b.components(), reasons)) {
            dimensions.add(ConflictDimension.SEMANTIC);
        }
        if (resourceConflict(a, b, reasons)) {
            dimensions.add(ConflictDimension.RESOURCE);
        }
        if (overlap("interface", a.interfaces(), b.interfaces(), reasons)) {
            dimensions.add(ConflictDimension.INTERFACE);
        }
        if (overlap("data model", a.dataModels(), b.dataModels(), reasons)) {
            dimensions.add(ConflictDimension.STATE);
        }
        if (overlap("test environment", a.testEnvironments(), b.testEnvironments(), reasons)) {
            dimensions.add(ConflictDimension.TEST_ENVIRONMENT);
        }

        if (dimensions.isEmpty()) {
            return ConflictDescriptor.NONE;
        }
        return new ConflictDescriptor(dimensions, reasons);
    }

    /**
     * Pairwise detection over all tasks; only conflicting pairs are stored.
     */
    public ConflictMatrix detectAll(List<Task> tasks) {
        var sorted = new ArrayList<>(tasks);
        sorted.sort(Comparator.comparing(Task::id));
        var builder = ConflictMatrix.builder();
        int conflicts = 0;
        for (int i = 0; i < sorted.size(); i++) {
            for (int j = i + 1; j < sorted.size(); j++) {
                Task a = sorted.get(i);
                Task b = sorted.get(j);
                ConflictDescriptor descriptor = detect(a, b);
                if (descriptor.hasConflict()) {
                    log.debug("Conflict {} <-> {}: {}", a.id(), b.id(), descriptor.reasons());
                    builder.put(a.id(), b.id(), descriptor);
                    conflicts++;
                }
            }
        }
        log.info("Conflict detection: {} tasks, {} conflicting pair(s)", sorted.size(), conflicts);
        return builder.build();
    }

    private boolean fileConflict(Task a, Task b, List<String> reasons) {
        boolean found = false;
        for (String fa : a.targetFiles()) {
            for (String fb : b.targetFiles()) {
                if (filesMatch(fa, fb)) {
                    reasons.add("both modify " + normalizePath(fa));
                    found = true;
                }
            }
        }
        for (String da : a.targetDirectories()) {
            for (String db : b.targetDirectories()) {
                if (isWithin(da, db) || isWithin(db, da)) {
                    reasons.add("overlapping directories " + normalizeDir(da) + " and " + normalizeDir(db));
                    found = true;
                }
            }
        }
        found |= fileInDirectory(a, b, reasons);
        found |= fileInDirectory(b, a, reasons);
        found |= fileImported(a, b, reasons);
        found |= fileImported(b, a, reasons);
        return found;
    }

    private boolean fileInDirectory(Task owner, Task other, List<String> reasons) {
        boolean found = false;
        for (String file : owner.targetFiles()) {
            for (String dir : other.targetDirectories()) {
                if (isWithin(file, dir)) {
                    reasons.add(owner.id() + " modifies " + normalizePath(file)
                            + " inside " + other.id() + " directory " + normalizeDir(dir));
                    found = true;
                }
            }
        }
        return found;
    }

    private boolean fileImported(Task writer, Task reader, List<String> reasons) {
        boolean found = false;
        for (String file : writer.targetFiles()) {
            for (String imported : reader.imports()) {
                if (filesMatch(file, imported)) {
                    reasons.add(reader.id() + " imports " + normalizePath(file) + " modified by " + writer.id());
                    found = true;
                }
            }
        }
        return found;
    }

    private static boolean resourceConflict(Task a, Task b, List<String> reasons) {
        boolean found = false;
        if (a.cpuIntensive() && b.cpuIntensive()) {
            reasons.add("both are CPU intensive");
            found = true;
        }
        if (a.memoryIntensive() && b.memoryIntensive()) {
            reasons.add("both are memory intensive");
            found = true;
        }
        found |= overlap("exclusive resource", a.exclusiveResources(), b.exclusiveResources(), reasons);
        return found;
    }

    private static boolean overlap(String label, List<String> a, List<String> b, List<String> reasons) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        Set<String> left = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        left.addAll(a);
        Set<String> shared = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (String value : b) {
            if (left.contains(value)) {
                shared.add(value.toLowerCase(Locale.ROOT));
            }
        }
        for (String value : shared) {
            reasons.add("shared " + label + " '" + value + "'");
        }
        return !shared.isEmpty();
    }

    /**
     * Checks if two file paths refer to the same file.
     * Handles relative vs. absolute paths by checking if one is a suffix of the other.
     */
    static boolean filesMatch(String file1, String file2) {
        String n1 = normalizePath(file1);
        String n2 = normalizePath(file2);

        if (n1.equals(n2)) return true;
        return n1.endsWith("/" + n2) || n2.endsWith("/" + n1);
    }

    /**
     * True when {@code path} is the directory {@code dir} or lies under it, allowing either
     * side to be written relative to a different root.
     */
    static boolean isWithin(String path, String dir) {
        String p = normalizeDir(path);
        String d = normalizeDir(dir);
        if (d.isEmpty()) return false;
        if (filesMatch(p, d)) return true;
        return p.startsWith(d + "/") || p.contains("/" + d + "/");
    }

    static String normalizePath(String path) {
        String normalized = path.strip().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    private static String normalizeDir(String dir) {
        String normalized = normalizePath(dir);
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
