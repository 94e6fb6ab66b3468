package com.conclave.core.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutputStoreTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("writes both streams under the run's log directory")
    void writesBothStreams() throws Exception {
        var store = new OutputStore(tempDir);

        var refs = store.store("RUN-1", "TASK-001", 2, "out", "err");

        Path dir = tempDir.resolve("RUN-1").resolve("logs");
        assertEquals(dir, store.logDirectory("RUN-1"));
        assertEquals(dir.resolve("TASK-001.attempt-2.stdout.log").toString(), refs.stdoutRef());
        assertEquals(dir.resolve("TASK-001.attempt-2.stderr.log").toString(), refs.stderrRef());
        assertEquals("out", Files.readString(Path.of(refs.stdoutRef())));
        assertEquals("err", Files.readString(Path.of(refs.stderrRef())));
    }

    @Test
    @DisplayName("null streams yield null refs")
    void nullStreams() {
        var refs = new OutputStore(tempDir).store("RUN-1", "TASK-001", 1, null, "err");

        assertNull(refs.stdoutRef());
        assertNotNull(refs.stderrRef());
    }

    @Test
    @DisplayName("an unwritable base directory yields no refs instead of failing")
    void unwritableBase() throws Exception {
        Path file = tempDir.resolve("not-a-dir");
        Files.writeString(file, "x");

        var refs = new OutputStore(file).store("RUN-1", "TASK-001", 1, "out", "err");

        assertEquals(OutputStore.OutputRefs.NONE, refs);
    }
}
