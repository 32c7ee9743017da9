package com.questrail.plc.runtime;

import com.questrail.plc.lang.ast.Program;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProgramLoaderTest {

    @TempDir
    Path dir;

    private final ProgramLoader loader = new ProgramLoader();

    @Test
    void loadsValidProgram() throws IOException {
        Path file = dir.resolve("ok.st");
        Files.writeString(file, "PROGRAM Ok\nVAR_OUTPUT y : INT; END_VAR\ny := 1;\nEND_PROGRAM\n", StandardCharsets.UTF_8);

        Optional<Program> program = loader.load(file);

        assertTrue(program.isPresent());
        assertEquals("Ok", program.get().name());
        assertEquals(1, program.get().statements().size());
    }

    @Test
    void missingFileFallsBack() {
        assertTrue(loader.load(dir.resolve("absent.st")).isEmpty());
    }

    @Test
    void directoryFallsBack() {
        assertTrue(loader.load(dir).isEmpty());
    }

    @Test
    void malformedProgramFallsBack() throws IOException {
        Path file = dir.resolve("bad.st");
        Files.writeString(file, "PROGRAM Bad\nx := ;\nEND_PROGRAM\n", StandardCharsets.UTF_8);

        assertTrue(loader.load(file).isEmpty());
    }

    @Test
    void deeplyNestedProgramFallsBack() throws IOException {
        int n = 50_000;
        Path file = dir.resolve("deep.st");
        Files.writeString(file, "PROGRAM Deep\nVAR x : REAL; END_VAR\nx := " + "(".repeat(n) + "1" + ")".repeat(n)
                + ";\nEND_PROGRAM\n", StandardCharsets.UTF_8);

        assertTrue(loader.load(file).isEmpty());
    }
}
