package com.engram.core.manifest;

import com.engram.core.config.EngramProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestInterpreterTest {

    @TempDir
    Path tempDir;

    EngramProperties properties = new EngramProperties();
    ManifestInterpreter interpreter = new ManifestInterpreter(properties);

    @Test
    @DisplayName("returns nothing when no manifest exists")
    void noManifests() {
        var report = interpreter.interpret(tempDir);
        assertTrue(report.results().isEmpty());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    @DisplayName("results follow manifest kind order, not file creation order")
    void resultsInKindOrder() throws IOException {
        Files.writeString(tempDir.resolve("go.mod"), "module x\n");
        Files.writeString(tempDir.resolve("package.json"), "{\"description\": \"web\"}");

        var report = interpreter.interpret(tempDir);
        assertEquals(List.of("npm/yarn/pnpm", "Go modules"),
                report.results().stream().map(r -> r.packageManager()).toList());
    }

    @Test
    @DisplayName("a malformed manifest is isolated from the other ecosystems")
    void malformedManifestIsolated() throws IOException {
        Files.writeString(tempDir.resolve("package.json"), "{ this is not json");
        Files.writeString(tempDir.resolve("Cargo.toml"), "[dependencies]\naxum = \"0.7\"\n");

        var report = interpreter.interpret(tempDir);
        assertEquals(2, report.results().size());
        assertTrue(report.results().get(0).isEmpty());
        assertEquals(List.of("Axum"), report.results().get(1).frameworks());
        assertEquals(1, report.warnings().size());
        assertTrue(report.warnings().get(0).contains("package.json"));
    }

    @Test
    @DisplayName("reads at most the configured number of bytes")
    void capsManifestSize() throws IOException {
        properties.getAnalysis().setMaxManifestBytes(16);
        Files.writeString(tempDir.resolve("requirements.txt"), "flask\nnumpy\npandas\ntorch\n");

        var result = interpreter.interpret(tempDir).results().get(0);
        // "flask\nnumpy\npand" is all that is read
        assertEquals(List.of("Flask", "NumPy"), result.frameworks());
    }

    @Test
    @DisplayName("invalid UTF-8 is decoded leniently")
    void lenientDecoding() throws IOException {
        byte[] bytes = "gem \"rails\"\n".getBytes(StandardCharsets.UTF_8);
        byte[] withGarbage = new byte[bytes.length + 2];
        withGarbage[0] = (byte) 0xC3;
        withGarbage[1] = (byte) 0x28;
        System.arraycopy(bytes, 0, withGarbage, 2, bytes.length);
        Files.write(tempDir.resolve("Gemfile"), withGarbage);

        var result = interpreter.interpret(tempDir).results().get(0);
        assertEquals(List.of("Ruby on Rails"), result.frameworks());
    }
}
