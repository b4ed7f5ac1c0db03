package com.engram.core.manifest;

import com.engram.core.config.EngramProperties;
import com.engram.core.model.ManifestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Runs every {@link ManifestKind} whose file exists at the repository root.
 * <p>
 * Each manifest is parsed in isolation: a read error or a parser failure yields an empty
 * result for that manifest and a warning, never an exception to the caller.
 */
@Service
public class ManifestInterpreter {

    private static final Logger log = LoggerFactory.getLogger(ManifestInterpreter.class);

    private final EngramProperties properties;

    public ManifestInterpreter(EngramProperties properties) {
        this.properties = properties;
    }

    public ManifestReport interpret(Path root) {
        var results = new ArrayList<ManifestResult>();
        var warnings = new ArrayList<String>();

        for (ManifestKind kind : ManifestKind.values()) {
            Path file = root.resolve(kind.fileName());
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                String content = readCapped(file, properties.getMaxManifestBytes());
                ManifestResult result = kind.parser().parse(content);
                log.debug("Parsed {}: {} framework(s), {} dependency categories",
                        kind.fileName(), result.frameworks().size(), result.dependenciesByCategory().size());
                results.add(result);
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unreadable manifest {}: {}", kind.fileName(), e.getMessage());
                warnings.add("manifest: " + kind.fileName() + " could not be parsed (" + describe(e) + ")");
                results.add(ManifestResult.empty());
            }
        }
        return new ManifestReport(results, warnings);
    }

    /**
     * Reads at most {@code maxBytes} bytes and decodes them as UTF-8, replacing malformed input.
     */
    static String readCapped(Path file, int maxBytes) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return new String(in.readNBytes(maxBytes), StandardCharsets.UTF_8);
        }
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName();
    }
}
