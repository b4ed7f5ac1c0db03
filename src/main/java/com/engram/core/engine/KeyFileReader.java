package com.engram.core.engine;

import com.engram.core.config.EngramProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Reads the heads of well-known documentation and manifest files so downstream consumers
 * get raw context next to the derived facts.
 */
@Component
public class KeyFileReader {

    private static final Logger log = LoggerFactory.getLogger(KeyFileReader.class);

    static final String README = "README.md";

    static final List<String> KEY_FILES = List.of(
            README, "CONTRIBUTING.md", "ARCHITECTURE.md",
            "package.json", "Cargo.toml", "go.mod", "pyproject.toml",
            "pom.xml", "build.gradle"
    );

    private final EngramProperties properties;

    public KeyFileReader(EngramProperties properties) {
        this.properties = properties;
    }

    public KeyFiles read(Path root) {
        var contents = new LinkedHashMap<String, String>();
        var warnings = new ArrayList<String>();
        String readmeExcerpt = "";

        for (String name : KEY_FILES) {
            Path file = root.resolve(name);
            if (!Files.isRegularFile(file)) {
                continue;
            }
            try {
                String content = readChars(file, properties.getKeyFileMaxChars());
                contents.put(name, content);
                if (name.equals(README)) {
                    readmeExcerpt = head(content, properties.getReadmeExcerptChars());
                }
            } catch (IOException e) {
                log.warn("Cannot read key file {}: {}", name, e.getMessage());
                warnings.add("key-files: " + name + " could not be read (" + e.getMessage() + ")");
            }
        }
        return new KeyFiles(contents, readmeExcerpt, warnings);
    }

    /**
     * Reads at most {@code maxChars} characters, decoding UTF-8 leniently.
     */
    static String readChars(Path file, int maxChars) throws IOException {
        var sb = new StringBuilder();
        char[] buffer = new char[4096];
        try (Reader reader = new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8)) {
            int n;
            while (sb.length() < maxChars
                    && (n = reader.read(buffer, 0, Math.min(buffer.length, maxChars - sb.length()))) != -1) {
                sb.append(buffer, 0, n);
            }
        }
        return sb.toString();
    }

    private static String head(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
