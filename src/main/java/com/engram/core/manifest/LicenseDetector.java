package com.engram.core.manifest;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Classifies the repository license from the head of its license file.
 */
@Service
public class LicenseDetector {

    static final List<String> LICENSE_FILES = List.of("LICENSE", "LICENSE.md", "LICENSE.txt");
    static final int HEAD_BYTES = 500;

    private record LicenseFamily(String label, Pattern marker) {
    }

    private static final Pattern LESSER = Pattern.compile("lesser|lgpl");

    // Checked in order; the first match wins.
    private static final List<LicenseFamily> FAMILIES = List.of(
            new LicenseFamily("MIT", Pattern.compile("\\bmit\\b")),
            new LicenseFamily("Apache-2.0", Pattern.compile("apache")),
            new LicenseFamily("GPL", Pattern.compile("gpl|general public license")),
            new LicenseFamily("BSD", Pattern.compile("\\bbsd\\b")),
            new LicenseFamily("MPL-2.0", Pattern.compile("\\bmpl\\b|mozilla public license")),
            new LicenseFamily("ISC", Pattern.compile("\\bisc\\b"))
    );

    /**
     * Looks at the first existing license file only.
     *
     * @return the license label, or empty when there is no license file or no family matches
     * @throws IOException if the license file exists but cannot be read
     */
    public Optional<String> detect(Path root) throws IOException {
        for (String name : LICENSE_FILES) {
            Path file = root.resolve(name);
            if (Files.isRegularFile(file)) {
                return classify(ManifestInterpreter.readCapped(file, HEAD_BYTES));
            }
        }
        return Optional.empty();
    }

    public Optional<String> classify(String head) {
        String text = head.toLowerCase(Locale.ROOT);
        for (var family : FAMILIES) {
            if (family.marker().matcher(text).find()) {
                if (family.label().equals("GPL") && LESSER.matcher(text).find()) {
                    return Optional.of("LGPL");
                }
                return Optional.of(family.label());
            }
        }
        return Optional.empty();
    }
}
