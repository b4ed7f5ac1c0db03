package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Rust {@code Cargo.toml}.
 * <p>
 * Only line-anchored {@code key = value} pairs are read: the top-level description and
 * every declared key that is not package metadata. Nested-table semantics are not needed
 * to list dependency names.
 */
public class CargoTomlParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "Cargo";
    static final String CATEGORY = "crates";

    private static final Pattern DESCRIPTION = Pattern.compile("^description\\s*=\\s*\"([^\"]+)\"", Pattern.MULTILINE);
    private static final Pattern KEY = Pattern.compile("^(\\w[\\w-]*)\\s*=", Pattern.MULTILINE);

    /** Keys of the {@code [package]} and {@code [workspace]} tables. */
    private static final Set<String> NON_DEPENDENCY_KEYS = Set.of(
            "name", "version", "edition", "description", "authors", "license",
            "license-file", "rust-version", "homepage", "repository", "documentation",
            "readme", "keywords", "categories", "publish", "build", "exclude", "include",
            "resolver", "members", "default-members", "workspace", "default-run", "autobins"
    );

    private static final Map<String, String> FRAMEWORKS = Map.ofEntries(
            entry("actix-web", "Actix Web"),
            entry("axum", "Axum"),
            entry("rocket", "Rocket"),
            entry("tokio", "Tokio"),
            entry("async-std", "async-std"),
            entry("serde", "Serde"),
            entry("diesel", "Diesel"),
            entry("sqlx", "SQLx"),
            entry("tonic", "Tonic (gRPC)"),
            entry("warp", "Warp"),
            entry("bevy", "Bevy"),
            entry("clap", "Clap"),
            entry("tracing", "Tracing"),
            entry("tower", "Tower")
    );

    @Override
    public ManifestResult parse(String content) {
        Matcher description = DESCRIPTION.matcher(content);
        String text = description.find() ? description.group(1) : "";

        var crates = new LinkedHashSet<String>();
        var frameworks = new ArrayList<String>();
        Matcher key = KEY.matcher(content);
        while (key.find()) {
            String name = key.group(1);
            String label = FRAMEWORKS.get(name);
            if (label != null) {
                FrameworkRule.addLabel(frameworks, label);
            }
            if (!NON_DEPENDENCY_KEYS.contains(name)) {
                crates.add(name);
            }
        }

        Map<String, List<String>> dependencies = crates.isEmpty()
                ? Map.of()
                : Map.of(CATEGORY, new ArrayList<>(crates));
        return new ManifestResult(PACKAGE_MANAGER, text, dependencies, frameworks);
    }
}
