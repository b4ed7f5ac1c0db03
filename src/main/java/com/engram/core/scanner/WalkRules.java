package com.engram.core.scanner;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.regex.Pattern;

/**
 * Static classification rules applied to every file during the tree walk.
 * All tables are immutable; lookups take lower-cased names unless stated otherwise.
 */
public final class WalkRules {

    /** Directories pruned before descent. */
    static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "__pycache__", ".venv", "venv", "env",
            ".tox", ".mypy_cache", ".pytest_cache", ".ruff_cache",
            "target", "build", "dist", ".next", ".nuxt", ".output", "out",
            "vendor", "Pods", ".build", ".swiftpm", "DerivedData",
            "coverage", ".coverage", "htmlcov", ".nyc_output",
            ".idea", ".vscode", ".vs", ".gradle", ".settings", ".mvn"
    );

    /** Binary, archive and lock-file extensions that are never counted. */
    static final Set<String> IGNORE_EXTENSIONS = Set.of(
            ".pyc", ".pyo", ".class", ".o", ".obj", ".a", ".lib",
            ".so", ".dylib", ".dll", ".exe", ".bin",
            ".jpg", ".jpeg", ".png", ".gif", ".ico", ".svg", ".webp",
            ".woff", ".woff2", ".ttf", ".eot",
            ".zip", ".tar", ".gz", ".bz2", ".xz", ".rar",
            ".lock"
    );

    private static final Pattern TEST_FILE_NAME =
            Pattern.compile("(^test_|_test\\.|\\.test\\.|\\.spec\\.|_spec\\.)");

    private static final Pattern TEST_DIRECTORY =
            Pattern.compile("(^|/)(tests?|__tests__|specs?)/");

    private record MarkerRule(String framework, Set<String> fileNames) {}

    private static final String PYTEST = "pytest";

    private static final List<MarkerRule> TEST_FRAMEWORK_MARKERS = List.of(
            new MarkerRule("Jest", Set.of("jest.config.js", "jest.config.ts", "jest.config.mjs")),
            new MarkerRule("Vitest", Set.of("vitest.config.ts", "vitest.config.js", "vitest.config.mts")),
            new MarkerRule(PYTEST, Set.of("pytest.ini", "conftest.py", "tox.ini")),
            new MarkerRule("PHPUnit", Set.of("phpunit.xml", "phpunit.xml.dist")),
            new MarkerRule("RSpec", Set.of(".rspec")),
            new MarkerRule("Mocha", Set.of(".mocharc.js", ".mocharc.json", ".mocharc.yml")),
            new MarkerRule("Playwright", Set.of("playwright.config.ts", "playwright.config.js")),
            new MarkerRule("Karma", Set.of("karma.conf.js"))
    );

    /** CI rule: (relative path, lower-cased file name) predicate. */
    private record CiRule(String provider, BiPredicate<String, String> matcher) {}

    private static final List<CiRule> CI_RULES = List.of(
            new CiRule("GitHub Actions", (rel, lower) -> rel.startsWith(".github/workflows/")),
            new CiRule("Travis CI", (rel, lower) -> lower.equals(".travis.yml") || lower.equals(".travis.yaml")),
            new CiRule("Jenkins", (rel, lower) -> lower.equals("jenkinsfile") || lower.equals("jenkins.yml")),
            new CiRule("GitLab CI", (rel, lower) -> lower.equals(".gitlab-ci.yml")),
            new CiRule("Azure Pipelines", (rel, lower) -> lower.equals("azure-pipelines.yml")),
            new CiRule("CircleCI", (rel, lower) -> rel.startsWith(".circleci/") && lower.equals("config.yml")),
            new CiRule("Bitbucket Pipelines", (rel, lower) -> lower.equals("bitbucket-pipelines.yml"))
    );

    private static final Set<String> COMPOSE_FILES = Set.of(
            "docker-compose.yml", "docker-compose.yaml", "compose.yml", "compose.yaml"
    );

    private static final List<String> K8S_KEYWORDS = List.of(
            "k8s", "kubernetes", "deploy", "service", "ingress", "helm"
    );

    private static final Set<String> CHANGELOG_FILES = Set.of("changelog.md", "changes.md", "history.md");

    static final Set<String> CONFIG_FILES = Set.of(
            "tsconfig.json", ".eslintrc.json", ".eslintrc.js", "eslint.config.js",
            "prettier.config.js", ".prettierrc", "babel.config.js",
            "webpack.config.js", "rollup.config.js", "vite.config.ts",
            "next.config.js", "next.config.mjs", "next.config.ts",
            "tailwind.config.js", "tailwind.config.ts",
            "rustfmt.toml", "clippy.toml", ".golangci.yml",
            "mypy.ini", "ruff.toml", "pyrightconfig.json",
            "lerna.json", "nx.json", "turbo.json", "pnpm-workspace.yaml"
    );

    static final Set<String> ENTRY_POINTS = Set.of(
            "main.py", "app.py", "server.py", "index.ts", "index.js",
            "main.go", "main.rs", "lib.rs", "main.swift", "app.swift"
    );

    private WalkRules() {} // utility class

    public static boolean isIgnoredDirectory(String name) {
        return IGNORE_DIRS.contains(name);
    }

    public static boolean isIgnoredExtension(String extension) {
        return IGNORE_EXTENSIONS.contains(extension);
    }

    /**
     * Returns the lower-cased extension including the dot, or an empty string.
     * A single leading dot (e.g. {@code .gitignore}) is not an extension.
     */
    public static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Test-file heuristic: naming convention on the file name, or a conventional
     * test directory anywhere in the relative path.
     */
    public static boolean isTestFile(String lowerName, String lowerRelativePath) {
        return TEST_FILE_NAME.matcher(lowerName).find()
                || TEST_DIRECTORY.matcher(lowerRelativePath).find();
    }

    public static Optional<String> testFrameworkMarker(String lowerName) {
        for (var rule : TEST_FRAMEWORK_MARKERS) {
            if (rule.fileNames().contains(lowerName)) {
                return Optional.of(rule.framework());
            }
        }
        return Optional.empty();
    }

    /**
     * Decides which test framework label to keep when a new marker is seen.
     * The first explicit framework wins; pytest only fills an empty slot and
     * gives way to an explicit framework.
     */
    static String resolveTestFramework(String current, String candidate) {
        if (current.isEmpty()) {
            return candidate;
        }
        if (PYTEST.equals(current) && !PYTEST.equals(candidate)) {
            return candidate;
        }
        return current;
    }

    public static Optional<String> ciProvider(String relativePath, String lowerName) {
        for (var rule : CI_RULES) {
            if (rule.matcher().test(relativePath, lowerName)) {
                return Optional.of(rule.provider());
            }
        }
        return Optional.empty();
    }

    public static boolean isContainerFile(String lowerName) {
        return lowerName.startsWith("dockerfile") || COMPOSE_FILES.contains(lowerName);
    }

    public static boolean isKubernetesManifest(String lowerName) {
        if (!lowerName.endsWith(".yaml") && !lowerName.endsWith(".yml")) {
            return false;
        }
        for (String keyword : K8S_KEYWORDS) {
            if (lowerName.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isChangelog(String lowerName) {
        return CHANGELOG_FILES.contains(lowerName);
    }

    public static boolean isLicense(String lowerName) {
        return lowerName.equals("license") || lowerName.startsWith("license.");
    }

    public static boolean isConfigFile(String lowerName) {
        return CONFIG_FILES.contains(lowerName);
    }

    public static boolean isEntryPoint(String lowerName) {
        return ENTRY_POINTS.contains(lowerName);
    }
}
