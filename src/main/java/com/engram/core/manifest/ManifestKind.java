package com.engram.core.manifest;

/**
 * Recognized manifest files, each bound to the parser for its format.
 * Declaration order is the order in which results are merged, so it decides which
 * manifest's description wins.
 */
public enum ManifestKind {

    PACKAGE_JSON("package.json", new PackageJsonParser()),
    CARGO_TOML("Cargo.toml", new CargoTomlParser()),
    GO_MOD("go.mod", new GoModParser()),
    PYPROJECT_TOML("pyproject.toml", Parsers.PYTHON),
    SETUP_PY("setup.py", Parsers.PYTHON),
    REQUIREMENTS_TXT("requirements.txt", Parsers.PYTHON),
    GEMFILE("Gemfile", new GemfileParser()),
    POM_XML("pom.xml", new MavenPomParser()),
    BUILD_GRADLE("build.gradle", Parsers.GRADLE),
    BUILD_GRADLE_KTS("build.gradle.kts", Parsers.GRADLE),
    PACKAGE_SWIFT("Package.swift", new SwiftPackageParser()),
    COMPOSER_JSON("composer.json", new ComposerJsonParser());

    private final String fileName;
    private final ManifestParser parser;

    ManifestKind(String fileName, ManifestParser parser) {
        this.fileName = fileName;
        this.parser = parser;
    }

    public String fileName() {
        return fileName;
    }

    public ManifestParser parser() {
        return parser;
    }

    // Enum constants cannot reference static fields of their own class during initialization.
    private static final class Parsers {
        static final ManifestParser PYTHON = new PythonManifestParser();
        static final ManifestParser GRADLE = new GradleBuildParser();
    }
}
