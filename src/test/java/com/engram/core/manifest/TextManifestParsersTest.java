package com.engram.core.manifest;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the regex-based manifest parsers.
 */
class TextManifestParsersTest {

    @Nested
    class Cargo {

        @Test
        @DisplayName("reads description, crate names and frameworks")
        void parsesCargoToml() {
            var result = new CargoTomlParser().parse("""
                    [package]
                    name = "engine"
                    version = "0.3.0"
                    edition = "2021"
                    description = "Game engine core"

                    [dependencies]
                    tokio = { version = "1", features = ["full"] }
                    serde = "1.0"
                    anyhow = "1"

                    [dev-dependencies]
                    serde = "1.0"
                    """);

            assertEquals("Cargo", result.packageManager());
            assertEquals("Game engine core", result.description());
            assertEquals(List.of("tokio", "serde", "anyhow"), result.dependenciesByCategory().get("crates"));
            assertEquals(List.of("Tokio", "Serde"), result.frameworks());
        }
    }

    @Nested
    class GoMod {

        @Test
        @DisplayName("reads require block modules and prefix-matched frameworks")
        void parsesGoMod() {
            var result = new GoModParser().parse("module example.com/svc\n\ngo 1.22\n\nrequire (\n"
                    + "\tgithub.com/gin-gonic/gin v1.9.1\n"
                    + "\tgithub.com/spf13/cobra v1.8.0\n"
                    + "\tgolang.org/x/sync v0.6.0 // indirect\n"
                    + ")\n");

            assertEquals("Go modules", result.packageManager());
            assertEquals(List.of("github.com/gin-gonic/gin", "github.com/spf13/cobra", "golang.org/x/sync"),
                    result.dependenciesByCategory().get("go_modules"));
            assertEquals(List.of("Gin", "Cobra"), result.frameworks());
        }
    }

    @Nested
    class Python {

        @Test
        @DisplayName("reads requirements.txt lines")
        void parsesRequirements() {
            var result = new PythonManifestParser().parse("Django>=4.2\ncelery[redis]==5.3\nrequests\n");

            assertEquals("pip", result.packageManager());
            assertEquals(List.of("Django", "Celery"), result.frameworks());
            assertEquals(List.of("django", "Django", "celery", "requests"),
                    result.dependenciesByCategory().get("python"));
        }

        @Test
        @DisplayName("reads quoted pyproject dependencies and the description")
        void parsesPyproject() {
            var result = new PythonManifestParser().parse("""
                    [project]
                    description = "Ingestion service"
                    dependencies = [
                        "fastapi>=0.110",
                        "uvicorn[standard]",
                    ]
                    """);

            assertEquals("Ingestion service", result.description());
            assertEquals(List.of("FastAPI", "Uvicorn"), result.frameworks());
            assertTrue(result.dependenciesByCategory().get("python").contains("fastapi"));
        }

        @Test
        @DisplayName("caps the dependency list at twenty names")
        void capsDependencies() {
            var sb = new StringBuilder();
            for (int i = 0; i < 30; i++) {
                sb.append("pkg").append(i).append('\n');
            }
            var deps = new PythonManifestParser().parse(sb.toString()).dependenciesByCategory().get("python");
            assertEquals(20, deps.size());
            assertEquals("pkg0", deps.get(0));
        }

        @Test
        @DisplayName("keeps the other quote character inside a double-quoted description")
        void descriptionWithApostrophe() {
            var result = new PythonManifestParser().parse("""
                    [project]
                    description = "Bob's repo analyzer"
                    """);
            assertEquals("Bob's repo analyzer", result.description());
        }

        @Test
        @DisplayName("keeps double quotes inside a single-quoted description")
        void descriptionWithDoubleQuotes() {
            var result = new PythonManifestParser().parse("""
                    setup(
                        description='A "fast" tool',
                    )
                    """);
            assertEquals("A \"fast\" tool", result.description());
        }
    }

    @Nested
    class Ruby {

        @Test
        @DisplayName("reads gem names")
        void parsesGemfile() {
            var result = new GemfileParser().parse("""
                    source "https://rubygems.org"
                    gem "rails", "~> 7.1"
                    gem 'pg'
                    group :test do
                      gem "rspec-rails"
                      gem "rspec"
                    end
                    """);

            assertEquals("Bundler", result.packageManager());
            assertEquals(List.of("rails", "pg", "rspec-rails", "rspec"), result.dependenciesByCategory().get("gems"));
            assertEquals(List.of("Ruby on Rails", "RSpec"), result.frameworks());
        }

        @Test
        @DisplayName("counts a gem declared in several groups once toward the cap")
        void deduplicatesBeforeCapping() {
            var sb = new StringBuilder("gem \"rails\"\n");
            for (int i = 0; i < 25; i++) {
                sb.append("group :g").append(i).append(" do\n  gem \"rails\"\n  gem \"gem").append(i).append("\"\nend\n");
            }
            var gems = new GemfileParser().parse(sb.toString()).dependenciesByCategory().get("gems");
            assertEquals(20, gems.size());
            assertEquals("rails", gems.get(0));
            assertEquals("gem18", gems.get(19));
        }
    }

    @Nested
    class Jvm {

        @Test
        @DisplayName("reads Maven dependency coordinates and frameworks")
        void parsesPom() {
            var result = new MavenPomParser().parse("""
                    <project>
                      <parent>
                        <groupId>org.springframework.boot</groupId>
                        <artifactId>spring-boot-starter-parent</artifactId>
                      </parent>
                      <dependencies>
                        <dependency>
                          <groupId>org.springframework.boot</groupId>
                          <artifactId>spring-boot-starter-web</artifactId>
                        </dependency>
                        <dependency>
                          <groupId>org.junit.jupiter</groupId>
                          <artifactId>junit-jupiter</artifactId>
                          <scope>test</scope>
                        </dependency>
                      </dependencies>
                    </project>
                    """);

            assertEquals("Maven/Gradle", result.packageManager());
            assertEquals(List.of("org.springframework.boot:spring-boot-starter-web", "org.junit.jupiter:junit-jupiter"),
                    result.dependenciesByCategory().get("maven"));
            assertEquals(List.of("Spring Boot", "JUnit"), result.frameworks());
        }

        @Test
        @DisplayName("reads Gradle string coordinates without versions")
        void parsesGradle() {
            var result = new GradleBuildParser().parse("""
                    dependencies {
                        implementation("io.ktor:ktor-server-core:2.3.7")
                        testImplementation 'org.mockito:mockito-core:5.8.0'
                        implementation(project(":shared"))
                    }
                    """);

            assertEquals(List.of("io.ktor:ktor-server-core", "org.mockito:mockito-core"),
                    result.dependenciesByCategory().get("gradle"));
            assertEquals(List.of("Mockito", "Ktor"), result.frameworks());
        }
    }

    @Nested
    class Swift {

        @Test
        @DisplayName("uses repository names as packages and frameworks")
        void parsesPackageSwift() {
            var result = new SwiftPackageParser().parse("""
                    dependencies: [
                        .package(url: "https://github.com/vapor/vapor.git", from: "4.0.0"),
                        .package(url: "https://github.com/apple/swift-nio/", from: "2.0.0"),
                    ]
                    """);

            assertEquals("Swift Package Manager", result.packageManager());
            assertEquals(List.of("vapor", "swift-nio"), result.frameworks());
            assertEquals(List.of("vapor", "swift-nio"), result.dependenciesByCategory().get("swift_packages"));
        }
    }
}
