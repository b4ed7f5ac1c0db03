package com.engram.core.pattern;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Infers architectural patterns from the repository layout.
 * <p>
 * Rules are evaluated in declaration order and each contributes its label at most once,
 * so the output order is stable for a given input.
 */
@Service
public class PatternDetector {

    private record PatternRule(String label, Predicate<PatternInput> applies) {
    }

    private static final List<PatternRule> RULES = List.of(
            new PatternRule("Web application",
                    in -> in.hasAllDirs("src", "public") || in.hasAllDirs("app", "public")),
            new PatternRule("Server-side rendering (SSR)",
                    in -> in.hasAnyDir("pages", "app") && in.frameworks().contains("Next.js")),
            new PatternRule("REST API", in -> in.hasAnyDir("api", "routes")),
            new PatternRule("Middleware pattern", in -> in.hasDir("middleware")),
            new PatternRule("Component-based architecture", in -> in.hasDir("components")),
            new PatternRule("Model layer", in -> in.hasAnyDir("models", "schemas", "entities")),
            new PatternRule("MVC / Handler pattern", in -> in.hasAnyDir("controllers", "handlers")),
            new PatternRule("Service layer", in -> in.hasDir("services")),
            new PatternRule("Repository pattern", in -> in.hasAnyDir("repositories", "repos")),
            new PatternRule("Hexagonal / Clean architecture",
                    in -> in.hasAllDirs("domain", "application", "infrastructure")
                            || in.hasAllDirs("domain", "ports", "adapters")),
            new PatternRule("Go cmd pattern (multi-binary)", in -> in.hasDir("cmd")),
            new PatternRule("Go project layout", in -> in.hasAnyDir("internal", "pkg")),
            new PatternRule("Rust workspace (multi-crate)",
                    in -> in.hasDir("crates") || in.description().toLowerCase(Locale.ROOT).contains("workspace")),
            new PatternRule("Protocol Buffers / gRPC",
                    in -> in.hasAnyDir("proto", "protos") || in.extensions().contains(".proto")),
            new PatternRule("Database migrations", in -> in.hasDir("migrations")),
            new PatternRule("Monorepo", in -> in.hasAnyDir("packages", "apps")),
            new PatternRule("Lerna monorepo", in -> in.configFileNames().contains("lerna.json")),
            new PatternRule("Plugin architecture", in -> in.hasAnyDir("plugins", "extensions")),
            new PatternRule("Documentation site", in -> in.hasAnyDir("docs", "documentation")),
            new PatternRule("Example/sample code included", in -> in.hasAnyDir("examples", "samples"))
    );

    public List<String> detect(PatternInput input) {
        var patterns = new ArrayList<String>();
        for (var rule : RULES) {
            if (rule.applies().test(input) && !patterns.contains(rule.label())) {
                patterns.add(rule.label());
            }
        }
        return List.copyOf(patterns);
    }
}
