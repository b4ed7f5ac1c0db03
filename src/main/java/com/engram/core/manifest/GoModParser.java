package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go {@code go.mod}: module paths listed on tab-indented lines of {@code require} blocks.
 * A dependency matches a framework when its path starts with the framework's module prefix.
 */
public class GoModParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "Go modules";
    static final String CATEGORY = "go_modules";
    private static final int MAX_DEPENDENCIES = 20;

    private static final Pattern REQUIRE_LINE = Pattern.compile("^\\t([\\w./\\-]+)\\s", Pattern.MULTILINE);

    private static final List<FrameworkRule> FRAMEWORKS = List.of(
            new FrameworkRule("github.com/gin-gonic/gin", "Gin"),
            new FrameworkRule("github.com/labstack/echo", "Echo"),
            new FrameworkRule("github.com/gofiber/fiber", "Fiber"),
            new FrameworkRule("github.com/gorilla/mux", "Gorilla Mux"),
            new FrameworkRule("google.golang.org/grpc", "gRPC"),
            new FrameworkRule("github.com/spf13/cobra", "Cobra"),
            new FrameworkRule("github.com/urfave/cli", "urfave/cli"),
            new FrameworkRule("gorm.io/gorm", "GORM"),
            new FrameworkRule("github.com/stretchr/testify", "Testify")
    );

    @Override
    public ManifestResult parse(String content) {
        var modules = new ArrayList<String>();
        var frameworks = new ArrayList<String>();
        Matcher line = REQUIRE_LINE.matcher(content);
        while (line.find()) {
            String module = line.group(1);
            modules.add(module);
            for (var rule : FRAMEWORKS) {
                if (module.startsWith(rule.key())) {
                    FrameworkRule.addLabel(frameworks, rule.label());
                }
            }
        }

        Map<String, List<String>> dependencies = modules.isEmpty()
                ? Map.of()
                : Map.of(CATEGORY, FrameworkRule.firstN(modules, MAX_DEPENDENCIES));
        return new ManifestResult(PACKAGE_MANAGER, "", dependencies, frameworks);
    }
}
