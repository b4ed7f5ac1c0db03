package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Node.js {@code package.json}: dependency groups, framework labels and description.
 */
public class PackageJsonParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "npm/yarn/pnpm";

    /** Groups kept separately in the dependency map, in this order. */
    static final List<String> DEPENDENCY_GROUPS = List.of("dependencies", "devDependencies", "peerDependencies");

    private static final List<FrameworkRule> FRAMEWORKS = List.of(
            new FrameworkRule("next", "Next.js"),
            new FrameworkRule("react", "React"),
            new FrameworkRule("vue", "Vue.js"),
            new FrameworkRule("svelte", "Svelte"),
            new FrameworkRule("@sveltejs/kit", "SvelteKit"),
            new FrameworkRule("express", "Express"),
            new FrameworkRule("fastify", "Fastify"),
            new FrameworkRule("koa", "Koa"),
            new FrameworkRule("nuxt", "Nuxt.js"),
            new FrameworkRule("@angular/core", "Angular"),
            new FrameworkRule("electron", "Electron"),
            new FrameworkRule("react-native", "React Native"),
            new FrameworkRule("gatsby", "Gatsby"),
            new FrameworkRule("remix", "Remix"),
            new FrameworkRule("astro", "Astro"),
            new FrameworkRule("vite", "Vite"),
            new FrameworkRule("webpack", "Webpack"),
            new FrameworkRule("rollup", "Rollup"),
            new FrameworkRule("esbuild", "esbuild"),
            new FrameworkRule("tailwindcss", "Tailwind CSS"),
            new FrameworkRule("prisma", "Prisma"),
            new FrameworkRule("drizzle-orm", "Drizzle ORM"),
            new FrameworkRule("typeorm", "TypeORM"),
            new FrameworkRule("jest", "Jest"),
            new FrameworkRule("vitest", "Vitest"),
            new FrameworkRule("mocha", "Mocha"),
            new FrameworkRule("playwright", "Playwright"),
            new FrameworkRule("cypress", "Cypress")
    );

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public ManifestResult parse(String content) throws IOException {
        JsonNode root = MAPPER.readTree(content);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("package.json root is not a JSON object");
        }

        var dependencies = new LinkedHashMap<String, List<String>>();
        var allNames = new HashSet<String>();
        for (String group : DEPENDENCY_GROUPS) {
            JsonNode deps = root.get(group);
            if (deps == null || !deps.isObject() || deps.isEmpty()) {
                continue;
            }
            var names = new ArrayList<String>();
            deps.fieldNames().forEachRemaining(names::add);
            allNames.addAll(names);
            dependencies.put(group, names);
        }

        var frameworks = new ArrayList<String>();
        for (var rule : FRAMEWORKS) {
            if (allNames.contains(rule.key())) {
                FrameworkRule.addLabel(frameworks, rule.label());
            }
        }

        JsonNode description = root.get("description");
        String text = description != null && description.isTextual() ? description.asText() : "";
        return new ManifestResult(PACKAGE_MANAGER, text, dependencies, frameworks);
    }
}
