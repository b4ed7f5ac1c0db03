package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Swift {@code Package.swift}. Each {@code .package(url: "...")} declaration contributes the
 * repository name, which doubles as the framework label.
 */
public class SwiftPackageParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "Swift Package Manager";
    static final String CATEGORY = "swift_packages";

    private static final Pattern PACKAGE_URL = Pattern.compile("\\.package\\(.*?url:\\s*\"([^\"]+)\"");

    @Override
    public ManifestResult parse(String content) {
        var packages = new ArrayList<String>();
        Matcher url = PACKAGE_URL.matcher(content);
        while (url.find()) {
            String name = repositoryName(url.group(1));
            if (!name.isEmpty()) {
                FrameworkRule.addLabel(packages, name);
            }
        }

        Map<String, List<String>> dependencies = packages.isEmpty()
                ? Map.of()
                : Map.of(CATEGORY, packages);
        return new ManifestResult(PACKAGE_MANAGER, "", dependencies, packages);
    }

    static String repositoryName(String url) {
        String trimmed = url;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        String name = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        return name.endsWith(".git") ? name.substring(0, name.length() - 4) : name;
    }
}
