package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ruby {@code Gemfile}: the first quoted argument of every {@code gem} call.
 */
public class GemfileParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "Bundler";
    static final String CATEGORY = "gems";
    private static final int MAX_DEPENDENCIES = 20;

    private static final Pattern GEM = Pattern.compile("gem\\s+['\"]([^'\"]+)['\"]");

    private static final Map<String, String> FRAMEWORKS = Map.of(
            "rails", "Ruby on Rails",
            "sinatra", "Sinatra",
            "rspec", "RSpec",
            "sidekiq", "Sidekiq"
    );

    @Override
    public ManifestResult parse(String content) {
        var gems = new LinkedHashSet<String>();
        var frameworks = new ArrayList<String>();
        Matcher gem = GEM.matcher(content);
        while (gem.find()) {
            String name = gem.group(1);
            gems.add(name);
            String label = FRAMEWORKS.get(name);
            if (label != null) {
                FrameworkRule.addLabel(frameworks, label);
            }
        }

        Map<String, List<String>> dependencies = gems.isEmpty()
                ? Map.of()
                : Map.of(CATEGORY, FrameworkRule.firstN(new ArrayList<>(gems), MAX_DEPENDENCIES));
        return new ManifestResult(PACKAGE_MANAGER, "", dependencies, frameworks);
    }
}
