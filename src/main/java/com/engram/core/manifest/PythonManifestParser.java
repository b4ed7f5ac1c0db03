package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented reader shared by {@code pyproject.toml}, {@code setup.py} and
 * {@code requirements.txt}.
 * <p>
 * Each line is stripped of surrounding whitespace, quotes and a trailing comma, then
 * matched against the framework prefix table and a leading identifier pattern. This
 * catches PEP 508 requirement strings in all three formats without a TOML or Python parser.
 */
public class PythonManifestParser implements ManifestParser {

    static final String PACKAGE_MANAGER = "pip";
    static final String CATEGORY = "python";
    private static final int MAX_DEPENDENCIES = 20;

    private static final Pattern LEADING_IDENTIFIER = Pattern.compile("^([a-zA-Z0-9_-]+)");
    private static final Pattern DESCRIPTION =
            Pattern.compile("^\\s*description\\s*=\\s*(?:\"([^\"\\n]*)\"|'([^'\\n]*)')", Pattern.MULTILINE);

    private static final List<FrameworkRule> FRAMEWORKS = List.of(
            new FrameworkRule("django", "Django"),
            new FrameworkRule("flask", "Flask"),
            new FrameworkRule("fastapi", "FastAPI"),
            new FrameworkRule("starlette", "Starlette"),
            new FrameworkRule("tornado", "Tornado"),
            new FrameworkRule("celery", "Celery"),
            new FrameworkRule("sqlalchemy", "SQLAlchemy"),
            new FrameworkRule("pydantic", "Pydantic"),
            new FrameworkRule("pytest", "pytest"),
            new FrameworkRule("numpy", "NumPy"),
            new FrameworkRule("pandas", "pandas"),
            new FrameworkRule("scikit-learn", "scikit-learn"),
            new FrameworkRule("torch", "PyTorch"),
            new FrameworkRule("tensorflow", "TensorFlow"),
            new FrameworkRule("transformers", "Transformers"),
            new FrameworkRule("click", "Click"),
            new FrameworkRule("typer", "Typer"),
            new FrameworkRule("httpx", "HTTPX"),
            new FrameworkRule("aiohttp", "aiohttp"),
            new FrameworkRule("rich", "Rich"),
            new FrameworkRule("uvicorn", "Uvicorn")
    );

    @Override
    public ManifestResult parse(String content) {
        var names = new LinkedHashSet<String>();
        var frameworks = new ArrayList<String>();

        for (String raw : content.split("\n")) {
            String line = normalize(raw);
            String lower = line.toLowerCase(Locale.ROOT);
            for (var rule : FRAMEWORKS) {
                if (lower.startsWith(rule.key()) && !frameworks.contains(rule.label())) {
                    frameworks.add(rule.label());
                    names.add(rule.key());
                }
            }
            Matcher identifier = LEADING_IDENTIFIER.matcher(line);
            if (identifier.find()) {
                names.add(identifier.group(1));
            }
        }

        Matcher description = DESCRIPTION.matcher(content);
        String text = "";
        if (description.find()) {
            text = description.group(1) != null ? description.group(1) : description.group(2);
        }

        Map<String, List<String>> dependencies = names.isEmpty()
                ? Map.of()
                : Map.of(CATEGORY, FrameworkRule.firstN(new ArrayList<>(names), MAX_DEPENDENCIES));
        return new ManifestResult(PACKAGE_MANAGER, text, dependencies, frameworks);
    }

    static String normalize(String line) {
        String s = line.strip();
        s = strip(s, '"');
        s = strip(s, '\'');
        s = strip(s, ',');
        return s;
    }

    private static String strip(String s, char c) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == c) {
            start++;
        }
        while (end > start && s.charAt(end - 1) == c) {
            end--;
        }
        return s.substring(start, end);
    }
}
