package com.engram.core.language;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Maps file extensions to language labels and computes the language distribution
 * of a repository from its extension histogram.
 */
@Service
public class ExtensionClassifier {

    /** Maximum number of languages reported. */
    static final int MAX_LANGUAGES = 10;

    private static final Map<String, String> EXT_LANG = Map.ofEntries(
            entry(".py", "Python"), entry(".pyi", "Python"),
            entry(".js", "JavaScript"), entry(".mjs", "JavaScript"), entry(".cjs", "JavaScript"),
            entry(".jsx", "JavaScript"),
            entry(".ts", "TypeScript"), entry(".tsx", "TypeScript"), entry(".mts", "TypeScript"),
            entry(".rs", "Rust"),
            entry(".go", "Go"),
            entry(".java", "Java"), entry(".kt", "Kotlin"), entry(".kts", "Kotlin"),
            entry(".rb", "Ruby"),
            entry(".php", "PHP"),
            entry(".swift", "Swift"),
            // a bare header could be either language
            entry(".c", "C"), entry(".h", "C/C++"),
            entry(".cpp", "C++"), entry(".cc", "C++"), entry(".cxx", "C++"), entry(".hpp", "C++"),
            entry(".cs", "C#"),
            entry(".scala", "Scala"),
            entry(".ex", "Elixir"), entry(".exs", "Elixir"),
            entry(".erl", "Erlang"),
            entry(".hs", "Haskell"),
            entry(".lua", "Lua"),
            entry(".r", "R"),
            entry(".dart", "Dart"),
            entry(".vue", "Vue"),
            entry(".svelte", "Svelte"),
            entry(".proto", "Protocol Buffers"),
            entry(".sql", "SQL"),
            entry(".sh", "Shell"), entry(".bash", "Shell"), entry(".zsh", "Shell"),
            entry(".yaml", "YAML"), entry(".yml", "YAML"),
            entry(".toml", "TOML"),
            entry(".json", "JSON"),
            entry(".md", "Markdown"),
            entry(".html", "HTML"), entry(".htm", "HTML"),
            entry(".css", "CSS"), entry(".scss", "SCSS"), entry(".sass", "SCSS"), entry(".less", "LESS"),
            entry(".zig", "Zig"),
            entry(".nim", "Nim"),
            entry(".v", "V"),
            entry(".ml", "OCaml"), entry(".mli", "OCaml")
    );

    /**
     * Returns the language label for a lower-cased extension (with leading dot), or null.
     */
    public String languageOf(String extension) {
        return EXT_LANG.get(extension);
    }

    /**
     * Computes language percentages over all classified files.
     *
     * @param extensionHistogram extension (lower-cased, with dot) to file count
     * @return language to percentage (one decimal), top {@value #MAX_LANGUAGES} by count,
     *         descending; empty when no file has a known extension
     */
    public Map<String, Double> classify(Map<String, Integer> extensionHistogram) {
        var counts = new LinkedHashMap<String, Integer>();
        extensionHistogram.forEach((ext, count) -> {
            String language = languageOf(ext);
            if (language != null) {
                counts.merge(language, count, Integer::sum);
            }
        });

        int total = counts.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) {
            return Map.of();
        }

        var ranked = new ArrayList<>(counts.entrySet());
        ranked.sort((a, b) -> Integer.compare(b.getValue(), a.getValue()));

        var languages = new LinkedHashMap<String, Double>();
        for (var e : ranked.subList(0, Math.min(MAX_LANGUAGES, ranked.size()))) {
            languages.put(e.getKey(), Math.round(e.getValue() * 1000.0 / total) / 10.0);
        }
        return Collections.unmodifiableMap(languages);
    }
}
