package io.repo.vectors.scan;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration for the file selector.
 */
public record SelectorConfig(
    /** Files larger than this are skipped */
    long maxFileSizeBytes,

    /** Path fragments that exclude a file, matched case-insensitively */
    Set<String> excludeNameFragments,

    /** Extensions without the dot; empty means every extension */
    Set<String> includeExtensions
) {
    public SelectorConfig {
        if (maxFileSizeBytes <= 0) throw new IllegalArgumentException("maxFileSizeBytes must be > 0");
        excludeNameFragments = lowerCase(excludeNameFragments);
        includeExtensions = lowerCase(includeExtensions).stream()
            .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
            .collect(Collectors.toUnmodifiableSet());
    }

    public static SelectorConfig defaults() {
        return new SelectorConfig(
            1024 * 1024,
            Set.of(".git/", "node_modules/", "target/", "build/", "dist/",
                "__pycache__/", ".venv/", ".idea/"),
            Set.of()
        );
    }

    public SelectorConfig withMaxFileSizeBytes(long maxFileSizeBytes) {
        return new SelectorConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions);
    }

    public SelectorConfig withExcludeNameFragments(Set<String> excludeNameFragments) {
        return new SelectorConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions);
    }

    public SelectorConfig withIncludeExtensions(Set<String> includeExtensions) {
        return new SelectorConfig(maxFileSizeBytes, excludeNameFragments, includeExtensions);
    }

    private static Set<String> lowerCase(Set<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
            .map(v -> v.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }
}
