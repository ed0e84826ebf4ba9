package io.repo.vectors.scan;

import java.util.Locale;
import java.util.Map;

/**
 * Maps file paths to language tags by extension.
 *
 * <p>Unknown extensions map to {@link #UNKNOWN}. Adding a language is one
 * entry in {@link #EXTENSIONS}.</p>
 */
public final class LanguageClassifier {

    public static final String UNKNOWN = "text";

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
        Map.entry("java", "java"),
        Map.entry("kt", "kotlin"),
        Map.entry("kts", "kotlin"),
        Map.entry("scala", "scala"),
        Map.entry("groovy", "groovy"),
        Map.entry("py", "python"),
        Map.entry("pyi", "python"),
        Map.entry("js", "javascript"),
        Map.entry("jsx", "javascript"),
        Map.entry("mjs", "javascript"),
        Map.entry("cjs", "javascript"),
        Map.entry("ts", "typescript"),
        Map.entry("tsx", "typescript"),
        Map.entry("go", "go"),
        Map.entry("rs", "rust"),
        Map.entry("rb", "ruby"),
        Map.entry("php", "php"),
        Map.entry("c", "c"),
        Map.entry("h", "c"),
        Map.entry("cc", "cpp"),
        Map.entry("cpp", "cpp"),
        Map.entry("cxx", "cpp"),
        Map.entry("hpp", "cpp"),
        Map.entry("cs", "csharp"),
        Map.entry("swift", "swift"),
        Map.entry("sh", "shell"),
        Map.entry("bash", "shell"),
        Map.entry("sql", "sql"),
        Map.entry("html", "html"),
        Map.entry("css", "css"),
        Map.entry("scss", "css"),
        Map.entry("md", "markdown"),
        Map.entry("rst", "markdown"),
        Map.entry("json", "json"),
        Map.entry("yaml", "yaml"),
        Map.entry("yml", "yaml"),
        Map.entry("toml", "toml"),
        Map.entry("xml", "xml"),
        Map.entry("properties", "properties"),
        Map.entry("txt", UNKNOWN)
    );

    private static final Map<String, String> FILE_NAMES = Map.of(
        "dockerfile", "dockerfile",
        "makefile", "makefile"
    );

    private LanguageClassifier() {
    }

    /**
     * Classifies a path (relative or absolute, any separator) by its extension.
     */
    public static String classify(String path) {
        if (path == null || path.isEmpty()) {
            return UNKNOWN;
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String fileName = path.substring(slash + 1).toLowerCase(Locale.ROOT);

        String byName = FILE_NAMES.get(fileName);
        if (byName != null) {
            return byName;
        }

        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return UNKNOWN;
        }
        return EXTENSIONS.getOrDefault(fileName.substring(dot + 1), UNKNOWN);
    }

    /**
     * Returns the lower-case extension of a path without the dot, or "" if none.
     */
    public static String extension(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        String fileName = path.substring(slash + 1);
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
