package io.repo.vectors.parser;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line markers used by {@link PatternChunker}, one set per language.
 *
 * <p>The {@code function} and {@code type} patterns capture the symbol in a
 * group called {@code name}. Languages without an entry fall back to
 * {@link #PLAIN}, which never matches and leaves pure size-based splitting.</p>
 */
public record LanguagePatterns(Pattern function, Pattern type, Pattern imports, Pattern comment) {

    private static final Pattern NEVER = Pattern.compile("(?<name>[^\\s\\S])");

    private static final String C_COMMENT = "^\\s*(?://|/\\*|\\*)";

    private static final String NOT_KEYWORD =
        "(?!(?:if|for|while|switch|catch|return|new|else|do|try|throw|sizeof)\\b)";

    public static final LanguagePatterns PLAIN = new LanguagePatterns(NEVER, NEVER, NEVER, NEVER);

    public static final LanguagePatterns PYTHON = of(
        "^\\s*(?:async\\s+)?def\\s+(?<name>\\w+)",
        "^\\s*class\\s+(?<name>\\w+)",
        "^\\s*(?:import|from)\\s+[\\w.]+",
        "^\\s*(?:#|\"\"\"|''')"
    );

    public static final LanguagePatterns JAVASCRIPT = of(
        "^\\s*(?:export\\s+)?(?:default\\s+)?(?:(?:async\\s+)?function\\s*\\*?\\s*"
            + "|(?:const|let|var)\\s+(?=[\\w$]+\\s*=\\s*(?:async\\s*)?(?:\\([^)]*\\)|[\\w$]+)\\s*=>))"
            + "(?<name>[\\w$]+)",
        "^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?(?:class|interface)\\s+(?<name>[\\w$]+)",
        "^\\s*(?:import\\s|export\\s.*\\sfrom\\s|(?:const|let|var)\\s+[\\w${}, ]+=\\s*require\\()",
        C_COMMENT
    );

    public static final LanguagePatterns JAVA = of(
        "^\\s*(?:@\\w+(?:\\([^)]*\\))?\\s+)*"
            + "(?:(?:public|protected|private|static|final|abstract|synchronized|native|default)\\s+)*"
            + "(?:<[^>]+>\\s+)?[\\w<>\\[\\],.?]+\\s+" + NOT_KEYWORD + "(?<name>\\w+)\\s*\\([^;]*$",
        "^\\s*(?:(?:public|protected|private|static|final|abstract|sealed|non-sealed)\\s+)*"
            + "(?:class|interface|enum|record|@interface)\\s+(?<name>\\w+)",
        "^\\s*(?:import|package)\\s",
        C_COMMENT
    );

    public static final LanguagePatterns KOTLIN = of(
        "^\\s*(?:\\w+\\s+)*fun\\s+(?:<[^>]*>\\s*)?(?:[\\w.]+\\.)?(?<name>\\w+)",
        "^\\s*(?:\\w+\\s+)*(?:class|interface|object)\\s+(?<name>\\w+)",
        "^\\s*(?:import|package)\\s",
        C_COMMENT
    );

    public static final LanguagePatterns GO = of(
        "^func\\s+(?:\\([^)]*\\)\\s*)?(?<name>\\w+)",
        "^type\\s+(?<name>\\w+)\\s+(?:struct|interface)",
        "^\\s*(?:import|package)\\b",
        "^\\s*//"
    );

    public static final LanguagePatterns RUST = of(
        "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:async\\s+)?(?:unsafe\\s+)?(?:const\\s+)?fn\\s+(?<name>\\w+)",
        "^\\s*(?:pub(?:\\([^)]*\\))?\\s+)?(?:struct|enum|trait|impl(?:<[^>]*>)?)\\s+(?<name>\\w+)",
        "^\\s*(?:use|mod)\\s",
        "^\\s*//"
    );

    public static final LanguagePatterns RUBY = of(
        "^\\s*def\\s+(?:self\\.)?(?<name>[\\w?!=]+)",
        "^\\s*(?:class|module)\\s+(?<name>[\\w:]+)",
        "^\\s*require(?:_relative)?\\s",
        "^\\s*#"
    );

    public static final LanguagePatterns PHP = of(
        "^\\s*(?:(?:public|protected|private|static|abstract|final)\\s+)*function\\s+(?<name>\\w+)",
        "^\\s*(?:abstract\\s+|final\\s+)?(?:class|interface|trait)\\s+(?<name>\\w+)",
        "^\\s*(?:use|require|require_once|include|include_once|namespace)\\s",
        "^\\s*(?://|#|/\\*|\\*)"
    );

    public static final LanguagePatterns C_FAMILY = of(
        "^(?:[\\w:*&<>,]+\\s+)+\\*?" + NOT_KEYWORD + "(?<name>[\\w:~]+)\\s*\\([^;]*$",
        "^\\s*(?:class|struct)\\s+(?<name>\\w+)(?![^;]*;\\s*$)",
        "^\\s*#\\s*include",
        C_COMMENT
    );

    public static final LanguagePatterns CSHARP = of(
        "^\\s*(?:(?:public|protected|private|internal|static|virtual|override|abstract|async|sealed)\\s+)+"
            + "[\\w<>\\[\\],.?]+\\s+" + NOT_KEYWORD + "(?<name>\\w+)\\s*\\([^;]*$",
        "^\\s*(?:(?:public|protected|private|internal|static|abstract|sealed|partial)\\s+)*"
            + "(?:class|interface|struct|enum|record)\\s+(?<name>\\w+)",
        "^\\s*(?:using|namespace)\\s",
        C_COMMENT
    );

    public static final LanguagePatterns SHELL = new LanguagePatterns(
        Pattern.compile("^\\s*(?:function\\s+)?(?<name>[\\w-]+)\\s*\\(\\)"),
        NEVER,
        Pattern.compile("^\\s*(?:source|\\.)\\s"),
        Pattern.compile("^\\s*#")
    );

    private static final Map<String, LanguagePatterns> BY_LANGUAGE = Map.ofEntries(
        Map.entry("python", PYTHON),
        Map.entry("javascript", JAVASCRIPT),
        Map.entry("typescript", JAVASCRIPT),
        Map.entry("java", JAVA),
        Map.entry("groovy", JAVA),
        Map.entry("kotlin", KOTLIN),
        Map.entry("go", GO),
        Map.entry("rust", RUST),
        Map.entry("ruby", RUBY),
        Map.entry("php", PHP),
        Map.entry("c", C_FAMILY),
        Map.entry("cpp", C_FAMILY),
        Map.entry("csharp", CSHARP),
        Map.entry("shell", SHELL)
    );

    /**
     * Returns the markers for a language tag, {@link #PLAIN} if none are known.
     */
    public static LanguagePatterns forLanguage(String language) {
        return BY_LANGUAGE.getOrDefault(language, PLAIN);
    }

    /**
     * Returns the captured symbol name of a successful match, or {@code null}.
     */
    static String name(Matcher matcher) {
        String name = matcher.group("name");
        return name == null || name.isEmpty() ? null : name;
    }

    private static LanguagePatterns of(String function, String type, String imports, String comment) {
        return new LanguagePatterns(
            Pattern.compile(function),
            Pattern.compile(type),
            Pattern.compile(imports),
            Pattern.compile(comment)
        );
    }
}
