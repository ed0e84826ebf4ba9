package io.repo.vectors.embeddings;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites source text so that identifiers read like words.
 *
 * <p>{@code parseConfigFile}, {@code parse_config_file} and
 * {@code ParseConfigFile} all become {@code parse config file} (modulo case),
 * which lets a query in plain language meet the code that implements it.</p>
 */
public class CodePreprocessor {

    // lowercase followed by uppercase: cosineSimilarity
    private static final Pattern CAMEL_CASE = Pattern.compile("(\\p{Ll})(\\p{Lu})");

    // acronym followed by a word: XMLParser
    private static final Pattern ACRONYM = Pattern.compile("(\\p{Lu}+)(\\p{Lu}\\p{Ll})");

    private static final Pattern SNAKE_CASE = Pattern.compile("_+");

    private static final Pattern NUMERIC_BOUNDARY = Pattern.compile("(?<=\\p{L})(?=\\d)|(?<=\\d)(?=\\p{L})");

    private static final Pattern IDENTIFIER = Pattern.compile("[\\p{L}_$][\\p{L}\\p{N}_$]*");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Keywords of the common languages; they carry no meaning for retrieval. */
    private static final Set<String> KEYWORDS = Set.of(
        "public", "private", "protected", "static", "final", "void", "class", "interface",
        "return", "new", "this", "self", "def", "func", "fn", "function", "const", "let", "var",
        "import", "from", "package", "if", "else", "for", "while", "in", "is", "not", "and", "or",
        "true", "false", "null", "none", "nil", "int", "string", "bool", "boolean", "pub", "use"
    );

    private final boolean splitCamelCase;
    private final boolean splitSnakeCase;
    private final boolean splitNumeric;
    private final boolean lowercase;
    private final boolean dropKeywords;

    private CodePreprocessor(Builder builder) {
        this.splitCamelCase = builder.splitCamelCase;
        this.splitSnakeCase = builder.splitSnakeCase;
        this.splitNumeric = builder.splitNumeric;
        this.lowercase = builder.lowercase;
        this.dropKeywords = builder.dropKeywords;
    }

    /**
     * Creates a preprocessor that splits identifiers and keeps case and keywords.
     */
    public static CodePreprocessor defaults() {
        return new Builder().build();
    }

    /**
     * Creates a preprocessor for bag-of-words models: lowercase, keywords dropped.
     */
    public static CodePreprocessor forTokens() {
        return new Builder().lowercase(true).dropKeywords(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Splits every identifier in the text and collapses whitespace.
     *
     * @param text source text, may be null
     * @return preprocessed text
     */
    public String preprocess(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        StringBuilder result = new StringBuilder(text.length() + 16);
        Matcher matcher = IDENTIFIER.matcher(text);
        int lastEnd = 0;

        while (matcher.find()) {
            result.append(text, lastEnd, matcher.start());
            result.append(splitIdentifier(matcher.group()));
            lastEnd = matcher.end();
        }
        result.append(text, lastEnd, text.length());

        String processed = WHITESPACE.matcher(result).replaceAll(" ").trim();
        return lowercase ? processed.toLowerCase(Locale.ROOT) : processed;
    }

    /**
     * Extracts the words of all identifiers in the text.
     *
     * <p>Single characters are dropped, and keywords too when the preprocessor
     * was built with {@code dropKeywords}.</p>
     */
    public List<String> tokens(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null) {
            return tokens;
        }

        Matcher matcher = IDENTIFIER.matcher(text);
        while (matcher.find()) {
            for (String part : WHITESPACE.split(splitIdentifier(matcher.group()))) {
                if (part.length() < 2) {
                    continue;
                }
                String token = lowercase ? part.toLowerCase(Locale.ROOT) : part;
                if (dropKeywords && KEYWORDS.contains(token.toLowerCase(Locale.ROOT))) {
                    continue;
                }
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Prefixes the preprocessed code with its cleaned documentation comment.
     *
     * @param code the original code
     * @param doc documentation comment in any common syntax, may be null
     */
    public String withDoc(String code, String doc) {
        String cleaned = cleanDoc(doc);
        String processed = preprocess(code);
        return cleaned.isEmpty() ? processed : cleaned + " " + processed;
    }

    /**
     * Strips comment delimiters and tags from a Javadoc, docstring or line comment.
     */
    static String cleanDoc(String doc) {
        if (doc == null || doc.isBlank()) {
            return "";
        }
        return doc
            .replaceAll("/\\*\\*?|\\*/|\"\"\"|'''", "")
            .replaceAll("(?m)^\\s*(\\*|//+|#+)\\s?", "")
            .replaceAll("@param\\s+\\w+\\s+", "parameter: ")
            .replaceAll("@return\\s+", "returns: ")
            .replaceAll("@throws\\s+\\w+\\s+", "throws: ")
            .replaceAll("\\{@\\w+\\s+([^}]+)}", "$1")
            .replaceAll("@\\w+", "")
            .replaceAll("\\s+", " ")
            .trim();
    }

    private String splitIdentifier(String identifier) {
        String result = identifier;

        if (splitCamelCase) {
            result = CAMEL_CASE.matcher(result).replaceAll("$1 $2");
            result = ACRONYM.matcher(result).replaceAll("$1 $2");
        }
        if (splitSnakeCase) {
            result = SNAKE_CASE.matcher(result).replaceAll(" ").trim();
        }
        if (splitNumeric) {
            result = NUMERIC_BOUNDARY.matcher(result).replaceAll(" ");
        }
        return result;
    }

    public static class Builder {
        private boolean splitCamelCase = true;
        private boolean splitSnakeCase = true;
        private boolean splitNumeric = true;
        private boolean lowercase = false;
        private boolean dropKeywords = false;

        public Builder splitCamelCase(boolean enabled) {
            this.splitCamelCase = enabled;
            return this;
        }

        public Builder splitSnakeCase(boolean enabled) {
            this.splitSnakeCase = enabled;
            return this;
        }

        public Builder splitNumeric(boolean enabled) {
            this.splitNumeric = enabled;
            return this;
        }

        public Builder lowercase(boolean enabled) {
            this.lowercase = enabled;
            return this;
        }

        public Builder dropKeywords(boolean enabled) {
            this.dropKeywords = enabled;
            return this;
        }

        public CodePreprocessor build() {
            return new CodePreprocessor(this);
        }
    }
}
