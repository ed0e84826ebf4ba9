package io.repo.vectors.parser;

import io.repo.vectors.ChunkType;
import io.repo.vectors.CodeChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Line-oriented chunker driven by {@link LanguagePatterns}.
 *
 * <p>Lines accumulate in a buffer. A function or class marker closes the
 * buffer and opens a new one at the marker. A line that would push the buffer
 * past {@link ChunkerConfig#maxChunkSize()} closes it as well, and the next
 * buffer starts with trailing lines of the closed one (at most
 * {@link ChunkerConfig#overlapSize()} characters, or its last line when that
 * alone is longer) and is typed {@link ChunkType#MIXED}. At end of input the
 * remainder is kept only if it reaches {@link ChunkerConfig#minChunkSize()}.</p>
 */
public class PatternChunker {

    private static final Logger log = LoggerFactory.getLogger(PatternChunker.class);

    private final ChunkerConfig config;

    public PatternChunker() {
        this(ChunkerConfig.defaults());
    }

    public PatternChunker(ChunkerConfig config) {
        this.config = config;
    }

    /**
     * Splits source text into chunks. Never throws for malformed input.
     */
    public List<CodeChunk> chunk(String filePath, String content, String language) {
        List<CodeChunk> chunks = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return chunks;
        }

        LanguagePatterns patterns = LanguagePatterns.forLanguage(language);
        String[] lines = splitLines(content);

        Buffer buffer = new Buffer(1, List.of(), null, null);

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            int lineNumber = i + 1;

            Matcher function = patterns.function().matcher(line);
            Matcher type = patterns.type().matcher(line);
            boolean isFunction = function.find();
            boolean isType = !isFunction && type.find();

            if (isFunction || isType) {
                if (buffer.hasFreshContent()) {
                    chunks.add(buffer.emit(filePath, language));
                }
                buffer = new Buffer(
                    lineNumber,
                    List.of(),
                    LanguagePatterns.name(isFunction ? function : type),
                    isFunction ? ChunkType.FUNCTION : ChunkType.CLASS
                );
            } else if (buffer.wouldExceed(line, config.maxChunkSize()) && buffer.hasFreshContent()) {
                chunks.add(buffer.emit(filePath, language));
                List<String> overlap = overlap(buffer.lines, line);
                buffer = new Buffer(lineNumber - overlap.size(), overlap, buffer.name, ChunkType.MIXED);
            }

            buffer.append(line, classify(line, patterns));
        }

        if (buffer.hasFreshContent() && buffer.chars >= config.minChunkSize()) {
            chunks.add(buffer.emit(filePath, language));
        } else if (buffer.hasFreshContent()) {
            log.debug("Dropped {}-char remnant at end of {}", buffer.chars, filePath);
        }

        return chunks;
    }

    /**
     * Longest whole-line suffix of {@code emitted} that fits in the overlap
     * budget and leaves room for the incoming line. When no line fits the
     * budget, the last line alone is carried as long as it and the incoming
     * line stay within the maximum chunk size.
     */
    private List<String> overlap(List<String> emitted, String incoming) {
        int budget = Math.min(config.overlapSize(), config.maxChunkSize() - incoming.length() - 1);
        int chars = 0;
        int from = emitted.size();

        while (from > 1) {
            String candidate = emitted.get(from - 1);
            int next = chars + candidate.length() + (from == emitted.size() ? 0 : 1);
            if (next > budget) {
                break;
            }
            chars = next;
            from--;
        }

        if (from == emitted.size() && !emitted.isEmpty()) {
            String last = emitted.get(emitted.size() - 1);
            if (!last.isBlank() && last.length() + 1 + incoming.length() <= config.maxChunkSize()) {
                from--;
            }
        }
        return new ArrayList<>(emitted.subList(from, emitted.size()));
    }

    private static LineKind classify(String line, LanguagePatterns patterns) {
        if (line.isBlank()) {
            return LineKind.BLANK;
        }
        if (patterns.imports().matcher(line).find()) {
            return LineKind.IMPORT;
        }
        if (patterns.comment().matcher(line).find()) {
            return LineKind.COMMENT;
        }
        return LineKind.CODE;
    }

    /**
     * Splits on '\n', keeping any '\r' so chunk text is the exact source.
     * A trailing newline does not produce an extra empty line.
     */
    static String[] splitLines(String content) {
        String[] lines = content.split("\n", -1);
        if (lines.length > 1 && lines[lines.length - 1].isEmpty()) {
            String[] trimmed = new String[lines.length - 1];
            System.arraycopy(lines, 0, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return lines;
    }

    private enum LineKind {
        BLANK, IMPORT, COMMENT, CODE
    }

    private static final class Buffer {

        private final int startLine;
        private final List<String> lines;
        private final int freshFrom;
        private final String name;
        private ChunkType type;
        private int chars;
        private boolean freshContent;

        Buffer(int startLine, List<String> overlap, String name, ChunkType type) {
            this.startLine = startLine;
            this.lines = new ArrayList<>(overlap);
            this.freshFrom = overlap.size();
            this.name = name;
            this.type = type;
            this.chars = overlap.isEmpty() ? 0 : String.join("\n", overlap).length();
        }

        boolean hasFreshContent() {
            return freshContent;
        }

        boolean wouldExceed(String line, int maxChunkSize) {
            int separator = lines.isEmpty() ? 0 : 1;
            return chars + separator + line.length() > maxChunkSize;
        }

        void append(String line, LineKind kind) {
            chars += (lines.isEmpty() ? 0 : 1) + line.length();
            lines.add(line);
            if (kind == LineKind.BLANK) {
                return;
            }
            if (lines.size() > freshFrom) {
                freshContent = true;
            }
            if (type == null) {
                type = kind == LineKind.COMMENT ? ChunkType.COMMENT : ChunkType.MODULE;
            } else if (type == ChunkType.COMMENT && kind != LineKind.COMMENT) {
                type = ChunkType.MODULE;
            }
        }

        CodeChunk emit(String filePath, String language) {
            Map<String, String> metadata = new HashMap<>();
            metadata.put(CodeChunk.META_EXTRACTION, CodeChunk.EXTRACTION_PATTERN);
            if (name != null) {
                metadata.put(CodeChunk.META_NAME, name);
            }
            return CodeChunk.of(
                String.join("\n", lines),
                filePath,
                startLine,
                startLine + lines.size() - 1,
                type != null ? type : ChunkType.MODULE,
                language,
                metadata
            );
        }
    }
}
