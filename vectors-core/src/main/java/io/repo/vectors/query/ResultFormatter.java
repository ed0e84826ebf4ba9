package io.repo.vectors.query;

import io.repo.vectors.CodeChunk;

import java.util.List;
import java.util.Locale;

/**
 * Renders query results as numbered context blocks for a downstream answer generator.
 */
public final class ResultFormatter {

    public static final String NO_RESULTS = "No relevant repository information found.";

    private ResultFormatter() {
    }

    public static String format(List<RankedResult> results) {
        if (results.isEmpty()) {
            return NO_RESULTS;
        }

        StringBuilder sb = new StringBuilder();
        for (RankedResult result : results) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(header(result)).append('\n').append(result.chunk().content().stripTrailing());
        }
        return sb.toString();
    }

    static String header(RankedResult result) {
        CodeChunk chunk = result.chunk();
        StringBuilder sb = new StringBuilder();
        sb.append("Document ").append(result.rank()).append(':');
        sb.append(" (Type: ").append(chunk.type().name().toLowerCase(Locale.ROOT)).append(')');
        if (chunk.name() != null) {
            sb.append(" (Symbol: ").append(chunk.displayName()).append(')');
        }
        sb.append(" (Path: ").append(chunk.filePath())
            .append(':').append(chunk.startLine()).append('-').append(chunk.endLine()).append(')');
        return sb.toString();
    }
}
