package io.repo.vectors.parser;

import io.repo.vectors.CodeChunk;

import java.util.List;

/**
 * Syntax-tree based chunker for one language.
 *
 * <p>Implementations return an empty list when the source cannot be parsed;
 * the caller then falls back to {@link PatternChunker}.</p>
 */
@FunctionalInterface
public interface StructuralChunker {

    List<CodeChunk> chunk(String filePath, String content, ChunkerConfig config);
}
