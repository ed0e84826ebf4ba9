package io.repo.vectors;

/**
 * Kinds of code chunks produced by the chunkers.
 */
public enum ChunkType {
    FUNCTION,
    CLASS,
    MODULE,
    COMMENT,
    MIXED
}
