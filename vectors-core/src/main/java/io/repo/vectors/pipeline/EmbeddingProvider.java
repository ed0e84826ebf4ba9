package io.repo.vectors.pipeline;

import java.util.List;

/**
 * External embedding function.
 *
 * <p>Returns one vector per input text, in input order, with the same
 * dimension on every call for the lifetime of an index.</p>
 */
@FunctionalInterface
public interface EmbeddingProvider {

    List<float[]> embedBatch(List<String> texts);
}
