package io.repo.vectors.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural chunkers available to a pipeline, keyed by language tag.
 *
 * <p>Built once when the pipeline is created and handed to the
 * {@link CodeChunker}; there is no process-wide parser cache.</p>
 */
public final class ParserRegistry {

    private final Map<String, StructuralChunker> chunkers;

    private ParserRegistry(Map<String, StructuralChunker> chunkers) {
        this.chunkers = Collections.unmodifiableMap(new HashMap<>(chunkers));
    }

    /**
     * Registry with every structural chunker shipped in this module.
     */
    public static ParserRegistry defaults() {
        return builder()
            .register("java", new JavaStructuralChunker())
            .build();
    }

    /**
     * Registry without structural chunkers: every language is pattern-chunked.
     */
    public static ParserRegistry empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the structural chunker for a language, if one is registered.
     */
    public Optional<StructuralChunker> lookup(String language) {
        return Optional.ofNullable(chunkers.get(language));
    }

    public Set<String> languages() {
        return chunkers.keySet();
    }

    public static class Builder {
        private final Map<String, StructuralChunker> chunkers = new HashMap<>();

        public Builder register(String language, StructuralChunker chunker) {
            chunkers.put(language, chunker);
            return this;
        }

        public ParserRegistry build() {
            return new ParserRegistry(chunkers);
        }
    }
}
