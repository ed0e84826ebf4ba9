package io.repo.vectors.parser;

import io.repo.vectors.CodeChunk;
import io.repo.vectors.scan.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Chooses the chunking strategy for a file.
 *
 * <p>Languages with a registered {@link StructuralChunker} are chunked from
 * their syntax tree; if that yields nothing, or no chunker is registered, the
 * {@link PatternChunker} takes over.</p>
 */
public class CodeChunker {

    private static final Logger log = LoggerFactory.getLogger(CodeChunker.class);

    private final ChunkerConfig config;
    private final ParserRegistry registry;
    private final PatternChunker patternChunker;

    public CodeChunker(ChunkerConfig config, ParserRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.patternChunker = new PatternChunker(config);
    }

    public List<CodeChunk> chunkFile(SourceFile file) {
        return chunkFile(file.relativePath(), file.content(), file.language());
    }

    /**
     * Splits one file into chunks. The result is identical for identical input.
     */
    public List<CodeChunk> chunkFile(String filePath, String content, String language) {
        Optional<StructuralChunker> structural = registry.lookup(language);

        if (structural.isPresent()) {
            List<CodeChunk> chunks = structural.get().chunk(filePath, content, config);
            if (!chunks.isEmpty()) {
                return chunks;
            }
            log.debug("No structural chunks for {}, using patterns", filePath);
        }

        return patternChunker.chunk(filePath, content, language);
    }

    public ChunkerConfig config() {
        return config;
    }
}
