package io.repo.vectors.query;

import io.repo.vectors.ChunkType;
import io.repo.vectors.IndexHit;
import io.repo.vectors.pipeline.EmbeddingAdapter;
import io.repo.vectors.pipeline.RepositoryIndexer;
import io.repo.vectors.pipeline.RepositorySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Answers natural-language queries against published repository snapshots.
 *
 * <p>Read-only: neither the index nor the cache is touched.</p>
 */
public class QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    /** Extra hits fetched per requested result when filtering by type. */
    private static final int FILTER_OVERFETCH = 4;

    private final RepositoryIndexer indexer;
    private final EmbeddingAdapter adapter;

    public QueryEngine(RepositoryIndexer indexer, EmbeddingAdapter adapter) {
        this.indexer = indexer;
        this.adapter = adapter;
    }

    /**
     * Queries the snapshot currently published for a repository identity.
     *
     * @return ranked results, empty if the identity has no snapshot
     */
    public List<RankedResult> query(String identity, String text, int topK) {
        Optional<RepositorySnapshot> snapshot = indexer.snapshot(identity);
        if (snapshot.isEmpty()) {
            log.debug("No snapshot published for {}", identity);
            return List.of();
        }
        return query(snapshot.get(), text, topK);
    }

    public List<RankedResult> query(RepositorySnapshot snapshot, String text, int topK) {
        return query(snapshot, text, topK, null);
    }

    /**
     * Queries a snapshot, keeping only chunks of the given type.
     *
     * @param type chunk type to keep, or null for all
     * @throws io.repo.vectors.pipeline.EmbeddingException if the query cannot be embedded
     */
    public List<RankedResult> query(RepositorySnapshot snapshot, String text, int topK, ChunkType type) {
        if (snapshot.index().isEmpty() || topK <= 0) {
            return List.of();
        }

        float[] queryVector = adapter.embedQuery(text);
        int fetch = type == null ? topK : (int) Math.min(snapshot.size(), (long) topK * FILTER_OVERFETCH);
        List<RankedResult> results = rank(snapshot, snapshot.index().search(queryVector, fetch), type, topK);

        // Widen a filtered search until enough chunks of the type are found or the index is exhausted
        while (type != null && results.size() < topK && fetch < snapshot.size()) {
            fetch = (int) Math.min(snapshot.size(), fetch * 2L);
            results = rank(snapshot, snapshot.index().search(queryVector, fetch), type, topK);
        }

        log.debug("Query '{}' returned {} results", text, results.size());
        return results;
    }

    private static List<RankedResult> rank(RepositorySnapshot snapshot, List<IndexHit> hits, ChunkType type, int topK) {
        List<RankedResult> results = new ArrayList<>(Math.min(topK, hits.size()));
        for (IndexHit hit : hits) {
            if (type != null && snapshot.chunk(hit.row()).type() != type) {
                continue;
            }
            results.add(new RankedResult(results.size() + 1, snapshot.chunk(hit.row()), hit.score()));
            if (results.size() == topK) {
                break;
            }
        }
        return results;
    }
}
