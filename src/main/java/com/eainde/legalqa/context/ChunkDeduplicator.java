package com.eainde.legalqa.context;

import com.eainde.legalqa.model.ClassifiedChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses chunks sharing a content id and ranks the survivors.
 */
public final class ChunkDeduplicator {

    /** Descending by (priority, relevance). */
    public static final Comparator<ClassifiedChunk> RANKING = Comparator
            .comparingInt(ClassifiedChunk::priority)
            .thenComparingDouble(ClassifiedChunk::relevanceScore)
            .reversed();

    private ChunkDeduplicator() {
    }

    /**
     * Keeps one chunk per content id: the one with the greatest (priority, relevance).
     * Ties keep the first seen. Output preserves first-seen order of content ids.
     */
    public static List<ClassifiedChunk> deduplicate(List<ClassifiedChunk> chunks) {
        Map<String, ClassifiedChunk> best = new LinkedHashMap<>();
        for (ClassifiedChunk chunk : chunks) {
            best.merge(chunk.contentId(), chunk,
                    (kept, candidate) -> RANKING.compare(candidate, kept) < 0 ? candidate : kept);
        }
        return new ArrayList<>(best.values());
    }

    /**
     * Deduplicates then sorts by {@link #RANKING}. The sort is stable.
     */
    public static List<ClassifiedChunk> deduplicateAndRank(List<ClassifiedChunk> chunks) {
        List<ClassifiedChunk> unique = deduplicate(chunks);
        unique.sort(RANKING);
        return unique;
    }
}
