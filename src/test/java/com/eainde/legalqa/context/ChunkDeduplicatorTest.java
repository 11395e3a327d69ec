package com.eainde.legalqa.context;

import com.eainde.legalqa.model.ClassifiedChunk;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.SourceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkDeduplicatorTest {

    private static ClassifiedChunk chunk(String contentId, String label, int priority, double relevance) {
        return new ClassifiedChunk(RawPassage.of(label, relevance), label, SourceType.CASE_LAW, priority, 10, contentId);
    }

    @Test
    void keepsTheHighestPriorityCopyOfEachContentId() {
        List<ClassifiedChunk> unique = ChunkDeduplicator.deduplicate(List.of(
                chunk("a", "a-low", 3, 0.9),
                chunk("b", "b", 5, 0.5),
                chunk("a", "a-high", 8, 0.1)));

        assertThat(unique).extracting(ClassifiedChunk::text).containsExactly("a-high", "b");
    }

    @Test
    void relevanceBreaksPriorityTiesAndFullTiesKeepTheFirst() {
        List<ClassifiedChunk> unique = ChunkDeduplicator.deduplicate(List.of(
                chunk("a", "first", 5, 0.4),
                chunk("a", "more-relevant", 5, 0.7),
                chunk("a", "same-as-best", 5, 0.7)));

        assertThat(unique).extracting(ClassifiedChunk::text).containsExactly("more-relevant");
    }

    @Test
    void rankingOrdersByPriorityThenRelevance() {
        List<ClassifiedChunk> ranked = ChunkDeduplicator.deduplicateAndRank(List.of(
                chunk("a", "a", 2, 0.9),
                chunk("b", "b", 9, 0.1),
                chunk("c", "c", 9, 0.6)));

        assertThat(ranked).extracting(ClassifiedChunk::text).containsExactly("c", "b", "a");
    }
}
