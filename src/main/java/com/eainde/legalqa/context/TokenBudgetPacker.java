package com.eainde.legalqa.context;

import com.eainde.legalqa.config.LegalQaProperties;
import com.eainde.legalqa.model.ClassifiedChunk;
import com.eainde.legalqa.model.PackedContext;
import com.eainde.legalqa.model.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Selects the best chunks that fit a token budget and renders them as prompt context.
 *
 * <h3>Selection:</h3>
 * <ol>
 *   <li>deduplicate by content id, rank by (priority, relevance) descending</li>
 *   <li>stop at {@code maxChunks}; skip chunks under {@code minChunkTokens}</li>
 *   <li>truncate chunks over {@code maxChunkTokens}</li>
 *   <li>accept while the running total fits {@code maxTokens}; the first chunk is accepted
 *       even when it alone exceeds the budget</li>
 *   <li>if nothing was accepted, force the top-ranked chunk in, truncated</li>
 * </ol>
 *
 * <h3>Usage:</h3>
 * <pre>
 * TokenBudgetPacker packer = TokenBudgetPacker.builder()
 *         .maxTokens(2000)
 *         .maxChunks(12)
 *         .tokenCounter(new TokenCounter(true))
 *         .build();
 *
 * PackedContext context = packer.pack(classifiedChunks);
 * </pre>
 *
 * <p>{@link #pack(List)} never throws: internal failures come back as an
 * {@link PackedContext.Status#ERROR ERROR} context.</p>
 */
public class TokenBudgetPacker {

    private static final Logger log = LoggerFactory.getLogger(TokenBudgetPacker.class);

    private final int maxTokens;
    private final int maxChunks;
    private final int minChunkTokens;
    private final int maxChunkTokens;
    private final TokenCounter tokenCounter;

    private TokenBudgetPacker(Builder builder) {
        this.maxTokens = builder.maxTokens;
        this.maxChunks = builder.maxChunks;
        this.minChunkTokens = builder.minChunkTokens;
        this.maxChunkTokens = builder.maxChunkTokens;
        this.tokenCounter = builder.tokenCounter;

        if (maxTokens <= 0 || maxChunks <= 0 || maxChunkTokens <= 0) {
            throw new IllegalArgumentException("maxTokens, maxChunks and maxChunkTokens must be positive");
        }
    }

    public static TokenBudgetPacker fromProperties(LegalQaProperties.Packing packing, TokenCounter tokenCounter) {
        return builder()
                .maxTokens(packing.maxTokens())
                .maxChunks(packing.maxChunks())
                .minChunkTokens(packing.minChunkTokens())
                .maxChunkTokens(packing.maxChunkTokens())
                .tokenCounter(tokenCounter)
                .build();
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public PackedContext pack(List<ClassifiedChunk> chunks) {
        int originalCount = chunks == null ? 0 : chunks.size();
        if (originalCount == 0) {
            return PackedContext.empty();
        }
        try {
            List<ClassifiedChunk> ranked = ChunkDeduplicator.deduplicateAndRank(chunks);
            List<ClassifiedChunk> selected = select(ranked);
            PackedContext context = assemble(selected, originalCount, ranked.size());
            log.info("Packed {}/{} chunks ({} after dedup) into {} tokens (limit {})",
                    context.chunkCount(), originalCount, ranked.size(), context.tokenCount(), maxTokens);
            return context;
        } catch (RuntimeException e) {
            log.error("Context packing failed for {} chunks", originalCount, e);
            return PackedContext.error("Context packing failed: " + e.getMessage(), originalCount);
        }
    }

    /**
     * Minimal context holding only the top-ranked chunk, truncated. Used to recover from a
     * failed {@link #pack(List)}.
     */
    public PackedContext packSingle(List<ClassifiedChunk> chunks) {
        int originalCount = chunks == null ? 0 : chunks.size();
        if (originalCount == 0) {
            return PackedContext.empty();
        }
        try {
            ClassifiedChunk best = chunks.stream().min(ChunkDeduplicator.RANKING).orElseThrow();
            return assemble(List.of(fitToChunkLimit(best)), originalCount, 1);
        } catch (RuntimeException e) {
            log.error("Single-chunk fallback packing failed", e);
            return PackedContext.error("Fallback packing failed: " + e.getMessage(), originalCount);
        }
    }

    public int maxTokens() {
        return maxTokens;
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    List<ClassifiedChunk> select(List<ClassifiedChunk> ranked) {
        List<ClassifiedChunk> selected = new ArrayList<>();
        int total = 0;

        for (ClassifiedChunk chunk : ranked) {
            if (selected.size() >= maxChunks) {
                break;
            }
            if (chunk.tokenCount() < minChunkTokens) {
                log.debug("Skipping {} ({} tokens below minimum {})",
                        chunk.contentId(), chunk.tokenCount(), minChunkTokens);
                continue;
            }
            ClassifiedChunk fitted = fitToChunkLimit(chunk);
            if (total + fitted.tokenCount() <= maxTokens || selected.isEmpty()) {
                selected.add(fitted);
                total += fitted.tokenCount();
            } else {
                break;
            }
        }

        if (selected.isEmpty() && !ranked.isEmpty()) {
            ClassifiedChunk top = fitToChunkLimit(ranked.get(0));
            log.info("No chunk met the selection rules, force-accepting top chunk {} ({} tokens)",
                    top.contentId(), top.tokenCount());
            selected.add(top);
        }
        return selected;
    }

    ClassifiedChunk fitToChunkLimit(ClassifiedChunk chunk) {
        if (chunk.tokenCount() <= maxChunkTokens) {
            return chunk;
        }
        String truncated = tokenCounter.truncate(chunk.text(), maxChunkTokens);
        int tokens = tokenCounter.count(truncated);
        log.debug("Truncated {} from {} to {} tokens", chunk.contentId(), chunk.tokenCount(), tokens);
        return chunk.withText(truncated, tokens);
    }

    private PackedContext assemble(List<ClassifiedChunk> selected, int originalCount, int processedCount) {
        int total = 0;
        Map<SourceType, Integer> typeCounts = new EnumMap<>(SourceType.class);
        for (ClassifiedChunk chunk : selected) {
            total += chunk.tokenCount();
            typeCounts.merge(chunk.sourceType(), 1, Integer::sum);
        }
        boolean forced = total > maxTokens;
        return PackedContext.success(selected, ContextFormatter.format(selected), total, typeCounts,
                originalCount, processedCount, forced);
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxTokens = 2000;
        private int maxChunks = 12;
        private int minChunkTokens = 50;
        private int maxChunkTokens = 400;
        private TokenCounter tokenCounter = TokenCounter.estimating();

        public Builder maxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder maxChunks(int maxChunks) {
            this.maxChunks = maxChunks;
            return this;
        }

        public Builder minChunkTokens(int minChunkTokens) {
            this.minChunkTokens = minChunkTokens;
            return this;
        }

        public Builder maxChunkTokens(int maxChunkTokens) {
            this.maxChunkTokens = maxChunkTokens;
            return this;
        }

        public Builder tokenCounter(TokenCounter tokenCounter) {
            this.tokenCounter = tokenCounter;
            return this;
        }

        public TokenBudgetPacker build() {
            return new TokenBudgetPacker(this);
        }
    }
}
