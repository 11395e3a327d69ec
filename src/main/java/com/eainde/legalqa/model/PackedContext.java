package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The token-bounded evidence block handed to the generator, plus diagnostics.
 *
 * <p>A packed context never exceeds the configured token and chunk limits, except when the
 * single best chunk alone exceeds the token budget; it is then force-accepted as the only chunk
 * and {@link #forcedOverBudget()} is {@code true}.</p>
 *
 * @param status             {@code SUCCESS} or {@code ERROR}
 * @param chunks             selected chunks in selection order
 * @param contextText        formatted text grouped by source type
 * @param tokenCount         total tokens over {@code chunks}
 * @param typeCounts         selected chunk count per source type
 * @param chunkSummaries     one diagnostic row per selected chunk
 * @param originalCount      chunks handed to the packer
 * @param processedCount     chunks remaining after deduplication
 * @param forcedOverBudget   whether the single selected chunk exceeds the token budget
 * @param errorMessage       failure description when {@code status == ERROR}
 */
public record PackedContext(
        @JsonProperty("status")           Status status,
        @JsonProperty("chunks")           List<ClassifiedChunk> chunks,
        @JsonProperty("contextText")      String contextText,
        @JsonProperty("tokenCount")       int tokenCount,
        @JsonProperty("typeCounts")       Map<SourceType, Integer> typeCounts,
        @JsonProperty("chunkSummaries")   List<ChunkSummary> chunkSummaries,
        @JsonProperty("originalCount")    int originalCount,
        @JsonProperty("processedCount")   int processedCount,
        @JsonProperty("forcedOverBudget") boolean forcedOverBudget,
        @JsonProperty("errorMessage")     String errorMessage
) {

    public enum Status { SUCCESS, ERROR }

    /**
     * Diagnostic row describing one selected chunk.
     */
    public record ChunkSummary(
            @JsonProperty("contentId")      String contentId,
            @JsonProperty("sourceType")     SourceType sourceType,
            @JsonProperty("priority")       int priority,
            @JsonProperty("tokenCount")     int tokenCount,
            @JsonProperty("relevanceScore") double relevanceScore,
            @JsonProperty("caseNumber")     String caseNumber,
            @JsonProperty("court")          String court
    ) {
        public static ChunkSummary of(ClassifiedChunk chunk) {
            return new ChunkSummary(chunk.contentId(), chunk.sourceType(), chunk.priority(),
                    chunk.tokenCount(), chunk.relevanceScore(),
                    chunk.passage().caseNumber(), chunk.passage().court());
        }
    }

    public PackedContext {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        contextText = contextText == null ? "" : contextText;
        typeCounts = typeCounts == null || typeCounts.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(typeCounts));
        chunkSummaries = chunkSummaries == null ? List.of() : List.copyOf(chunkSummaries);
    }

    public static PackedContext success(List<ClassifiedChunk> chunks, String contextText, int tokenCount,
                                        Map<SourceType, Integer> typeCounts, int originalCount,
                                        int processedCount, boolean forcedOverBudget) {
        List<ChunkSummary> summaries = chunks.stream().map(ChunkSummary::of).toList();
        return new PackedContext(Status.SUCCESS, chunks, contextText, tokenCount, typeCounts,
                summaries, originalCount, processedCount, forcedOverBudget, null);
    }

    public static PackedContext empty() {
        return new PackedContext(Status.SUCCESS, List.of(), "", 0, Map.of(), List.of(), 0, 0, false, null);
    }

    public static PackedContext error(String errorMessage, int originalCount) {
        return new PackedContext(Status.ERROR, List.of(), "", 0, Map.of(), List.of(),
                originalCount, 0, false, errorMessage);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    @JsonIgnore
    public int chunkCount() {
        return chunks.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    /**
     * Packing ratios for diagnostics: dedup ratio, selection ratio and token efficiency.
     */
    @JsonIgnore
    public Map<String, Object> packingMetadata(int maxTokens) {
        double dedupRatio = originalCount == 0 ? 0.0 : (double) processedCount / originalCount;
        double selectionRatio = processedCount == 0 ? 0.0 : (double) chunks.size() / processedCount;
        double tokenEfficiency = maxTokens <= 0 ? 0.0 : (double) tokenCount / maxTokens;
        return Map.of(
                "originalChunks", originalCount,
                "processedChunks", processedCount,
                "selectedChunks", chunks.size(),
                "dedupRatio", dedupRatio,
                "selectionRatio", selectionRatio,
                "tokenEfficiency", tokenEfficiency);
    }
}
