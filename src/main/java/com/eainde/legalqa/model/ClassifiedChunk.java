package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A retrieved passage after source-type inference and priority scoring.
 *
 * @param passage    the original passage (metadata is read from here)
 * @param text       the text that will be packed; may be a truncated form of the passage text
 * @param sourceType inferred source type
 * @param priority   packing priority in [0,20]
 * @param tokenCount token count of {@code text}
 * @param contentId  identity used for deduplication
 */
public record ClassifiedChunk(
        @JsonProperty("passage")    RawPassage passage,
        @JsonProperty("text")       String text,
        @JsonProperty("sourceType") SourceType sourceType,
        @JsonProperty("priority")   int priority,
        @JsonProperty("tokenCount") int tokenCount,
        @JsonProperty("contentId")  String contentId
) {

    @JsonIgnore
    public double relevanceScore() {
        return passage.relevanceScore();
    }

    /**
     * Copy with replaced text, used after truncation.
     */
    public ClassifiedChunk withText(String newText, int newTokenCount) {
        return new ClassifiedChunk(passage, newText, sourceType, priority, newTokenCount, contentId);
    }
}
