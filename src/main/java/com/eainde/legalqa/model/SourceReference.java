package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A source cited alongside an answer.
 *
 * @param caseId         case identifier, if known
 * @param caseNumber     court case number, if known
 * @param title          human readable title
 * @param court          court name, if known
 * @param dateDecided    decision date as supplied by the retriever
 * @param judgeName      judge name, if known
 * @param sourceType     inferred source type
 * @param relevanceScore retriever relevance in [0,1]
 * @param citation       formatted citation line
 */
public record SourceReference(
        @JsonProperty("caseId")         String caseId,
        @JsonProperty("caseNumber")     String caseNumber,
        @JsonProperty("title")          String title,
        @JsonProperty("court")          String court,
        @JsonProperty("dateDecided")    String dateDecided,
        @JsonProperty("judgeName")      String judgeName,
        @JsonProperty("sourceType")     SourceType sourceType,
        @JsonProperty("relevanceScore") double relevanceScore,
        @JsonProperty("citation")       String citation
) {}
