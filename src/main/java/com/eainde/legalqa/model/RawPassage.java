package com.eainde.legalqa.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single passage returned by the retriever, before classification.
 *
 * <h3>Documented metadata keys</h3>
 * <p>{@code case_id}, {@code document_id}, {@code case_number}, {@code case_title}, {@code court},
 * {@code date_decided}, {@code judge_name}, {@code legal_domain}, {@code content_type},
 * {@code document_type}, {@code source}. All are optional.</p>
 *
 * <h3>Text extraction rule</h3>
 * <p>{@link #effectiveText()} returns {@code text} when it is not blank, otherwise the first
 * non-blank metadata value among {@code content}, {@code content_text}, {@code case_description},
 * {@code document_text}, {@code clean_text}, {@code summary}; failing that, a text composed from
 * {@code case_title}, {@code case_description} and {@code short_order}.</p>
 *
 * @param text           passage text, may be blank when the text lives in metadata
 * @param relevanceScore retriever similarity in [0,1]
 * @param metadata       optional fields keyed by the names above
 */
public record RawPassage(
        @JsonProperty("text")           String text,
        @JsonProperty("relevanceScore") double relevanceScore,
        @JsonProperty("metadata")       Map<String, Object> metadata
) {

    public static final String CASE_ID = "case_id";
    public static final String DOCUMENT_ID = "document_id";
    public static final String CASE_NUMBER = "case_number";
    public static final String CASE_TITLE = "case_title";
    public static final String COURT = "court";
    public static final String DATE_DECIDED = "date_decided";
    public static final String JUDGE_NAME = "judge_name";
    public static final String LEGAL_DOMAIN = "legal_domain";
    public static final String CONTENT_TYPE = "content_type";
    public static final String DOCUMENT_TYPE = "document_type";
    public static final String SOURCE = "source";

    private static final List<String> TEXT_FALLBACK_KEYS = List.of(
            "content", "content_text", "case_description", "document_text", "clean_text", "summary");

    public RawPassage {
        text = text == null ? "" : text;
        relevanceScore = Math.max(0.0, Math.min(1.0, relevanceScore));
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RawPassage of(String text, double relevanceScore) {
        return new RawPassage(text, relevanceScore, Map.of());
    }

    /**
     * Returns the metadata value for {@code key} as a trimmed string, or {@code null} when absent or blank.
     */
    public String meta(String key) {
        Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    @JsonIgnore
    public String effectiveText() {
        if (!text.isBlank()) {
            return text;
        }
        for (String key : TEXT_FALLBACK_KEYS) {
            String value = meta(key);
            if (value != null) {
                return value;
            }
        }
        StringBuilder composed = new StringBuilder();
        appendLabelled(composed, "Case", meta(CASE_TITLE));
        appendLabelled(composed, "Description", meta("case_description"));
        appendLabelled(composed, "Order", meta("short_order"));
        return composed.toString();
    }

    @JsonIgnore public String caseId()      { return meta(CASE_ID); }
    @JsonIgnore public String documentId()  { return meta(DOCUMENT_ID); }
    @JsonIgnore public String caseNumber()  { return meta(CASE_NUMBER); }
    @JsonIgnore public String caseTitle()   { return meta(CASE_TITLE); }
    @JsonIgnore public String court()       { return meta(COURT); }
    @JsonIgnore public String dateDecided() { return meta(DATE_DECIDED); }
    @JsonIgnore public String judgeName()   { return meta(JUDGE_NAME); }
    @JsonIgnore public String legalDomain() { return meta(LEGAL_DOMAIN); }

    private static void appendLabelled(StringBuilder sb, String label, String value) {
        if (value == null) {
            return;
        }
        if (sb.length() > 0) {
            sb.append('\n');
        }
        sb.append(label).append(": ").append(value);
    }
}
