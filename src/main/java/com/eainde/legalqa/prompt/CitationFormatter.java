package com.eainde.legalqa.prompt;

import com.eainde.legalqa.model.ClassifiedChunk;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.SourceReference;
import com.eainde.legalqa.model.SourceType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns passages into the source references returned with an answer.
 *
 * <p>Citation line: {@code Title, Case No. X, Court, decided Date, Judge}, absent parts omitted.</p>
 */
public final class CitationFormatter {

    static final String UNTITLED = "Legal source";

    private CitationFormatter() {
    }

    public static SourceReference toReference(RawPassage passage, SourceType type) {
        String title = firstNonNull(passage.caseTitle(), passage.caseNumber(), passage.meta(RawPassage.SOURCE), UNTITLED);
        return new SourceReference(
                passage.caseId(),
                passage.caseNumber(),
                title,
                passage.court(),
                passage.dateDecided(),
                passage.judgeName(),
                type,
                passage.relevanceScore(),
                citation(title, passage));
    }

    /**
     * One reference per distinct case (or per chunk when it carries no case id), in chunk order.
     */
    public static List<SourceReference> fromChunks(List<ClassifiedChunk> chunks) {
        Map<String, SourceReference> byKey = new LinkedHashMap<>();
        for (ClassifiedChunk chunk : chunks) {
            String key = chunk.passage().caseId() != null ? chunk.passage().caseId() : chunk.contentId();
            byKey.putIfAbsent(key, toReference(chunk.passage(), chunk.sourceType()));
        }
        return new ArrayList<>(byKey.values());
    }

    static String citation(String title, RawPassage passage) {
        List<String> parts = new ArrayList<>();
        parts.add(title);
        if (passage.caseNumber() != null && !passage.caseNumber().equals(title)) {
            parts.add("Case No. " + passage.caseNumber());
        }
        if (passage.court() != null) parts.add(passage.court());
        if (passage.dateDecided() != null) parts.add("decided " + passage.dateDecided());
        if (passage.judgeName() != null) parts.add(passage.judgeName());
        return String.join(", ", parts);
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
