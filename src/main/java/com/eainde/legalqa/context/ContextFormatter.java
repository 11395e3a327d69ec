package com.eainde.legalqa.context;

import com.eainde.legalqa.model.ClassifiedChunk;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.SourceType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Renders selected chunks as prompt context, grouped by source type in {@link SourceType}
 * declaration order and numbered continuously across groups.
 *
 * <pre>
 * RELEVANT STATUTES AND LAWS:
 * [1] Section 497 CrPC governs bail in non-bailable offences...
 *    Source: Court: Supreme Court | Date: 2021-03-04
 *
 * RELEVANT CASE LAW:
 * [2] ...
 * </pre>
 */
public final class ContextFormatter {

    private ContextFormatter() {
    }

    public static String format(List<ClassifiedChunk> chunks) {
        Map<SourceType, List<ClassifiedChunk>> groups = group(chunks);
        StringBuilder sb = new StringBuilder();
        int index = 1;
        for (Map.Entry<SourceType, List<ClassifiedChunk>> group : groups.entrySet()) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(group.getKey().sectionHeader()).append(':');
            for (ClassifiedChunk chunk : group.getValue()) {
                sb.append('\n').append('[').append(index++).append("] ").append(chunk.text().trim());
                String source = sourceLine(chunk.passage());
                if (!source.isEmpty()) {
                    sb.append("\n   Source: ").append(source);
                }
            }
        }
        return sb.toString();
    }

    /**
     * Groups in {@link SourceType} order, preserving selection order inside each group.
     */
    static Map<SourceType, List<ClassifiedChunk>> group(List<ClassifiedChunk> chunks) {
        Map<SourceType, List<ClassifiedChunk>> groups = new EnumMap<>(SourceType.class);
        for (ClassifiedChunk chunk : chunks) {
            groups.computeIfAbsent(chunk.sourceType(), k -> new ArrayList<>()).add(chunk);
        }
        return groups;
    }

    /**
     * {@code Case: x | Court: y | Date: z | Judge: w}, omitting absent fields.
     */
    static String sourceLine(RawPassage passage) {
        List<String> parts = new ArrayList<>(4);
        String caseRef = passage.caseNumber() != null ? passage.caseNumber() : passage.caseTitle();
        if (caseRef != null) parts.add("Case: " + caseRef);
        if (passage.court() != null) parts.add("Court: " + passage.court());
        if (passage.dateDecided() != null) parts.add("Date: " + passage.dateDecided());
        if (passage.judgeName() != null) parts.add("Judge: " + passage.judgeName());
        return String.join(" | ", parts);
    }
}
