package com.eainde.legalqa.retrieval;

import com.eainde.legalqa.exception.RetrievalException;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.resolver.CaseReferenceExtractor;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * {@link LegalRetriever} over a LangChain4j {@link ContentRetriever}.
 *
 * <p>Segment metadata becomes passage metadata. The relevance score is read from the
 * {@code score} or {@code relevance_score} metadata key and otherwise derived from rank.
 * Filtering, case lookup and exact matching are applied to the retrieved segments.</p>
 */
@Slf4j
public class ContentRetrieverLegalRetriever implements LegalRetriever {

    private final ContentRetriever contentRetriever;

    public ContentRetrieverLegalRetriever(ContentRetriever contentRetriever) {
        this.contentRetriever = contentRetriever;
    }

    @Override
    public List<RawPassage> search(String query, int topK, Map<String, Object> filters) {
        List<RawPassage> passages = retrieve(query);
        return passages.stream()
                .filter(p -> matches(p, filters))
                .limit(Math.max(0, topK))
                .toList();
    }

    @Override
    public List<RawPassage> getByCaseId(String caseId) {
        return retrieve(caseId).stream()
                .filter(p -> caseId.equals(p.caseId()))
                .toList();
    }

    @Override
    public List<RawPassage> findExactCase(String reference) {
        String wanted = CaseReferenceExtractor.normalize(reference);
        if (wanted.isEmpty()) {
            return List.of();
        }
        List<RawPassage> hits = retrieve(reference).stream()
                .filter(p -> wanted.equals(CaseReferenceExtractor.normalize(p.caseNumber()))
                        || wanted.equals(CaseReferenceExtractor.normalize(p.caseTitle())))
                .toList();
        log.debug("Exact case lookup '{}' matched {} passages", reference, hits.size());
        return hits;
    }

    private List<RawPassage> retrieve(String text) {
        List<Content> contents;
        try {
            contents = contentRetriever.retrieve(Query.from(text));
        } catch (RuntimeException e) {
            throw new RetrievalException("Content retrieval failed", e);
        }
        if (contents == null) {
            return List.of();
        }
        int size = contents.size();
        return IntStream.range(0, size)
                .mapToObj(i -> toPassage(contents.get(i), i, size))
                .filter(Objects::nonNull)
                .toList();
    }

    static RawPassage toPassage(Content content, int rank, int total) {
        TextSegment segment = content.textSegment();
        if (segment == null) {
            return null;
        }
        Map<String, Object> metadata = new LinkedHashMap<>(segment.metadata().toMap());
        double score = scoreOf(metadata, rank, total);
        return new RawPassage(segment.text(), score, metadata);
    }

    private static double scoreOf(Map<String, Object> metadata, int rank, int total) {
        for (String key : List.of("score", "relevance_score")) {
            Object value = metadata.get(key);
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            if (value != null) {
                try {
                    return Double.parseDouble(value.toString());
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric {} metadata '{}'", key, value);
                }
            }
        }
        return total == 0 ? 0.0 : 1.0 - ((double) rank / total);
    }

    private static boolean matches(RawPassage passage, Map<String, Object> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object actual = passage.metadata().get(filter.getKey());
            if (actual == null || !actual.toString().equalsIgnoreCase(String.valueOf(filter.getValue()))) {
                return false;
            }
        }
        return true;
    }
}
