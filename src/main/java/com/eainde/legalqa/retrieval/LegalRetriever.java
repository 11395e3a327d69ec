package com.eainde.legalqa.retrieval;

import com.eainde.legalqa.model.RawPassage;

import java.util.List;
import java.util.Map;

/**
 * Source of legal passages. Implementations may block on I/O and may throw
 * {@link com.eainde.legalqa.exception.RetrievalException}.
 */
public interface LegalRetriever {

    /**
     * Semantic search.
     *
     * @param query   standalone query text
     * @param topK    maximum passages to return
     * @param filters metadata equality filters, may be empty
     */
    List<RawPassage> search(String query, int topK, Map<String, Object> filters);

    /**
     * All passages belonging to one case.
     */
    List<RawPassage> getByCaseId(String caseId);

    /**
     * Passages of the case whose number or title matches {@code reference} exactly.
     *
     * @return empty when the reference does not resolve
     */
    List<RawPassage> findExactCase(String reference);
}
