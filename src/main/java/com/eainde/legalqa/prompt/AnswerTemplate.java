package com.eainde.legalqa.prompt;

import java.util.Set;

/**
 * A system prompt and a user prompt template for one kind of legal question.
 *
 * <p>The user template uses LangChain4j {@code {{variable}}} placeholders:
 * {@code question}, {@code context} and {@code conversation}.</p>
 *
 * @param name          stable identifier reported in answer metadata
 * @param systemPrompt  instructions sent as the system message
 * @param userTemplate  template of the user message
 * @param queryTypes    question kinds this template serves
 * @param domains       legal domains this template serves
 */
public record AnswerTemplate(
        String name,
        String systemPrompt,
        String userTemplate,
        Set<QueryType> queryTypes,
        Set<LegalDomain> domains
) {

    public AnswerTemplate {
        queryTypes = queryTypes == null ? Set.of() : Set.copyOf(queryTypes);
        domains = domains == null ? Set.of() : Set.copyOf(domains);
    }

    public boolean serves(QueryType queryType) {
        return queryTypes.contains(queryType);
    }

    public boolean serves(QueryType queryType, LegalDomain domain) {
        return queryTypes.contains(queryType) && domains.contains(domain);
    }
}
