package com.eainde.legalqa.prompt;

import com.eainde.legalqa.model.ConversationTurn;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the {@link AnswerTemplate} for a question.
 *
 * <h3>Order:</h3>
 * <ol>
 *   <li>first template serving both the query type and the domain</li>
 *   <li>else the first template serving the query type</li>
 *   <li>else {@code general_legal}</li>
 *   <li>a domain suggested by earlier questions overrides the pick when that domain's template
 *       also serves the query type</li>
 * </ol>
 */
@Slf4j
public class PromptTemplateSelector {

    private static final Map<LegalDomain, String> DOMAIN_TEMPLATES = new EnumMap<>(Map.of(
            LegalDomain.CONSTITUTIONAL, LegalPromptTemplates.CONSTITUTIONAL,
            LegalDomain.CRIMINAL, LegalPromptTemplates.CRIMINAL,
            LegalDomain.CIVIL, LegalPromptTemplates.CIVIL,
            LegalDomain.FAMILY, LegalPromptTemplates.FAMILY,
            LegalDomain.PROCEDURAL, LegalPromptTemplates.PROCEDURAL));

    private final List<AnswerTemplate> templates;
    private final AnswerTemplate general;

    public PromptTemplateSelector() {
        this(LegalPromptTemplates.all());
    }

    public PromptTemplateSelector(List<AnswerTemplate> templates) {
        this.templates = List.copyOf(templates);
        this.general = find(LegalPromptTemplates.GENERAL)
                .orElseThrow(() -> new IllegalArgumentException("Template set has no '"
                        + LegalPromptTemplates.GENERAL + "' template"));
    }

    public AnswerTemplate selectTemplate(QueryType queryType, LegalDomain domain, List<ConversationTurn> history) {
        AnswerTemplate selected = templates.stream()
                .filter(t -> t.serves(queryType, domain))
                .findFirst()
                .or(() -> templates.stream().filter(t -> t.serves(queryType)).findFirst())
                .orElse(general);

        if (history != null && !history.isEmpty()) {
            LegalDomain historyDomain = QueryClassifier.domainFromHistory(
                    history.stream().map(ConversationTurn::query).toList());
            Optional<AnswerTemplate> preferred = Optional.ofNullable(historyDomain)
                    .map(DOMAIN_TEMPLATES::get)
                    .flatMap(this::find)
                    .filter(t -> t.serves(queryType));
            if (preferred.isPresent()) {
                selected = preferred.get();
            }
        }

        log.debug("Selected template '{}' for {} in {}", selected.name(), queryType, domain);
        return selected;
    }

    public List<AnswerTemplate> templates() {
        return templates;
    }

    private Optional<AnswerTemplate> find(String name) {
        return templates.stream().filter(t -> t.name().equals(name)).findFirst();
    }
}
