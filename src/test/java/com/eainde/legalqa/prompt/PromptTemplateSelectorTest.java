package com.eainde.legalqa.prompt;

import com.eainde.legalqa.model.AnswerStatus;
import com.eainde.legalqa.model.ConversationTurn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptTemplateSelectorTest {

    private final PromptTemplateSelector selector = new PromptTemplateSelector();

    private static List<ConversationTurn> history(String... queries) {
        return Arrays.stream(queries)
                .map(q -> new ConversationTurn("s", 1, q, q, "a", AnswerStatus.SUCCESS, 0.5, null, List.of(), null))
                .toList();
    }

    private String pick(QueryType type, LegalDomain domain) {
        return selector.selectTemplate(type, domain, List.of()).name();
    }

    @Test
    @DisplayName("type and domain together pick the specialist")
    void exactMatch() {
        assertThat(pick(QueryType.CRIMINAL_LAW, LegalDomain.CRIMINAL)).isEqualTo("criminal_law");
        assertThat(pick(QueryType.PROCEDURAL_GUIDANCE, LegalDomain.CRIMINAL)).isEqualTo("criminal_law");
        assertThat(pick(QueryType.CASE_INQUIRY, LegalDomain.CONSTITUTIONAL)).isEqualTo("constitutional_law");
        assertThat(pick(QueryType.PROPERTY_LAW, LegalDomain.PROPERTY)).isEqualTo("civil_law");
    }

    @Test
    @DisplayName("type alone falls back to the generic template for it")
    void typeMatch() {
        assertThat(pick(QueryType.CASE_INQUIRY, LegalDomain.GENERAL)).isEqualTo("case_analysis");
        assertThat(pick(QueryType.PROCEDURAL_GUIDANCE, LegalDomain.COMMERCIAL)).isEqualTo("procedural_guidance");
        assertThat(pick(QueryType.GENERAL_LEGAL, LegalDomain.FAMILY)).isEqualTo("general_legal");
    }

    @Test
    @DisplayName("a domain running through the conversation overrides the pick")
    void historyOverride() {
        AnswerTemplate t = selector.selectTemplate(QueryType.PROCEDURAL_GUIDANCE, LegalDomain.GENERAL,
                history("Is the offence bailable?", "Who registers the FIR?"));

        assertThat(t.name()).isEqualTo("criminal_law");
    }

    @Test
    @DisplayName("the override only applies when that template serves the question type")
    void historyOverrideIgnored() {
        AnswerTemplate t = selector.selectTemplate(QueryType.FAMILY_LAW, LegalDomain.FAMILY,
                history("Is the offence bailable?"));

        assertThat(t.name()).isEqualTo("family_law");
    }

    @Test
    @DisplayName("every built-in template renders the three variables")
    void builtInTemplates() {
        assertThat(selector.templates()).hasSize(7);
        assertThat(selector.templates()).allSatisfy(t -> assertThat(t.userTemplate())
                .contains("{{question}}", "{{context}}", "{{conversation}}"));
    }

    @Test
    @DisplayName("a template set needs a general template")
    void requiresGeneral() {
        List<AnswerTemplate> only = List.of(new AnswerTemplate("x", "s", "{{question}}",
                Set.of(QueryType.CASE_INQUIRY), Set.of(LegalDomain.GENERAL)));

        assertThatThrownBy(() -> new PromptTemplateSelector(only)).isInstanceOf(IllegalArgumentException.class);
    }
}
