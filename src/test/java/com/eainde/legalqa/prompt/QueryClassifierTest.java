package com.eainde.legalqa.prompt;

import com.eainde.legalqa.model.RawPassage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class QueryClassifierTest {

    @Nested
    @DisplayName("Query type")
    class Types {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource(delimiter = '|', value = {
                "What was the judgment in the bail matter?|CASE_INQUIRY",
                "What does section 302 say?|LAW_RESEARCH",
                "How to file for khula?|PROCEDURAL_GUIDANCE",
                "Who was the judge?|JUDGE_INQUIRY",
                "Which advocates appeared?|LAWYER_INQUIRY",
                "Find the PLD citation|CITATION_LOOKUP",
                "Is a writ available against a university?|CONSTITUTIONAL_QUESTION",
                "Is the offence bailable?|CRIMINAL_LAW",
                "Remedies for breach of contract|CIVIL_LAW",
                "Custody of minor children|FAMILY_LAW",
                "Disputed land mutation|PROPERTY_LAW",
                "Hello there|GENERAL_LEGAL"
        })
        void classifies(String query, QueryType expected) {
            assertThat(QueryClassifier.classifyQueryType(query)).isEqualTo(expected);
        }

        @Test
        @DisplayName("keywords inside other words do not match")
        void wholeWords() {
            // "act" inside "contract", "order" inside "border"
            assertThat(QueryClassifier.classifyQueryType("border contract")).isEqualTo(QueryType.CIVIL_LAW);
        }

        @Test
        @DisplayName("null is a general question")
        void nullQuery() {
            assertThat(QueryClassifier.classifyQueryType(null)).isEqualTo(QueryType.GENERAL_LEGAL);
        }
    }

    @Nested
    @DisplayName("Legal domain")
    class Domains {

        private RawPassage withDomain(String domain) {
            return new RawPassage("text", 0.5, Map.of(RawPassage.LEGAL_DOMAIN, domain));
        }

        @Test
        @DisplayName("question keywords decide first")
        void keywords() {
            assertThat(QueryClassifier.classifyDomain("Bail for murder", List.of(withDomain("civil"))))
                    .isEqualTo(LegalDomain.CRIMINAL);
        }

        @Test
        @DisplayName("otherwise the passages vote")
        void passageVote() {
            List<RawPassage> passages = List.of(withDomain("civil"), withDomain("Civil"), withDomain("family"),
                    withDomain("unknown"));
            assertThat(QueryClassifier.classifyDomain("What happened next?", passages)).isEqualTo(LegalDomain.CIVIL);
        }

        @Test
        @DisplayName("no signal is general")
        void general() {
            assertThat(QueryClassifier.classifyDomain("What happened next?", List.of())).isEqualTo(LegalDomain.GENERAL);
            assertThat(QueryClassifier.classifyDomain("What happened next?", List.of(withDomain("unknown"))))
                    .isEqualTo(LegalDomain.GENERAL);
        }
    }

    @Nested
    @DisplayName("Domain from history")
    class History {

        @Test
        void mostMentionedDomain() {
            assertThat(QueryClassifier.domainFromHistory(List.of("What is bail?", "How is an FIR registered?",
                    "Is divorce possible?"))).isEqualTo(LegalDomain.CRIMINAL);
        }

        @Test
        void noSignal() {
            assertThat(QueryClassifier.domainFromHistory(List.of("hello"))).isNull();
            assertThat(QueryClassifier.domainFromHistory(List.of())).isNull();
        }
    }
}
