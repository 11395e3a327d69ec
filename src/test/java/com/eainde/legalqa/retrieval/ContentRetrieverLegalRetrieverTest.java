package com.eainde.legalqa.retrieval;

import com.eainde.legalqa.exception.RetrievalException;
import com.eainde.legalqa.model.RawPassage;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContentRetrieverLegalRetrieverTest {

    @Mock
    private ContentRetriever contentRetriever;

    private static Content content(String text, Map<String, Object> metadata) {
        return Content.from(TextSegment.from(text, Metadata.from(metadata)));
    }

    private List<Content> corpus() {
        return List.of(
                content("Bail granted in the writ", Map.of(
                        RawPassage.CASE_ID, "wp-45", RawPassage.CASE_NUMBER, "W.P. 45/2019 Writ",
                        RawPassage.COURT, "Lahore High Court", "score", 0.91)),
                content("Section 497 CrPC", Map.of(RawPassage.LEGAL_DOMAIN, "criminal")),
                content("Leave refused", Map.of(
                        RawPassage.CASE_ID, "cp-12", RawPassage.CASE_NUMBER, "C.P. 12/2021 Civil",
                        RawPassage.CASE_TITLE, "Ahmed vs State", RawPassage.COURT, "Supreme Court")));
    }

    @Test
    @DisplayName("segments become passages with their metadata and score")
    void search() {
        when(contentRetriever.retrieve(any(Query.class))).thenReturn(corpus());

        List<RawPassage> passages = new ContentRetrieverLegalRetriever(contentRetriever).search("bail", 10, Map.of());

        assertThat(passages).hasSize(3);
        assertThat(passages.get(0).relevanceScore()).isCloseTo(0.91, within(1e-6));
        assertThat(passages.get(0).caseNumber()).isEqualTo("W.P. 45/2019 Writ");
        assertThat(passages.get(1).relevanceScore()).isCloseTo(1.0 - 1.0 / 3, within(1e-9));
    }

    @Test
    @DisplayName("filters and topK are applied")
    void filtersAndLimit() {
        when(contentRetriever.retrieve(any(Query.class))).thenReturn(corpus());
        ContentRetrieverLegalRetriever retriever = new ContentRetrieverLegalRetriever(contentRetriever);

        assertThat(retriever.search("bail", 10, Map.of(RawPassage.LEGAL_DOMAIN, "CRIMINAL")))
                .extracting(RawPassage::text).containsExactly("Section 497 CrPC");
        assertThat(retriever.search("bail", 1, Map.of())).hasSize(1);
    }

    @Test
    @DisplayName("case lookup keeps only that case")
    void byCaseId() {
        when(contentRetriever.retrieve(any(Query.class))).thenReturn(corpus());

        assertThat(new ContentRetrieverLegalRetriever(contentRetriever).getByCaseId("cp-12"))
                .extracting(RawPassage::caseId).containsExactly("cp-12");
    }

    @Test
    @DisplayName("exact lookup matches number or title regardless of dots and case")
    void exactCase() {
        when(contentRetriever.retrieve(any(Query.class))).thenReturn(corpus());
        ContentRetrieverLegalRetriever retriever = new ContentRetrieverLegalRetriever(contentRetriever);

        assertThat(retriever.findExactCase("c.p. 12/2021 civil")).extracting(RawPassage::caseId).containsExactly("cp-12");
        assertThat(retriever.findExactCase("Ahmed vs State")).hasSize(1);
        assertThat(retriever.findExactCase("W.P. 99/2030 Writ")).isEmpty();
    }

    @Test
    @DisplayName("a blank reference is not looked up")
    void blankReference() {
        assertThat(new ContentRetrieverLegalRetriever(contentRetriever).findExactCase(" ")).isEmpty();
    }

    @Test
    @DisplayName("retriever failures are wrapped")
    void failure() {
        when(contentRetriever.retrieve(any(Query.class))).thenThrow(new IllegalStateException("index offline"));

        assertThatThrownBy(() -> new ContentRetrieverLegalRetriever(contentRetriever).search("bail", 5, Map.of()))
                .isInstanceOf(RetrievalException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
