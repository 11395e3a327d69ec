package com.eainde.legalqa.context;

import com.eainde.legalqa.model.ClassifiedChunk;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContextFormatterTest {

    private static ClassifiedChunk chunk(String text, SourceType type, Map<String, Object> metadata) {
        return new ClassifiedChunk(new RawPassage(text, 0.5, metadata), text, type, 5, 10, text);
    }

    @Test
    @DisplayName("groups by source type with running numbering and source lines")
    void groupsAndNumbers() {
        String formatted = ContextFormatter.format(List.of(
                chunk("Bail was refused.", SourceType.CASE_LAW, Map.of(
                        RawPassage.CASE_NUMBER, "Crl.A. 45/2019 Lahore",
                        RawPassage.COURT, "Lahore High Court",
                        RawPassage.DATE_DECIDED, "2019-05-02")),
                chunk("Section 497 CrPC.", SourceType.STATUTE, Map.of())));

        assertThat(formatted).isEqualTo("""
                RELEVANT STATUTES AND LAWS:
                [1] Section 497 CrPC.

                RELEVANT CASE LAW:
                [2] Bail was refused.
                   Source: Case: Crl.A. 45/2019 Lahore | Court: Lahore High Court | Date: 2019-05-02""");
    }

    @Test
    @DisplayName("source line falls back to the case title and omits absent fields")
    void sourceLineFallback() {
        RawPassage passage = new RawPassage("t", 0.5, Map.of(RawPassage.CASE_TITLE, "Ali vs State",
                RawPassage.JUDGE_NAME, "Justice Khan"));

        assertThat(ContextFormatter.sourceLine(passage)).isEqualTo("Case: Ali vs State | Judge: Justice Khan");
    }
}
