package com.eainde.legalqa.resolver;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaseReferenceExtractorTest {

    @Test
    @DisplayName("finds a case number with its bracketed court")
    void caseNumberWithCourt() {
        assertThat(CaseReferenceExtractor.findCaseNumber("Status of C.P. 123/2021 Civil (SC) please"))
                .contains("C.P. 123/2021 Civil (SC)");
    }

    @Test
    @DisplayName("'Case No.' is not taken as a case-type prefix")
    void caseNoPrefix() {
        assertThat(CaseReferenceExtractor.findCaseNumber("Case No. 12/2020 Lahore")).isEmpty();
        assertThat(CaseReferenceExtractor.containsCaseNumber("Case No. 12/2020 Lahore")).isTrue();
    }

    @Test
    @DisplayName("finds a party title")
    void title() {
        assertThat(CaseReferenceExtractor.findCaseTitle("what about Ahmed Khan v. State of Punjab"))
                .contains("Ahmed Khan vs State");
    }

    @Test
    @DisplayName("a case number wins over a title")
    void numberFirst() {
        assertThat(CaseReferenceExtractor.findReference("Ahmed vs State in W.P. 45/2019 Writ"))
                .contains("W.P. 45/2019 Writ");
    }

    @Test
    @DisplayName("lists every case number in order")
    void all() {
        assertThat(CaseReferenceExtractor.findAllCaseNumbers("Compare W.P. 45/2019 Writ with C.P. 12/2021 Civil"))
                .containsExactly("W.P. 45/2019 Writ", "C.P. 12/2021 Civil");
    }

    @Test
    @DisplayName("plain questions carry no reference")
    void none() {
        assertThat(CaseReferenceExtractor.findReference("what is bail?")).isEmpty();
        assertThat(CaseReferenceExtractor.findReference(null)).isEmpty();
    }

    @Test
    @DisplayName("normalisation ignores dots, case and spacing")
    void normalize() {
        assertThat(CaseReferenceExtractor.normalize("C.P.  12/2021 Civil"))
                .isEqualTo(CaseReferenceExtractor.normalize("c p 12/2021 CIVIL"))
                .isEqualTo("c p 12/2021 civil");
    }
}
