package com.eainde.legalqa.resolver;

import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.SourceReference;
import com.eainde.legalqa.model.SourceType;
import com.eainde.legalqa.prompt.CitationFormatter;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link ActiveCaseContext} from the passages of a resolved case.
 * Fields are taken from the first passage that carries them.
 */
final class CaseContextBuilder {

    private CaseContextBuilder() {
    }

    static ActiveCaseContext fromPassages(String reference, List<RawPassage> passages, Instant lockedAt) {
        String caseNumber = first(passages, RawPassage.CASE_NUMBER);
        String caseTitle = first(passages, RawPassage.CASE_TITLE);
        String caseId = first(passages, RawPassage.CASE_ID);
        if (caseId == null) {
            caseId = caseNumber != null ? caseNumber : reference;
        }
        List<SourceReference> sources = passages.stream()
                .map(p -> CitationFormatter.toReference(p, SourceType.CASE_LAW))
                .distinct()
                .limit(5)
                .toList();
        return new ActiveCaseContext(
                caseId,
                caseNumber != null ? caseNumber : reference,
                caseTitle,
                first(passages, RawPassage.COURT),
                firstOf(passages, "bench", RawPassage.JUDGE_NAME),
                first(passages, "status"),
                names(passages, "petitioner_advocates"),
                names(passages, "respondent_advocates"),
                first(passages, "short_order"),
                firstOf(passages, "summary", "case_description"),
                sources,
                lockedAt);
    }

    private static String first(List<RawPassage> passages, String key) {
        return passages.stream().map(p -> p.meta(key)).filter(Objects::nonNull).findFirst().orElse(null);
    }

    private static String firstOf(List<RawPassage> passages, String key, String fallbackKey) {
        String value = first(passages, key);
        return value != null ? value : first(passages, fallbackKey);
    }

    /**
     * Advocate lists arrive either as collections or as comma/semicolon separated strings.
     */
    private static List<String> names(List<RawPassage> passages, String key) {
        for (RawPassage p : passages) {
            Object value = p.metadata().get(key);
            if (value instanceof Collection<?> c && !c.isEmpty()) {
                return c.stream().map(Object::toString).map(String::trim).filter(s -> !s.isEmpty()).toList();
            }
            if (value != null && !value.toString().isBlank()) {
                return Arrays.stream(value.toString().split("[,;]"))
                        .map(String::trim).filter(s -> !s.isEmpty()).toList();
            }
        }
        return List.of();
    }
}
