package com.eainde.legalqa.prompt;

import com.eainde.legalqa.model.RawPassage;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keyword classification of a question into a {@link QueryType} and a {@link LegalDomain}.
 *
 * <p>Rules are checked in declaration order and the first hit wins, so a question mentioning both
 * a case and a statute is a {@code CASE_INQUIRY}. Keywords match whole words, with an optional
 * plural {@code s}.</p>
 */
public final class QueryClassifier {

    private static final Map<QueryType, Pattern> TYPE_RULES = new LinkedHashMap<>();
    private static final Map<LegalDomain, Pattern> DOMAIN_RULES = new LinkedHashMap<>();

    static {
        TYPE_RULES.put(QueryType.CASE_INQUIRY, words("case", "judgment", "order", "decision", "ruling"));
        TYPE_RULES.put(QueryType.LAW_RESEARCH, words("law", "statute", "section", "act", "code", "provision"));
        TYPE_RULES.put(QueryType.PROCEDURAL_GUIDANCE, words("procedure", "process", "how to", "filing"));
        TYPE_RULES.put(QueryType.JUDGE_INQUIRY, words("judge", "justice", "bench", "judicial"));
        TYPE_RULES.put(QueryType.LAWYER_INQUIRY, words("lawyer", "advocate", "counsel", "attorney"));
        TYPE_RULES.put(QueryType.CITATION_LOOKUP, words("cite", "citation", "reference", "plj", "pld", "mld"));
        TYPE_RULES.put(QueryType.CONSTITUTIONAL_QUESTION, constitutional());
        TYPE_RULES.put(QueryType.CRIMINAL_LAW, criminal());
        TYPE_RULES.put(QueryType.CIVIL_LAW, civil());
        TYPE_RULES.put(QueryType.FAMILY_LAW, family());
        TYPE_RULES.put(QueryType.PROPERTY_LAW, property());

        DOMAIN_RULES.put(LegalDomain.CONSTITUTIONAL, constitutional());
        DOMAIN_RULES.put(LegalDomain.CRIMINAL, criminal());
        DOMAIN_RULES.put(LegalDomain.CIVIL, civil());
        DOMAIN_RULES.put(LegalDomain.FAMILY, family());
        DOMAIN_RULES.put(LegalDomain.PROPERTY, property());
        DOMAIN_RULES.put(LegalDomain.COMMERCIAL, words("commercial", "business", "trade", "company"));
        DOMAIN_RULES.put(LegalDomain.ADMINISTRATIVE, words("administrative", "government", "public", "bureaucracy"));
        DOMAIN_RULES.put(LegalDomain.PROCEDURAL, words("procedure", "process", "court procedure", "filing"));
    }

    private QueryClassifier() {
    }

    public static QueryType classifyQueryType(String query) {
        String lower = lower(query);
        return TYPE_RULES.entrySet().stream()
                .filter(e -> e.getValue().matcher(lower).find())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(QueryType.GENERAL_LEGAL);
    }

    /**
     * Domain from the question's keywords, else the most common {@code legal_domain} among the
     * retrieved passages, else {@code GENERAL}.
     */
    public static LegalDomain classifyDomain(String query, List<RawPassage> passages) {
        String lower = lower(query);
        for (Map.Entry<LegalDomain, Pattern> rule : DOMAIN_RULES.entrySet()) {
            if (rule.getValue().matcher(lower).find()) {
                return rule.getKey();
            }
        }
        if (passages == null || passages.isEmpty()) {
            return LegalDomain.GENERAL;
        }
        Map<LegalDomain, Long> votes = passages.stream()
                .map(p -> LegalDomain.fromMetadata(p.legalDomain()))
                .filter(d -> d != null)
                .collect(Collectors.groupingBy(d -> d, () -> new EnumMap<>(LegalDomain.class), Collectors.counting()));
        return votes.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(LegalDomain.GENERAL);
    }

    /**
     * Domain suggested by earlier questions of the conversation, {@code null} when none stands out.
     * Only the domains with a dedicated template are counted.
     */
    public static LegalDomain domainFromHistory(List<String> previousQueries) {
        if (previousQueries == null || previousQueries.isEmpty()) {
            return null;
        }
        Map<LegalDomain, Pattern> indicators = new LinkedHashMap<>();
        indicators.put(LegalDomain.CONSTITUTIONAL, constitutional());
        indicators.put(LegalDomain.CRIMINAL, criminal());
        indicators.put(LegalDomain.CIVIL, civil());
        indicators.put(LegalDomain.FAMILY, family());
        indicators.put(LegalDomain.PROCEDURAL, words("procedure", "filing", "court", "hearing", "process"));

        LegalDomain best = null;
        long bestCount = 0;
        for (Map.Entry<LegalDomain, Pattern> entry : indicators.entrySet()) {
            long count = previousQueries.stream()
                    .mapToLong(q -> entry.getValue().matcher(lower(q)).results().count())
                    .sum();
            if (count > bestCount) {
                best = entry.getKey();
                bestCount = count;
            }
        }
        return best;
    }

    // =========================================================================
    //  Keyword sets
    // =========================================================================

    private static Pattern constitutional() {
        return words("constitution", "constitutional", "article 199", "writ", "fundamental right");
    }

    private static Pattern criminal() {
        return words("criminal", "bail", "fir", "ppc", "crpc", "offence");
    }

    private static Pattern civil() {
        return words("civil", "property", "contract", "cpc", "suit");
    }

    private static Pattern family() {
        return words("family", "divorce", "custody", "inheritance", "marriage");
    }

    private static Pattern property() {
        return words("property", "land", "real estate", "ownership");
    }

    private static Pattern words(String... keywords) {
        String alternation = Arrays.stream(keywords)
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")s?\\b");
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
