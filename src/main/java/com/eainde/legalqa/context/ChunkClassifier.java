package com.eainde.legalqa.context;

import com.eainde.legalqa.model.ClassifiedChunk;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.SourceType;
import com.eainde.legalqa.resolver.CaseReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers a {@link SourceType} for each retrieved passage and scores its packing priority.
 *
 * <h3>Source type, first match wins:</h3>
 * <ol>
 *   <li>{@code case_id} metadata or a case-number token in the text: {@code case_law}</li>
 *   <li>{@code content_type}/{@code document_type} metadata via {@link #TYPE_LOOKUP}</li>
 *   <li>case cues (petitioner, respondent, case number): {@code case_law}</li>
 *   <li>holding cues (court held, judgment, decided): {@code judgment}</li>
 *   <li>constitutional cues: {@code constitutional_article}</li>
 *   <li>statutory cues (section, article, act, code, ordinance): {@code statute}</li>
 *   <li>order, principle and procedure keywords</li>
 *   <li>otherwise {@code general}</li>
 * </ol>
 *
 * <h3>Priority:</h3>
 * <pre>
 * base(sourceType) + relevance(+3/+2/+1) + recency(+2/+1) + court(+3 supreme, +2 high) + length(+1)
 * clamped to [0, 20]
 * </pre>
 *
 * <p>Pure logic, no Spring dependencies. The clock only feeds the recency bonus.</p>
 */
public class ChunkClassifier {

    private static final Logger log = LoggerFactory.getLogger(ChunkClassifier.class);

    public static final int MAX_PRIORITY = 20;

    /** Metadata type string (substring match) to source type, checked in insertion order. */
    static final Map<String, SourceType> TYPE_LOOKUP = new LinkedHashMap<>();

    static {
        TYPE_LOOKUP.put("constitution", SourceType.CONSTITUTIONAL_ARTICLE);
        TYPE_LOOKUP.put("statute", SourceType.STATUTE);
        TYPE_LOOKUP.put("law", SourceType.STATUTE);
        TYPE_LOOKUP.put("judgment", SourceType.JUDGMENT);
        TYPE_LOOKUP.put("judgement", SourceType.JUDGMENT);
        TYPE_LOOKUP.put("order", SourceType.ORDER);
        TYPE_LOOKUP.put("principle", SourceType.LEGAL_PRINCIPLE);
        TYPE_LOOKUP.put("procedure", SourceType.PROCEDURAL_GUIDANCE);
        TYPE_LOOKUP.put("procedural", SourceType.PROCEDURAL_GUIDANCE);
        TYPE_LOOKUP.put("metadata", SourceType.CASE_METADATA);
        TYPE_LOOKUP.put("case", SourceType.CASE_LAW);
        TYPE_LOOKUP.put("document", SourceType.DOCUMENT_TEXT);
    }

    private static final List<String> CASE_CUES = List.of("case number", "case no", "petitioner", "respondent");
    private static final List<String> JUDGMENT_CUES = List.of("court held", "judgment", "judgement", "decided", "ruled");
    private static final Pattern CONSTITUTIONAL_CUES = Pattern.compile(
            "\\bconstitution(al)?\\b|\\bfundamental rights?\\b|\\barticle\\s+\\d+[a-z]?\\s+of\\s+the\\s+constitution");
    private static final Pattern STATUTORY_CUES = Pattern.compile(
            "\\b(section|article|act|code|ordinance)\\b");
    private static final List<String> ORDER_CUES = List.of("order", "directed", "instructed");
    private static final List<String> PRINCIPLE_CUES = List.of("principle", "doctrine", "maxim");
    private static final List<String> PROCEDURE_CUES = List.of("procedure", "process", "how to", "steps to");

    private static final Pattern LEADING_YEAR = Pattern.compile("(\\d{4})");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int COMPLETENESS_LENGTH = 200;

    private final TokenCounter tokenCounter;
    private final Clock clock;

    public ChunkClassifier(TokenCounter tokenCounter, Clock clock) {
        this.tokenCounter = tokenCounter;
        this.clock = clock;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Classifies and scores one passage.
     *
     * @throws IllegalArgumentException when the passage has no usable text
     */
    public ClassifiedChunk classify(RawPassage passage) {
        String text = passage.effectiveText();
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Passage has no text");
        }
        SourceType type = inferSourceType(passage, text);
        int priority = priority(passage, type, text);
        return new ClassifiedChunk(passage, text, type, priority, tokenCounter.count(text), contentId(passage, text));
    }

    /**
     * Classifies every passage, skipping (and logging) any that fail.
     */
    public List<ClassifiedChunk> classifyAll(List<RawPassage> passages) {
        List<ClassifiedChunk> out = new ArrayList<>(passages.size());
        for (int i = 0; i < passages.size(); i++) {
            RawPassage passage = passages.get(i);
            try {
                out.add(classify(passage));
            } catch (RuntimeException e) {
                log.warn("Skipping passage {} (case_id={}): {}", i,
                        passage == null ? null : passage.caseId(), e.getMessage());
            }
        }
        log.debug("Classified {}/{} passages", out.size(), passages.size());
        return out;
    }

    // =========================================================================
    //  Source type
    // =========================================================================

    SourceType inferSourceType(RawPassage passage, String text) {
        if (passage.caseId() != null || CaseReferenceExtractor.containsCaseNumber(text)) {
            return SourceType.CASE_LAW;
        }

        SourceType fromMetadata = fromMetadata(passage.meta(RawPassage.CONTENT_TYPE));
        if (fromMetadata == null) {
            fromMetadata = fromMetadata(passage.meta(RawPassage.DOCUMENT_TYPE));
        }
        if (fromMetadata != null) {
            return fromMetadata;
        }

        String lower = text.toLowerCase(Locale.ROOT);
        if (containsAny(lower, CASE_CUES)) {
            return SourceType.CASE_LAW;
        }
        if (containsAny(lower, JUDGMENT_CUES)) {
            return SourceType.JUDGMENT;
        }
        if (CONSTITUTIONAL_CUES.matcher(lower).find()) {
            return SourceType.CONSTITUTIONAL_ARTICLE;
        }
        if (STATUTORY_CUES.matcher(lower).find()) {
            return SourceType.STATUTE;
        }
        if (containsAny(lower, ORDER_CUES)) {
            return SourceType.ORDER;
        }
        if (containsAny(lower, PRINCIPLE_CUES)) {
            return SourceType.LEGAL_PRINCIPLE;
        }
        if (containsAny(lower, PROCEDURE_CUES)) {
            return SourceType.PROCEDURAL_GUIDANCE;
        }
        return SourceType.GENERAL;
    }

    private static SourceType fromMetadata(String typeValue) {
        if (typeValue == null) {
            return null;
        }
        String lower = typeValue.toLowerCase(Locale.ROOT).trim();
        for (SourceType type : SourceType.values()) {
            if (type.key().equals(lower)) {
                return type;
            }
        }
        for (Map.Entry<String, SourceType> entry : TYPE_LOOKUP.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    // =========================================================================
    //  Priority
    // =========================================================================

    int priority(RawPassage passage, SourceType type, String text) {
        int score = type.basePriority()
                + relevanceBonus(passage.relevanceScore())
                + recencyBonus(passage.dateDecided())
                + courtBonus(passage.court())
                + (text.length() > COMPLETENESS_LENGTH ? 1 : 0);
        return Math.max(0, Math.min(MAX_PRIORITY, score));
    }

    static int relevanceBonus(double relevance) {
        if (relevance > 0.8) return 3;
        if (relevance > 0.6) return 2;
        if (relevance > 0.4) return 1;
        return 0;
    }

    int recencyBonus(String dateDecided) {
        if (dateDecided == null) {
            return 0;
        }
        Matcher m = LEADING_YEAR.matcher(dateDecided);
        if (!m.find()) {
            return 0;
        }
        int age = Year.now(clock).getValue() - Integer.parseInt(m.group(1));
        if (age < 0) {
            return 0;
        }
        if (age <= 5) return 2;
        if (age <= 10) return 1;
        return 0;
    }

    static int courtBonus(String court) {
        if (court == null) {
            return 0;
        }
        String lower = court.toLowerCase(Locale.ROOT);
        if (lower.contains("supreme")) return 3;
        if (lower.contains("high court")) return 2;
        return 0;
    }

    // =========================================================================
    //  Content id
    // =========================================================================

    /**
     * {@code caseId_documentId_hash}, where the hash covers the trimmed, whitespace-collapsed text.
     */
    static String contentId(RawPassage passage, String text) {
        String normalized = WHITESPACE.matcher(text.trim()).replaceAll(" ");
        String caseId = passage.caseId() != null ? passage.caseId() : "unknown";
        String documentId = passage.documentId() != null ? passage.documentId() : "unknown";
        return caseId + "_" + documentId + "_" + sha256(normalized).substring(0, 16);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
