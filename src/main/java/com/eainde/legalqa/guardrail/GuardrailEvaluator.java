package com.eainde.legalqa.guardrail;

import com.eainde.legalqa.config.LegalQaProperties;
import com.eainde.legalqa.model.AccessLevel;
import com.eainde.legalqa.model.GuardrailVerdict;
import com.eainde.legalqa.model.QualityMetrics;
import com.eainde.legalqa.model.RiskLevel;
import com.eainde.legalqa.model.SourceReference;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Safety and quality gates around the pipeline.
 *
 * <h3>{@link #checkQuery}</h3>
 * <ul>
 *   <li>high-risk topic: risk {@code HIGH}, lawyer access required, denied for public users</li>
 *   <li>PII shapes (card, SSN, email, phone, ZIP+4): risk at least {@code MEDIUM}, warning</li>
 *   <li>profanity, violent intent, hateful statements: error, denied</li>
 *   <li>very short or very long question, explicit advice request: warning</li>
 * </ul>
 *
 * <h3>{@link #checkResponse}</h3>
 * <p>Denied when the query check has errors, confidence is below the risk-scaled threshold,
 * overall quality is under the floor or hallucination risk exceeds the block threshold.
 * Borderline quality and hallucination findings are warnings. A denied answer carries a safe
 * fallback response.</p>
 *
 * <p>Both checks are pure: the same inputs give the same verdict. An internal failure yields a
 * denied {@code CRITICAL} verdict.</p>
 */
@Slf4j
public class GuardrailEvaluator {

    static final List<String> HIGH_RISK_TOPICS = List.of(
            "terrorism", "national security", "state secrets", "classified",
            "military operations", "intelligence", "counter-terrorism",
            "blasphemy", "religious offense", "hate speech",
            "corruption", "money laundering", "fraud", "embezzlement",
            "drug trafficking", "organized crime", "human trafficking");

    static final List<Pattern> PII_PATTERNS = List.of(
            Pattern.compile("\\b\\d{4}-\\d{4}-\\d{4}-\\d{4}\\b"),
            Pattern.compile("\\b\\d{13,19}\\b"),
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
            Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"),
            Pattern.compile("\\b\\d{5}-\\d{4}\\b"),
            Pattern.compile("\\b\\d{10,11}\\b"));

    /** Label to pattern. Violence and hate require intent so that questions about offences pass. */
    static final List<LabelledPattern> INAPPROPRIATE = List.of(
            new LabelledPattern("profanity", Pattern.compile("\\b(fuck\\w*|shit\\w*|bastard)\\b", Pattern.CASE_INSENSITIVE)),
            new LabelledPattern("violence", Pattern.compile(
                    "\\b(how (do i|to|can i)|help me|i want to|i will|i'm going to|i am going to)\\s+"
                            + "(kill|murder|bomb|hurt|attack)\\b|\\b(make|build) a bomb\\b",
                    Pattern.CASE_INSENSITIVE)),
            new LabelledPattern("hate", Pattern.compile(
                    "\\bi hate (all )?\\w+s\\b|\\b\\w+s (are|is) (inferior|subhuman|vermin)\\b",
                    Pattern.CASE_INSENSITIVE)));

    record LabelledPattern(String label, Pattern pattern) {}

    static final List<String> ADVICE_REQUESTS = List.of("legal advice", "professional advice", "consult a lawyer");

    private final LegalQaProperties.Guardrails config;
    private final ResponseQualityScorer qualityScorer;
    private final HallucinationDetector hallucinationDetector;

    public GuardrailEvaluator(LegalQaProperties.Guardrails config, ResponseQualityScorer qualityScorer,
                              HallucinationDetector hallucinationDetector) {
        this.config = config;
        this.qualityScorer = qualityScorer;
        this.hallucinationDetector = hallucinationDetector;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public GuardrailVerdict checkQuery(String query, AccessLevel accessLevel) {
        if (!config.enabled()) {
            return GuardrailVerdict.pass();
        }
        try {
            QueryAssessment qa = assessQuery(query == null ? "" : query, accessLevel);
            String safe = qa.errors.isEmpty() ? null : SafeResponseComposer.refusal(qa.errors.get(0));
            return new GuardrailVerdict(qa.errors.isEmpty(), qa.risk, qa.warnings, qa.errors, safe,
                    QualityMetrics.none(), threshold(qa.risk), qa.requiredAccess, 0.0, qa.riskFactors);
        } catch (RuntimeException e) {
            log.error("Query guardrail evaluation failed", e);
            return failClosed("Query safety check failed");
        }
    }

    public GuardrailVerdict checkResponse(String query, String answer, List<SourceReference> sources,
                                          double confidence, AccessLevel accessLevel) {
        if (!config.enabled()) {
            return GuardrailVerdict.pass();
        }
        try {
            List<SourceReference> srcs = sources == null ? List.of() : sources;
            QueryAssessment qa = assessQuery(query == null ? "" : query, accessLevel);
            List<String> warnings = new ArrayList<>(qa.warnings);
            List<String> errors = new ArrayList<>(qa.errors);
            if (answer == null || answer.isBlank()) {
                errors.add("Empty response");
            }

            double requiredConfidence = threshold(qa.risk);
            QualityMetrics quality = qualityScorer.score(answer, srcs);
            HallucinationDetector.Assessment hallucination = hallucinationDetector.assess(answer, srcs);

            boolean allowed = errors.isEmpty();
            if (confidence < requiredConfidence) {
                allowed = false;
                warnings.add(String.format(Locale.ROOT, "Confidence %.2f below required threshold %.2f",
                        confidence, requiredConfidence));
            }
            if (quality.overall() < config.qualityWarning()) {
                warnings.add(String.format(Locale.ROOT, "Response quality %.2f below threshold %.2f",
                        quality.overall(), config.qualityWarning()));
            }
            if (quality.overall() < config.qualityFloor()) {
                allowed = false;
                warnings.add("Response quality too low");
            }
            if (hallucination.score() > config.hallucinationWarning()) {
                warnings.addAll(hallucination.findings());
            }
            if (hallucination.score() > config.hallucinationBlock()) {
                allowed = false;
                warnings.add("High risk of hallucination detected");
            }

            RiskLevel risk = qa.risk;
            if (hallucination.score() > config.hallucinationWarning()) {
                risk = risk.max(RiskLevel.HIGH);
            } else if (quality.overall() < config.qualityWarning()) {
                risk = risk.max(RiskLevel.MEDIUM);
            }

            String safe = allowed ? null
                    : errors.isEmpty() ? SafeResponseComposer.compose(query, srcs.size())
                    : SafeResponseComposer.refusal(errors.get(0));

            if (!allowed) {
                log.info("Response denied: risk={}, confidence={}, quality={}, hallucination={}",
                        risk, confidence, quality.overall(), hallucination.score());
            }
            return new GuardrailVerdict(allowed, risk, warnings, errors, safe, quality, requiredConfidence,
                    qa.requiredAccess, hallucination.score(), qa.riskFactors);
        } catch (RuntimeException e) {
            log.error("Response guardrail evaluation failed", e);
            return failClosed("Response quality check failed");
        }
    }

    /**
     * Minimum confidence for a risk level: floor, midpoint, ceiling, critical.
     */
    public double threshold(RiskLevel risk) {
        return switch (risk) {
            case LOW -> config.minConfidence();
            case MEDIUM -> (config.minConfidence() + config.highConfidence()) / 2;
            case HIGH -> config.highConfidence();
            case CRITICAL -> config.criticalConfidence();
        };
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private static final class QueryAssessment {
        RiskLevel risk = RiskLevel.LOW;
        AccessLevel requiredAccess = AccessLevel.PUBLIC;
        final List<String> warnings = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        final List<String> riskFactors = new ArrayList<>();
    }

    private QueryAssessment assessQuery(String query, AccessLevel accessLevel) {
        AccessLevel access = accessLevel == null ? AccessLevel.PUBLIC : accessLevel;
        QueryAssessment qa = new QueryAssessment();
        String lower = query.toLowerCase(Locale.ROOT);

        for (String topic : HIGH_RISK_TOPICS) {
            if (lower.contains(topic)) {
                qa.risk = qa.risk.max(RiskLevel.HIGH);
                qa.requiredAccess = AccessLevel.LAWYER;
                qa.warnings.add("Query contains high-risk topic: " + topic);
                qa.riskFactors.add("high_risk_topic_" + topic.replace(' ', '_'));
            }
        }

        for (Pattern pii : PII_PATTERNS) {
            if (pii.matcher(query).find()) {
                qa.risk = qa.risk.max(RiskLevel.MEDIUM);
                qa.warnings.add("Query may contain personal information");
                qa.riskFactors.add("potential_pii");
                break;
            }
        }

        for (LabelledPattern entry : INAPPROPRIATE) {
            if (entry.pattern().matcher(query).find()) {
                qa.risk = qa.risk.max(RiskLevel.HIGH);
                qa.errors.add("Query contains inappropriate content (" + entry.label() + ")");
                qa.riskFactors.add("inappropriate_content");
            }
        }

        if (query.length() > config.maxQueryLength()) {
            qa.warnings.add("Query is unusually long");
        } else if (query.length() < config.minQueryLength()) {
            qa.warnings.add("Query is very short and may be unclear");
        }

        if (ADVICE_REQUESTS.stream().anyMatch(lower::contains)) {
            qa.warnings.add("Query appears to request legal advice");
            qa.riskFactors.add("advice_request");
        }

        if (qa.errors.isEmpty() && !access.atLeast(qa.requiredAccess)) {
            qa.errors.add("Query requires " + qa.requiredAccess + " access level");
        }
        return qa;
    }

    private GuardrailVerdict failClosed(String error) {
        return new GuardrailVerdict(false, RiskLevel.CRITICAL, List.of(), List.of(error),
                SafeResponseComposer.refusal(error), QualityMetrics.none(), config.criticalConfidence(),
                AccessLevel.LAWYER, 1.0, List.of());
    }
}
