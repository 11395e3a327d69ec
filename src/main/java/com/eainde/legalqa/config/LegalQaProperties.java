package com.eainde.legalqa.config;

import com.eainde.legalqa.model.AccessLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Immutable tuning for the whole pipeline, bound from {@code legalqa.*}.
 *
 * <h3>Example:</h3>
 * <pre>
 * legalqa:
 *   packing:
 *     max-tokens: 2000
 *     max-chunks: 12
 *   guardrails:
 *     min-confidence: 0.3
 *   conversation:
 *     overlap-threshold: 0.25
 *   store:
 *     type: jdbc
 * </pre>
 *
 * <p>Every group falls back to its {@code defaults()} when absent, so the record can also be
 * built directly in tests with {@link #defaults()}.</p>
 */
@ConfigurationProperties(prefix = "legalqa")
public record LegalQaProperties(
        Packing packing,
        Guardrails guardrails,
        Conversation conversation,
        Pipeline pipeline,
        Generation generation,
        Store store
) {

    public LegalQaProperties {
        packing = packing != null ? packing : Packing.defaults();
        guardrails = guardrails != null ? guardrails : Guardrails.defaults();
        conversation = conversation != null ? conversation : Conversation.defaults();
        pipeline = pipeline != null ? pipeline : Pipeline.defaults();
        generation = generation != null ? generation : Generation.defaults();
        store = store != null ? store : Store.defaults();
    }

    public static LegalQaProperties defaults() {
        return new LegalQaProperties(null, null, null, null, null, null);
    }

    // =========================================================================
    //  Groups
    // =========================================================================

    /**
     * Context packing limits.
     */
    public record Packing(
            @DefaultValue("2000") int maxTokens,
            @DefaultValue("12")   int maxChunks,
            @DefaultValue("50")   int minChunkTokens,
            @DefaultValue("400")  int maxChunkTokens,
            @DefaultValue("true") boolean exactTokenizer
    ) {
        public Packing {
            if (maxTokens <= 0 || maxChunks <= 0 || maxChunkTokens <= 0 || minChunkTokens < 0) {
                throw new IllegalArgumentException("Packing limits must be positive: maxTokens=" + maxTokens
                        + ", maxChunks=" + maxChunks + ", minChunkTokens=" + minChunkTokens
                        + ", maxChunkTokens=" + maxChunkTokens);
            }
        }

        public static Packing defaults() {
            return new Packing(2000, 12, 50, 400, true);
        }
    }

    /**
     * Guardrail thresholds. The medium-risk confidence threshold is the midpoint of
     * {@code minConfidence} and {@code highConfidence}.
     */
    public record Guardrails(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0.3")  double minConfidence,
            @DefaultValue("0.8")  double highConfidence,
            @DefaultValue("0.95") double criticalConfidence,
            @DefaultValue("0.5")  double qualityFloor,
            @DefaultValue("0.6")  double qualityWarning,
            @DefaultValue("0.7")  double hallucinationBlock,
            @DefaultValue("0.5")  double hallucinationWarning,
            @DefaultValue("10")   int minQueryLength,
            @DefaultValue("1000") int maxQueryLength
    ) {
        public static Guardrails defaults() {
            return new Guardrails(true, 0.3, 0.8, 0.95, 0.5, 0.6, 0.7, 0.5, 10, 1000);
        }
    }

    /**
     * Conversation memory and case-resolution heuristics.
     */
    public record Conversation(
            @DefaultValue("10")    int historyWindow,
            @DefaultValue("5")     int summaryTurns,
            @DefaultValue("0.25")  double overlapThreshold,
            @DefaultValue("350")   int rewriteMaxChars,
            @DefaultValue("150")   int summaryMaxWords,
            @DefaultValue("10000") long lockCacheSize,
            @DefaultValue("30m")   Duration lockCacheTtl
    ) {
        public static Conversation defaults() {
            return new Conversation(10, 5, 0.25, 350, 150, 10_000, Duration.ofMinutes(30));
        }
    }

    /**
     * Orchestration settings.
     */
    public record Pipeline(
            @DefaultValue("10")     int topK,
            @DefaultValue("10s")    Duration retrievalTimeout,
            @DefaultValue("60s")    Duration generationTimeout,
            @DefaultValue("120s")   Duration streamTimeout,
            @DefaultValue("PUBLIC") AccessLevel defaultAccessLevel,
            @DefaultValue("8")      int workerThreads,
            @DefaultValue("4000")   int maxQueryLength
    ) {
        public static Pipeline defaults() {
            return new Pipeline(10, Duration.ofSeconds(10), Duration.ofSeconds(60), Duration.ofSeconds(120),
                    AccessLevel.PUBLIC, 8, 4000);
        }
    }

    /**
     * Generator defaults. {@code baseConfidence} is the starting confidence for answers from the
     * configured model before length and token-efficiency adjustments.
     */
    public record Generation(
            @DefaultValue("0.85") double baseConfidence
    ) {
        public static Generation defaults() {
            return new Generation(0.85);
        }
    }

    /**
     * Conversation store selection: {@code memory} or {@code jdbc}.
     */
    public record Store(@DefaultValue("memory") String type) {
        public static Store defaults() {
            return new Store("memory");
        }
    }
}
