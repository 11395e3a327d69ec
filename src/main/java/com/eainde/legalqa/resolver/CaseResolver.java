package com.eainde.legalqa.resolver;

import com.eainde.legalqa.conversation.ConversationState;
import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.retrieval.LegalRetriever;
import com.eainde.legalqa.resolver.CaseResolution.Reason;
import com.eainde.legalqa.resolver.CaseResolution.State;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides which case, if any, a question is about, and rewrites it into a standalone query.
 *
 * <h3>Per question, first rule that applies:</h3>
 * <ol>
 *   <li>procedural or opinion question: unlock, no pronoun substitution</li>
 *   <li>explicit case number or title: exact lookup; lock on success, unlock on failure</li>
 *   <li>locked session: topic classifier keeps the lock ({@code same}) or clears it ({@code new})</li>
 *   <li>unlocked session, related follow-up to a question that resolved to an explicit case:
 *       lock to that case</li>
 *   <li>otherwise stay unlocked</li>
 * </ol>
 *
 * <p>A retriever failure during exact lookup is treated as an unresolvable reference.</p>
 */
@Slf4j
public class CaseResolver {

    private final LegalRetriever retriever;
    private final TopicClassifier topicClassifier;
    private final FollowUpDetector followUpDetector;
    private final QueryRewriter rewriter;
    private final Clock clock;

    public CaseResolver(LegalRetriever retriever, TopicClassifier topicClassifier,
                        FollowUpDetector followUpDetector, QueryRewriter rewriter, Clock clock) {
        this.retriever = retriever;
        this.topicClassifier = topicClassifier;
        this.followUpDetector = followUpDetector;
        this.rewriter = rewriter;
        this.clock = clock;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public CaseResolution resolve(String query, ConversationState state) {
        ActiveCaseContext current = state.activeCase();
        List<String> signals = followUpDetector.indicators(query);
        String previousQuery = state.previousQuery();

        if (QueryIntentDetector.isProcedural(query)) {
            return unlocked(query, current, Reason.PROCEDURAL, signals, state, false);
        }
        if (QueryIntentDetector.isGeneralOpinion(query)) {
            return unlocked(query, current, Reason.GENERAL_OPINION, signals, state, false);
        }

        Optional<String> reference = CaseReferenceExtractor.findReference(query);
        if (reference.isPresent()) {
            String ref = reference.get();
            if (current != null && refersTo(current, ref)) {
                return locked(query, current, current, Reason.EXPLICIT_RESOLVED, signals, state);
            }
            Optional<ActiveCaseContext> resolved = lookup(ref);
            if (resolved.isPresent()) {
                log.info("Explicit reference '{}' resolved to case {}", ref, resolved.get().caseId());
                return locked(query, resolved.get(), current, Reason.EXPLICIT_RESOLVED, signals, state);
            }
            log.info("Explicit reference '{}' did not resolve, clearing lock", ref);
            return unlocked(query, current, Reason.EXPLICIT_UNRESOLVED, signals, state, false);
        }

        if (current != null) {
            TopicClassifier.Topic topic = topicClassifier.classify(state.summary(), query, current.caseNumber());
            if (topic == TopicClassifier.Topic.NEW) {
                log.info("Topic change away from case {}", current.caseId());
                return unlocked(query, current, Reason.TOPIC_NEW, signals, state, false);
            }
            return locked(query, current, current, Reason.TOPIC_SAME, signals, state);
        }

        boolean followUp = followUpDetector.isRelatedFollowUp(query, previousQuery);
        ConversationTurn lastTurn = state.lastTurn();
        if (followUp && lastTurn != null && lastTurn.caseId() != null) {
            Optional<ActiveCaseContext> inherited = CaseReferenceExtractor.findReference(previousQuery)
                    .flatMap(this::lookup);
            if (inherited.isPresent()) {
                log.info("Follow-up inherits case {} from previous question", inherited.get().caseId());
                return locked(query, inherited.get(), null, Reason.FOLLOW_UP_INHERITED, signals, state);
            }
        }
        return unlocked(query, null, Reason.NO_CASE, signals, state, followUp);
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private Optional<ActiveCaseContext> lookup(String reference) {
        try {
            List<RawPassage> passages = retriever.findExactCase(reference);
            if (passages == null || passages.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(CaseContextBuilder.fromPassages(reference, passages, Instant.now(clock)));
        } catch (RuntimeException e) {
            log.warn("Exact case lookup for '{}' failed: {}", reference, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean refersTo(ActiveCaseContext activeCase, String reference) {
        String ref = CaseReferenceExtractor.normalize(reference);
        return ref.equals(CaseReferenceExtractor.normalize(activeCase.caseNumber()))
                || ref.equals(CaseReferenceExtractor.normalize(activeCase.caseTitle()));
    }

    private CaseResolution locked(String query, ActiveCaseContext lock, ActiveCaseContext previous,
                                  Reason reason, List<String> signals, ConversationState state) {
        String standalone = rewriter.rewrite(query, lock, state.summary(), state.previousQuery(), true);
        return new CaseResolution(State.LOCKED, lock, standalone, reason,
                !Objects.equals(caseId(previous), lock.caseId()), signals);
    }

    private CaseResolution unlocked(String query, ActiveCaseContext previous, Reason reason,
                                    List<String> signals, ConversationState state, boolean followUp) {
        String standalone = rewriter.rewrite(query, null, state.summary(), state.previousQuery(), followUp);
        return new CaseResolution(State.UNLOCKED, null, standalone, reason, previous != null, signals);
    }

    private static String caseId(ActiveCaseContext context) {
        return context == null ? null : context.caseId();
    }
}
