package com.eainde.legalqa.resolver;

import com.eainde.legalqa.conversation.ConversationState;
import com.eainde.legalqa.model.ActiveCaseContext;
import com.eainde.legalqa.model.AnswerStatus;
import com.eainde.legalqa.model.ConversationTurn;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.model.Session;
import com.eainde.legalqa.resolver.CaseResolution.Reason;
import com.eainde.legalqa.resolver.CaseResolution.State;
import com.eainde.legalqa.retrieval.LegalRetriever;
import com.eainde.legalqa.retrieval.TimeBoundedLegalRetriever;
import com.eainde.legalqa.thread.MdcAwareExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CaseResolverTest {

    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final ActiveCaseContext CASE_A = new ActiveCaseContext(
            "cp-12", "C.P. 12/2021 Civil", "Ahmed vs State", "Supreme Court of Pakistan",
            null, null, null, null, null, null, null, NOW);

    @Mock
    private LegalRetriever retriever;

    private CaseResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CaseResolver(retriever, new TopicClassifier(), new FollowUpDetector(0.25),
                new QueryRewriter(500), CLOCK);
    }

    private static ConversationState unlocked(List<ConversationTurn> turns) {
        return new ConversationState(Session.open("s1", "u1", null, NOW), turns, "No prior conversation.", false);
    }

    private static ConversationState locked(ActiveCaseContext activeCase) {
        Session session = Session.open("s1", "u1", null, NOW).withActiveCase(activeCase);
        return new ConversationState(session, List.of(), "Active case: " + activeCase.displayReference() + ".", false);
    }

    private static ConversationTurn turn(String query, String caseId) {
        return new ConversationTurn("s1", 1, query, query, "answer", AnswerStatus.SUCCESS, 0.8, caseId,
                List.of(), NOW);
    }

    private static RawPassage casePassage(String caseId, String caseNumber, String title) {
        return new RawPassage("Order sheet text", 0.9, Map.of(
                RawPassage.CASE_ID, caseId,
                RawPassage.CASE_NUMBER, caseNumber,
                RawPassage.CASE_TITLE, title,
                RawPassage.COURT, "Lahore High Court",
                "petitioner_advocates", "Mr. Khan; Ms. Bibi"));
    }

    // =========================================================================
    //  Intent overrides
    // =========================================================================

    @Nested
    @DisplayName("Intent overrides")
    class IntentOverrides {

        @Test
        @DisplayName("a procedural question clears an existing lock")
        void proceduralUnlocks() {
            CaseResolution r = resolver.resolve("How to file an appeal in this case?", locked(CASE_A));

            assertThat(r.state()).isEqualTo(State.UNLOCKED);
            assertThat(r.reason()).isEqualTo(Reason.PROCEDURAL);
            assertThat(r.lockChanged()).isTrue();
            assertThat(r.standaloneQuery()).isEqualTo("How to file an appeal in this case?");
        }

        @Test
        @DisplayName("an opinion question never inherits a lock")
        void opinionUnlocks() {
            CaseResolution r = resolver.resolve("What do you think about bail law?", locked(CASE_A));

            assertThat(r.isLocked()).isFalse();
            assertThat(r.reason()).isEqualTo(Reason.GENERAL_OPINION);
        }

        @Test
        @DisplayName("a procedural question on an unlocked session reports no lock change")
        void proceduralWithoutLock() {
            CaseResolution r = resolver.resolve("What is the procedure for khula?", unlocked(List.of()));

            assertThat(r.reason()).isEqualTo(Reason.PROCEDURAL);
            assertThat(r.lockChanged()).isFalse();
        }
    }

    // =========================================================================
    //  Explicit references
    // =========================================================================

    @Nested
    @DisplayName("Explicit references")
    class ExplicitReferences {

        @Test
        @DisplayName("a different case number switches the lock through an exact lookup")
        void switchesLock() {
            when(retriever.findExactCase("W.P. 45/2019 Writ"))
                    .thenReturn(List.of(casePassage("wp-45", "W.P. 45/2019 Writ", "Bibi vs Province")));

            CaseResolution r = resolver.resolve("What was the order in W.P. 45/2019 Writ?", locked(CASE_A));

            assertThat(r.state()).isEqualTo(State.LOCKED);
            assertThat(r.reason()).isEqualTo(Reason.EXPLICIT_RESOLVED);
            assertThat(r.lockedCaseId()).isEqualTo("wp-45");
            assertThat(r.lockChanged()).isTrue();
            assertThat(r.activeCase().court()).isEqualTo("Lahore High Court");
            assertThat(r.activeCase().petitionerAdvocates()).containsExactly("Mr. Khan", "Ms. Bibi");
            assertThat(r.activeCase().lockedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("a reference to the current lock skips the lookup")
        void sameCaseNoLookup() {
            CaseResolution r = resolver.resolve("What did the court hold in Ahmed vs State?", locked(CASE_A));

            assertThat(r.isLocked()).isTrue();
            assertThat(r.reason()).isEqualTo(Reason.EXPLICIT_RESOLVED);
            assertThat(r.lockChanged()).isFalse();
            verify(retriever, never()).findExactCase(anyString());
        }

        @Test
        @DisplayName("an unknown case clears the lock")
        void unresolvedUnlocks() {
            when(retriever.findExactCase("W.P. 99/2030 Writ")).thenReturn(List.of());

            CaseResolution r = resolver.resolve("Status of W.P. 99/2030 Writ", locked(CASE_A));

            assertThat(r.state()).isEqualTo(State.UNLOCKED);
            assertThat(r.reason()).isEqualTo(Reason.EXPLICIT_UNRESOLVED);
            assertThat(r.lockChanged()).isTrue();
        }

        @Test
        @DisplayName("a failing lookup is treated as unresolved")
        void lookupFailure() {
            when(retriever.findExactCase(anyString())).thenThrow(new IllegalStateException("index offline"));

            CaseResolution r = resolver.resolve("Status of W.P. 45/2019 Writ", unlocked(List.of()));

            assertThat(r.reason()).isEqualTo(Reason.EXPLICIT_UNRESOLVED);
            assertThat(r.lockChanged()).isFalse();
        }

        @Test
        @DisplayName("a hung lookup times out and the reference is treated as unresolved")
        void hungLookupTimesOut() {
            when(retriever.findExactCase(anyString())).thenAnswer(invocation -> {
                Thread.sleep(TimeUnit.MINUTES.toMillis(5));
                return List.of(casePassage("wp-45", "W.P. 45/2019 Writ", "Bibi vs Province"));
            });
            try (MdcAwareExecutor worker = new MdcAwareExecutor(1)) {
                CaseResolver bounded = new CaseResolver(
                        new TimeBoundedLegalRetriever(retriever, worker, Duration.ofMillis(200)),
                        new TopicClassifier(), new FollowUpDetector(0.25), new QueryRewriter(500), CLOCK);

                long started = System.nanoTime();
                CaseResolution r = bounded.resolve("What was the order in W.P. 45/2019 Writ?", locked(CASE_A));

                assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
                assertThat(r.state()).isEqualTo(State.UNLOCKED);
                assertThat(r.reason()).isEqualTo(Reason.EXPLICIT_UNRESOLVED);
                assertThat(r.lockChanged()).isTrue();
            }
        }
    }

    // =========================================================================
    //  Locked sessions
    // =========================================================================

    @Nested
    @DisplayName("Locked sessions")
    class LockedSessions {

        @Test
        @DisplayName("a same-topic question keeps the lock and substitutes the case")
        void sameTopic() {
            CaseResolution r = resolver.resolve("Who are the advocates in this case?", locked(CASE_A));

            assertThat(r.reason()).isEqualTo(Reason.TOPIC_SAME);
            assertThat(r.lockedCaseId()).isEqualTo("cp-12");
            assertThat(r.lockChanged()).isFalse();
            assertThat(r.standaloneQuery()).isEqualTo("Who are the advocates in C.P. 12/2021 Civil?");
        }

        @Test
        @DisplayName("an explicit new-topic phrase clears the lock")
        void newTopic() {
            CaseResolution r = resolver.resolve("Tell me about another case please", locked(CASE_A));

            assertThat(r.state()).isEqualTo(State.UNLOCKED);
            assertThat(r.reason()).isEqualTo(Reason.TOPIC_NEW);
            assertThat(r.activeCase()).isNull();
        }
    }

    // =========================================================================
    //  Unlocked sessions
    // =========================================================================

    @Nested
    @DisplayName("Unlocked sessions")
    class UnlockedSessions {

        @Test
        @DisplayName("a pronoun with no active case and no prior turn stays unchanged")
        void danglingPronoun() {
            CaseResolution r = resolver.resolve("What about this case?", unlocked(List.of()));

            assertThat(r.state()).isEqualTo(State.UNLOCKED);
            assertThat(r.reason()).isEqualTo(Reason.NO_CASE);
            assertThat(r.standaloneQuery()).isEqualTo("What about this case?");
            assertThat(r.lockChanged()).isFalse();
            assertThat(r.followUpSignals()).contains("pronoun_reference", "follow_up_phrase");
        }

        @Test
        @DisplayName("a follow-up inherits the case of the previous explicit question")
        void inheritsFromPreviousTurn() {
            when(retriever.findExactCase("C.P. 12/2021 Civil"))
                    .thenReturn(List.of(casePassage("cp-12", "C.P. 12/2021 Civil", "Ahmed vs State")));
            ConversationState state = unlocked(List.of(turn("What is the status of C.P. 12/2021 Civil?", "cp-12")));

            CaseResolution r = resolver.resolve("Who argued it?", state);

            assertThat(r.reason()).isEqualTo(Reason.FOLLOW_UP_INHERITED);
            assertThat(r.lockedCaseId()).isEqualTo("cp-12");
            assertThat(r.lockChanged()).isTrue();
            assertThat(r.standaloneQuery()).isEqualTo("Who argued it? (C.P. 12/2021 Civil)");
        }

        @Test
        @DisplayName("a follow-up to an unlocked turn is rewritten against the previous question")
        void followUpWithoutCase() {
            ConversationState state = unlocked(List.of(turn("What is bail under section 497?", null)));

            CaseResolution r = resolver.resolve("Can it be cancelled?", state);

            assertThat(r.reason()).isEqualTo(Reason.NO_CASE);
            assertThat(r.standaloneQuery())
                    .isEqualTo("What is bail under section 497?" + QueryRewriter.THEN_SEPARATOR + "Can it be cancelled?");
            verify(retriever, never()).findExactCase(anyString());
        }
    }
}
