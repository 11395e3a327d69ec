package com.eainde.legalqa.retrieval;

import com.eainde.legalqa.exception.RetrievalException;
import com.eainde.legalqa.model.RawPassage;
import com.eainde.legalqa.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimeBoundedLegalRetrieverTest {

    private static final RawPassage PASSAGE = RawPassage.of("Leave to appeal refused.", 0.9);

    @Mock
    private LegalRetriever delegate;

    private final MdcAwareExecutor worker = new MdcAwareExecutor(1);

    private TimeBoundedLegalRetriever retriever;

    @BeforeEach
    void setUp() {
        retriever = new TimeBoundedLegalRetriever(delegate, worker, Duration.ofMillis(200));
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    @Test
    @DisplayName("calls within the timeout pass straight through")
    void passesThrough() {
        when(delegate.findExactCase("C.P. 12/2021 Civil")).thenReturn(List.of(PASSAGE));
        when(delegate.getByCaseId("cp-12")).thenReturn(List.of(PASSAGE));
        when(delegate.search("bail", 5, Map.of())).thenReturn(List.of());

        assertThat(retriever.findExactCase("C.P. 12/2021 Civil")).containsExactly(PASSAGE);
        assertThat(retriever.getByCaseId("cp-12")).containsExactly(PASSAGE);
        assertThat(retriever.search("bail", 5, Map.of())).isEmpty();
    }

    @Test
    @DisplayName("an overrunning call is interrupted and reported as a retrieval failure")
    void overrunIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        when(delegate.findExactCase(anyString())).thenAnswer(invocation -> {
            try {
                Thread.sleep(TimeUnit.MINUTES.toMillis(5));
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return List.of(PASSAGE);
        });

        assertThatThrownBy(() -> retriever.findExactCase("W.P. 45/2019 Writ"))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("timed out");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("the worker is free again after a timeout")
    void workerRecovers() {
        when(delegate.findExactCase(anyString())).thenAnswer(invocation -> {
            Thread.sleep(TimeUnit.MINUTES.toMillis(5));
            return List.of();
        });
        when(delegate.getByCaseId("cp-12")).thenReturn(List.of(PASSAGE));

        assertThatThrownBy(() -> retriever.findExactCase("W.P. 45/2019 Writ")).isInstanceOf(RetrievalException.class);

        assertThat(retriever.getByCaseId("cp-12")).containsExactly(PASSAGE);
    }

    @Test
    @DisplayName("retrieval failures keep their type, others are wrapped")
    void failures() {
        when(delegate.getByCaseId("cp-12")).thenThrow(new RetrievalException("index offline"));
        when(delegate.findExactCase(anyString())).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> retriever.getByCaseId("cp-12"))
                .isInstanceOf(RetrievalException.class)
                .hasMessage("index offline");
        assertThatThrownBy(() -> retriever.findExactCase("x"))
                .isInstanceOf(RetrievalException.class)
                .hasMessageContaining("connection reset")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
