package com.eainde.legalqa.conversation;

import com.eainde.legalqa.model.ConversationTurn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryConversationStoreTest extends AbstractConversationStoreTest {

    private final InMemoryConversationStore store = new InMemoryConversationStore();

    @Override
    protected ConversationStore store() {
        return store;
    }

    @Test
    @DisplayName("concurrent appends to one session get distinct, gap-free numbers")
    void concurrentAppends() throws Exception {
        store.saveSession(session("s1", "u1", T0));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<ConversationTurn>> appends = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                String query = "q" + i;
                appends.add(pool.submit(() -> store.appendTurn(turn("s1", 0, query))));
            }
            for (Future<ConversationTurn> append : appends) {
                append.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.recentTurns("s1", 100)).extracting(ConversationTurn::sequence)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 40).boxed().toList());
    }
}
