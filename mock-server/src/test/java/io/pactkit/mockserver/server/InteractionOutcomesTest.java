package io.pactkit.mockserver.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.pactkit.core.matchers.Mismatch;
import io.pactkit.core.model.HttpRequest;
import io.pactkit.core.model.Interaction;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link InteractionOutcomes}. */
class InteractionOutcomesTest {

    private static final List<Interaction> TWO = List.of(
            Interaction.named("list").withRequest(HttpRequest.defaults().withPath("/widgets")),
            Interaction.named("create").withRequest(HttpRequest.defaults().withMethod("POST").withPath("/widgets")));

    private static MatchOutcome match(String interaction) {
        return new MatchOutcome.RequestMatch(interaction, "GET", "/widgets", List.of());
    }

    @Test
    @DisplayName("nothing recorded: not matched, every interaction is a missing request")
    void empty() {
        InteractionOutcomes outcomes = new InteractionOutcomes(TWO);

        assertThat(outcomes.isEmpty()).isTrue();
        assertThat(outcomes.allMatched()).isFalse();
        assertThat(outcomes.failures())
                .extracting(MatchOutcome::type, MatchOutcome::method, MatchOutcome::interaction)
                .containsExactly(
                        tuple("missing-request", "GET", "list"),
                        tuple("missing-request", "POST", "create"));
    }

    @Test
    @DisplayName("every interaction matched: matched, no failures")
    void allMatched() {
        InteractionOutcomes outcomes = new InteractionOutcomes(TWO);
        outcomes.record(0, match("list"));
        outcomes.record(1, match("create"));
        outcomes.record(0, match("list"));

        assertThat(outcomes.allMatched()).isTrue();
        assertThat(outcomes.failures()).isEmpty();
        assertThat(outcomes.outcomes(0)).hasSize(2);
    }

    @Test
    @DisplayName("a mismatch on a matched interaction still fails the table")
    void mismatchAfterMatch() {
        InteractionOutcomes outcomes = new InteractionOutcomes(TWO);
        outcomes.record(0, match("list"));
        outcomes.record(1, match("create"));
        outcomes.record(0, new MatchOutcome.RequestMismatch(
                "list", "GET", "/widgets", List.of(new Mismatch.MethodMismatch("GET", "PUT"))));

        assertThat(outcomes.allMatched()).isFalse();
        assertThat(outcomes.failures()).extracting(MatchOutcome::type).containsExactly("request-mismatch");
    }

    @Test
    @DisplayName("an unattributed request fails an otherwise clean table")
    void unattributed() {
        InteractionOutcomes outcomes = new InteractionOutcomes(List.of());
        assertThat(outcomes.allMatched()).isTrue();

        outcomes.record(-1, new MatchOutcome.RequestNotFound(null, "GET", "/x", List.of()));

        assertThat(outcomes.allMatched()).isFalse();
        assertThat(outcomes.failures()).hasSize(1);
    }

    @Test
    @DisplayName("concurrent appends are neither lost nor duplicated")
    void concurrentAppends() throws Exception {
        InteractionOutcomes outcomes = new InteractionOutcomes(TWO);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            int index = i % 2;
            futures.add(pool.submit(() -> {
                start.await();
                outcomes.record(index, match(index == 0 ? "list" : "create"));
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(outcomes.outcomes(0)).hasSize(200);
        assertThat(outcomes.outcomes(1)).hasSize(200);
        assertThat(outcomes.allMatched()).isTrue();
    }
}
