package io.pactkit.core.handles;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pactkit.core.error.FrozenHandleException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HandleRegistry")
class HandleRegistryTest {

    private final HandleRegistry<String> registry = new HandleRegistry<>();

    @Nested
    @DisplayName("allocation")
    class Allocation {

        @Test
        void handlesArePositiveAndIncreasing() {
            int first = registry.allocate("a");
            int second = registry.allocate("b");

            assertThat(first).isPositive();
            assertThat(second).isGreaterThan(first);
        }

        @Test
        void releasedHandlesAreNeverReused() {
            int first = registry.allocate("a");
            registry.release(first);

            int second = registry.allocate("b");

            assertThat(second).isNotEqualTo(first);
            assertThat(registry.get(first)).isEmpty();
            assertThat(registry.release(first)).isFalse();
        }

        @Test
        void nullValuesAreRejected() {
            assertThatThrownBy(() -> registry.allocate(null)).isInstanceOf(NullPointerException.class);
        }

        @Test
        void concurrentAllocationGivesDistinctHandles() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<Integer>> futures = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    String value = "v" + i;
                    futures.add(pool.submit(() -> registry.allocate(value)));
                }
                Set<Integer> handles = ConcurrentHashMap.newKeySet();
                for (Future<Integer> future : futures) {
                    handles.add(future.get());
                }
                assertThat(handles).hasSize(200);
            } finally {
                pool.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("updates")
    class Updates {

        @Test
        void updateReplacesTheSnapshot() {
            int handle = registry.allocate("a");

            assertThat(registry.withMutable(handle, v -> v + "b")).isTrue();
            assertThat(registry.get(handle)).contains("ab");
            assertThat(registry.read(handle, String::length)).contains(2);
        }

        @Test
        void unknownHandleIsNotUpdated() {
            assertThat(registry.withMutable(99, v -> v)).isFalse();
            assertThat(registry.update(99, v -> v)).isFalse();
        }

        @Test
        void frozenHandleRefusesUpdates() {
            int handle = registry.allocate("a");
            assertThat(registry.freeze(handle)).isTrue();

            assertThat(registry.isFrozen(handle)).isTrue();
            assertThat(registry.withMutable(handle, v -> v + "b")).isFalse();
            assertThatThrownBy(() -> registry.update(handle, v -> v + "b"))
                    .isInstanceOf(FrozenHandleException.class);
            assertThat(registry.get(handle)).contains("a");
        }

        @Test
        void updateMustNotProduceNull() {
            int handle = registry.allocate("a");

            assertThatThrownBy(() -> registry.update(handle, v -> null)).isInstanceOf(NullPointerException.class);
            assertThat(registry.get(handle)).contains("a");
        }
    }

    @Test
    void handlesAreFilteredInAllocationOrder() {
        int a = registry.allocate("apple");
        registry.allocate("banana");
        int c = registry.allocate("avocado");

        assertThat(registry.handles(v -> v.startsWith("a"))).containsExactly(a, c);
        assertThat(registry.size()).isEqualTo(3);
    }
}
