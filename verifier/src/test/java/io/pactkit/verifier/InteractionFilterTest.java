package io.pactkit.verifier;

import static org.assertj.core.api.Assertions.assertThat;

import io.pactkit.core.model.ProviderState;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InteractionFilter")
class InteractionFilterTest {

    private static final List<ProviderState> WIDGET_EXISTS = List.of(ProviderState.of("a widget exists"));

    @Test
    void acceptsEverythingByDefault() {
        assertThat(InteractionFilter.NONE.accepts("anything", List.of())).isTrue();
        assertThat(InteractionFilter.NONE.accepts("anything", WIDGET_EXISTS)).isTrue();
        assertThat(InteractionFilter.NONE.acceptsConsumer("web")).isTrue();
    }

    @Test
    @DisplayName("description regex matches anywhere in the description")
    void description() {
        InteractionFilter filter = new InteractionFilter(Pattern.compile("widget"), null, false, Set.of());

        assertThat(filter.accepts("a request for widgets", List.of())).isTrue();
        assertThat(filter.accepts("a request for gadgets", List.of())).isFalse();
    }

    @Test
    @DisplayName("state regex needs one matching provider state")
    void state() {
        InteractionFilter filter = new InteractionFilter(null, Pattern.compile("^a widget"), false, Set.of());

        assertThat(filter.accepts("x", WIDGET_EXISTS)).isTrue();
        assertThat(filter.accepts("x", List.of(ProviderState.of("no widgets")))).isFalse();
        assertThat(filter.accepts("x", List.of())).isFalse();
    }

    @Test
    void noState() {
        InteractionFilter filter = new InteractionFilter(null, null, true, Set.of());

        assertThat(filter.accepts("x", List.of())).isTrue();
        assertThat(filter.accepts("x", WIDGET_EXISTS)).isFalse();
    }

    @Test
    void consumers() {
        InteractionFilter filter = new InteractionFilter(null, null, false, Set.of("web"));

        assertThat(filter.acceptsConsumer("web")).isTrue();
        assertThat(filter.acceptsConsumer("mobile")).isFalse();
    }
}
