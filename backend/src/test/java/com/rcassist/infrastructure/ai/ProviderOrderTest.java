package com.rcassist.infrastructure.ai;

import com.rcassist.domain.analysis.model.ProviderName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderOrderTest {

    private static final ProviderName OPENAI = ProviderName.of("openai");
    private static final ProviderName ANTHROPIC = ProviderName.of("anthropic");
    private static final ProviderName OPENROUTER = ProviderName.of("openrouter");
    private static final List<ProviderName> DEFAULT_ORDER = List.of(OPENAI, ANTHROPIC, OPENROUTER);

    @Test
    @DisplayName("explicit list is used as given")
    void explicit() {
        assertThat(ProviderOrder.resolve(List.of(OPENROUTER, OPENAI), ANTHROPIC, DEFAULT_ORDER))
                .containsExactly(OPENROUTER, OPENAI);
    }

    @Test
    @DisplayName("preferred provider first, then the rest of the default order")
    void preferred_first() {
        assertThat(ProviderOrder.resolve(List.of(), ANTHROPIC, DEFAULT_ORDER))
                .containsExactly(ANTHROPIC, OPENAI, OPENROUTER);
    }

    @Test
    @DisplayName("neither → default order")
    void default_order() {
        assertThat(ProviderOrder.resolve(null, null, DEFAULT_ORDER)).containsExactlyElementsOf(DEFAULT_ORDER);
    }

    @Test
    @DisplayName("provider names are case-insensitive")
    void case_insensitive() {
        assertThat(ProviderOrder.resolve(List.of(), ProviderName.of("OpenAI"), DEFAULT_ORDER).get(0)).isEqualTo(OPENAI);
    }
}
