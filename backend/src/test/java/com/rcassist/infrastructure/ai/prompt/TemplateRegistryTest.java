package com.rcassist.infrastructure.ai.prompt;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateRegistryTest {

    @Test
    @DisplayName("bundled templates and contexts load from the classpath")
    void classpath_resources() {
        TemplateRegistry registry = new TemplateRegistry(new DefaultResourceLoader());

        assertThat(registry.all()).extracting(AnalysisTemplate::id)
                .contains("formal_rca", "kt_analysis", "initial_analysis");
        assertThat(registry.require("kt_analysis").body()).contains("| Dimension | IS | IS NOT | Distinction |");
        assertThat(registry.context("infrastructure_context")).isPresent();
    }

    @Test
    @DisplayName("unknown ids")
    void unknown_ids() {
        TemplateRegistry registry = new TemplateRegistry(Map.of("a", "body"), Map.of());

        assertThatThrownBy(() -> registry.require("b")).isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> registry.require(null)).isInstanceOf(TemplateNotFoundException.class);
        assertThat(registry.context("missing")).isEmpty();
        assertThat(registry.context("")).isEmpty();
    }
}
