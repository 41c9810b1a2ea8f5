package com.rcassist.infrastructure.ai.prompt;

import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.SourceKind;
import com.rcassist.infrastructure.config.RcaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptAssemblerTest {

    private PromptAssembler assembler;

    @BeforeEach
    void setUp() {
        TemplateRegistry registry = new TemplateRegistry(
                Map.of("formal_rca", "Write a formal RCA.", "empty", "   "),
                Map.of("storage", "Clustered storage environment."));
        RcaProperties properties = new RcaProperties(null,
                new RcaProperties.Prompt("formal_rca", "storage", Map.of("url", 10), 40),
                null, null, null);
        assembler = new PromptAssembler(registry, new EvidenceTextNormalizer(), properties);
    }

    @Test
    @DisplayName("template, issue, domain context and evidence appear in that order")
    void section_order() {
        EvidenceItem log = new EvidenceItem(SourceKind.FILE, "uploads/app.log", "ERROR disk full", Map.of());

        String prompt = assembler.assemble("formal_rca", "Writes fail on vol1", List.of(log));

        assertThat(prompt).startsWith("Write a formal RCA.");
        int issue = prompt.indexOf("## Issue Description:\nWrites fail on vol1");
        int context = prompt.indexOf("## Domain Context:\nClustered storage environment.");
        int sources = prompt.indexOf("## Source Data for Analysis:");
        int item = prompt.indexOf("--- FILE: uploads/app.log ---\nERROR disk full");
        assertThat(issue).isPositive();
        assertThat(context).isGreaterThan(issue);
        assertThat(sources).isGreaterThan(context);
        assertThat(item).isGreaterThan(sources);
    }

    @Test
    @DisplayName("blank issue description is left out")
    void no_issue() {
        String prompt = assembler.assemble("formal_rca", " ", List.of(
                new EvidenceItem(SourceKind.TICKET, "OPS-1", "Ticket: OPS-1", Map.of())));

        assertThat(prompt).doesNotContain("## Issue Description:");
    }

    @Test
    @DisplayName("evidence is truncated to the per-kind budget with a visible marker")
    void truncation() {
        EvidenceItem page = new EvidenceItem(SourceKind.URL, "https://status.example.com", "0123456789ABCDEF", Map.of());
        EvidenceItem file = new EvidenceItem(SourceKind.FILE, "a.txt", "short", Map.of());

        String prompt = assembler.assemble("formal_rca", "issue", List.of(page, file));

        assertThat(prompt).contains("0123456789\n[...truncated...]");
        assertThat(prompt).doesNotContain("ABCDEF");
        assertThat(prompt).contains("--- FILE: a.txt ---\nshort\n");
    }

    @Test
    @DisplayName("no evidence → explicit placeholder")
    void no_evidence() {
        assertThat(assembler.assemble("formal_rca", "issue", List.of()))
                .endsWith("## Source Data for Analysis:\n" + PromptAssembler.NO_EVIDENCE);
    }

    @Test
    @DisplayName("unknown or empty template → TemplateNotFoundException")
    void unknown_template() {
        assertThatThrownBy(() -> assembler.assemble("missing", "issue", List.of()))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> assembler.assemble("empty", "issue", List.of()))
                .isInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    @DisplayName("truncation never splits a surrogate pair")
    void surrogate_pair() {
        String text = "ab\uD83D\uDE00cd";

        assertThat(PromptAssembler.truncate(text, 3)).isEqualTo("ab" + PromptAssembler.TRUNCATION_MARKER);
    }
}
