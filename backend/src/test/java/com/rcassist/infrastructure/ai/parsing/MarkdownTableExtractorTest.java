package com.rcassist.infrastructure.ai.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownTableExtractorTest {

    @Test
    @DisplayName("a pipe line without separator is not a table")
    void no_separator() {
        assertThat(MarkdownTableExtractor.extract("| a | b |\n| 1 | 2 |")).isEmpty();
    }

    @Test
    @DisplayName("a single pipe is not enough for a header")
    void single_pipe_header() {
        assertThat(MarkdownTableExtractor.extract("a | b\n---|---\n1 | 2")).isEmpty();
    }

    @Test
    @DisplayName("table without outer pipes")
    void no_outer_pipes() {
        var extraction = MarkdownTableExtractor.extract("Cause | Verdict | Note\n--- | --- | ---\nNIC | likely | flaps").orElseThrow();

        assertThat(extraction.table().headers()).containsExactly("Cause", "Verdict", "Note");
        assertThat(extraction.table().rows()).containsExactly(List.of("NIC", "likely", "flaps"));
    }

    @Test
    @DisplayName("empty cells are kept")
    void empty_cells() {
        var extraction = MarkdownTableExtractor.extract("| a | b |\n|---|---|\n| 1 |  |").orElseThrow();

        assertThat(extraction.table().rows()).containsExactly(List.of("1", ""));
    }

    @Test
    @DisplayName("short rows are reported with their 1-based position")
    void short_row() {
        var extraction = MarkdownTableExtractor.extract("| a | b | c |\n|---|---|---|\n| 1 | 2 |\n| 4 | 5 | 6 |").orElseThrow();

        assertThat(extraction.droppedRows()).containsExactly(new MarkdownTableExtractor.DroppedRow(1, 2));
        assertThat(extraction.table().rows()).containsExactly(List.of("4", "5", "6"));
    }

    @Test
    @DisplayName("list detection needs every non-blank line to be an item")
    void list_items() {
        assertThat(MarkdownTableExtractor.listItems("- one\n\n* two\n3) three")).contains(List.of("one", "two", "three"));
        assertThat(MarkdownTableExtractor.listItems("- one\nplain")).isEmpty();
        assertThat(MarkdownTableExtractor.listItems("")).isEmpty();
    }
}
