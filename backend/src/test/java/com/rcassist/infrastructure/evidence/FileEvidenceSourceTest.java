package com.rcassist.infrastructure.evidence;

import com.rcassist.domain.analysis.exception.EvidenceUnavailableException;
import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.SourceKind;
import com.rcassist.infrastructure.config.RcaProperties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileEvidenceSourceTest {

    @TempDir
    Path uploads;

    @TempDir
    Path elsewhere;

    private FileEvidenceSource source;

    @BeforeEach
    void setUp() {
        RcaProperties.Evidence evidence = new RcaProperties.Evidence(
                List.of(uploads.toString()), List.of(".txt", ".log", ".pdf"), DataSize.ofBytes(1024), null, null);
        source = new FileEvidenceSource(new RcaProperties(null, null, evidence, null, null));
    }

    @Test
    @DisplayName("text file below an allowed root is read with size and type metadata")
    void reads_text() throws Exception {
        Path log = Files.writeString(uploads.resolve("app.log"), "ERROR volume vol1 is full");

        EvidenceItem item = source.fetch(log.toString());

        assertThat(item.sourceKind()).isEqualTo(SourceKind.FILE);
        assertThat(item.text()).isEqualTo("ERROR volume vol1 is full");
        assertThat(item.metadata()).containsEntry("type", "log").containsEntry("size", "25");
        assertThat(item.sourceLabel()).isEqualTo("File: app.log");
    }

    @Test
    @DisplayName("PDF text is extracted with PDFBox")
    void reads_pdf() throws Exception {
        Path pdf = uploads.resolve("report.pdf");
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.beginText();
                content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                content.newLineAtOffset(50, 700);
                content.showText("Controller takeover at 10:02");
                content.endText();
            }
            document.save(pdf.toFile());
        }
        RcaProperties.Evidence evidence = new RcaProperties.Evidence(
                List.of(uploads.toString()), List.of(".pdf"), DataSize.ofMegabytes(1), null, null);
        FileEvidenceSource pdfSource = new FileEvidenceSource(new RcaProperties(null, null, evidence, null, null));

        EvidenceItem item = pdfSource.fetch(pdf.toString());

        assertThat(item.text()).contains("Controller takeover at 10:02");
        assertThat(item.metadata()).containsEntry("pages", "1").containsEntry("type", "pdf");
    }

    @Test
    @DisplayName("files outside the allowed roots are rejected")
    void outside_root() throws Exception {
        Path secret = Files.writeString(elsewhere.resolve("secret.txt"), "nope");

        assertThatThrownBy(() -> source.fetch(secret.toString()))
                .isInstanceOf(EvidenceUnavailableException.class)
                .hasMessageContaining("outside the allowed directories");
    }

    @Test
    @DisplayName("path traversal out of the root is rejected")
    void traversal() throws Exception {
        Files.writeString(elsewhere.resolve("secret.txt"), "nope");
        String sneaky = uploads.resolve("..").resolve(elsewhere.getFileName()).resolve("secret.txt").toString();

        assertThatThrownBy(() -> source.fetch(sneaky)).isInstanceOf(EvidenceUnavailableException.class);
    }

    @Test
    @DisplayName("a symlink below the root that points outside it is rejected")
    void symlink_escape() throws Exception {
        Path secret = Files.writeString(elsewhere.resolve("secret.txt"), "nope");
        Path link = Files.createSymbolicLink(uploads.resolve("innocent.txt"), secret);

        assertThatThrownBy(() -> source.fetch(link.toString()))
                .isInstanceOf(EvidenceUnavailableException.class)
                .hasMessageContaining("outside the allowed directories");
    }

    @Test
    @DisplayName("a symlink that stays inside the root is followed")
    void symlink_inside_root() throws Exception {
        Path target = Files.writeString(uploads.resolve("real.log"), "ERROR vol1 full");
        Path link = Files.createSymbolicLink(uploads.resolve("latest.log"), target);

        assertThat(source.fetch(link.toString()).text()).isEqualTo("ERROR vol1 full");
    }

    @Test
    @DisplayName("disallowed extension, missing file and oversized file are rejected")
    void rejections() throws Exception {
        Path binary = Files.writeString(uploads.resolve("dump.bin"), "x");
        Path big = Files.writeString(uploads.resolve("big.txt"), "x".repeat(2048));

        assertThatThrownBy(() -> source.fetch(binary.toString())).hasMessageContaining("not allowed");
        assertThatThrownBy(() -> source.fetch(uploads.resolve("missing.txt").toString())).hasMessageContaining("not found");
        assertThatThrownBy(() -> source.fetch(big.toString())).hasMessageContaining("limit is 1024");
    }

    @Test
    @DisplayName("empty file has nothing to analyze")
    void empty_file() throws Exception {
        Path empty = Files.writeString(uploads.resolve("empty.txt"), "  \n");

        assertThatThrownBy(() -> source.fetch(empty.toString())).hasMessageContaining("no extractable text");
    }
}
