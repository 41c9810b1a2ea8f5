package com.rcassist.infrastructure.evidence;

import com.rcassist.domain.analysis.exception.EvidenceUnavailableException;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.SourceKind;
import com.rcassist.domain.analysis.service.EvidenceSource;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads evidence files below the configured roots. PDFs go through PDFBox, every other allowed
 * extension is read as UTF-8 text.
 */
@Slf4j
@Component
public class FileEvidenceSource implements EvidenceSource {

    private final List<Path> allowedRoots;
    private final List<String> allowedExtensions;
    private final long maxFileSize;

    public FileEvidenceSource(RcaProperties properties) {
        RcaProperties.Evidence evidence = properties.evidence();
        this.allowedRoots = evidence.allowedRoots().stream()
                .map(root -> Path.of(root).toAbsolutePath().normalize())
                .toList();
        this.allowedExtensions = evidence.allowedExtensions();
        this.maxFileSize = evidence.maxFileSize().toBytes();
    }

    @Override
    public SourceKind kind() {
        return SourceKind.FILE;
    }

    @Override
    public EvidenceItem fetch(String identifier) {
        Path path = resolve(identifier);
        String extension = extensionOf(path);

        long size;
        try {
            size = Files.size(path);
        } catch (IOException e) {
            throw unavailable("cannot read file size", e);
        }
        if (size > maxFileSize) {
            throw unavailable(String.format("file is %d bytes, limit is %d", size, maxFileSize), null);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("size", String.valueOf(size));
        metadata.put("type", extension.substring(1));

        String text = ".pdf".equals(extension) ? readPdf(path, metadata) : readText(path);
        if (text.isBlank()) {
            throw unavailable("file contains no extractable text", null);
        }

        log.info("[Evidence] Read file {} ({} bytes, {} chars)", path.getFileName(), size, text.length());
        return new EvidenceItem(SourceKind.FILE, identifier, text, metadata);
    }

    private Path resolve(String identifier) {
        Path path;
        try {
            path = Path.of(identifier).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw unavailable("invalid path", e);
        }
        Path checked = path;
        if (allowedRoots.stream().noneMatch(checked::startsWith)) {
            throw unavailable("path is outside the allowed directories", null);
        }
        if (!Files.isRegularFile(path)) {
            throw unavailable("file not found", null);
        }

        // symlinks below a root may point anywhere; check where they land
        Path real;
        try {
            real = path.toRealPath();
        } catch (IOException e) {
            throw unavailable("cannot resolve path", e);
        }
        if (allowedRoots.stream().map(FileEvidenceSource::realRoot).noneMatch(real::startsWith)) {
            throw unavailable("path is outside the allowed directories", null);
        }
        return real;
    }

    private static Path realRoot(Path root) {
        try {
            return root.toRealPath();
        } catch (IOException e) {
            return root;
        }
    }

    private String extensionOf(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        String extension = dot < 0 ? "" : name.substring(dot);
        if (!allowedExtensions.contains(extension)) {
            throw unavailable("file type '" + extension + "' is not allowed", null);
        }
        return extension;
    }

    private String readPdf(Path path, Map<String, String> metadata) {
        try (PDDocument document = Loader.loadPDF(path.toFile())) {
            metadata.put("pages", String.valueOf(document.getNumberOfPages()));
            PDFTextStripper stripper = new PDFTextStripper();
            return stripper.getText(document);
        } catch (IOException e) {
            throw unavailable("cannot extract PDF text: " + e.getMessage(), e);
        }
    }

    private String readText(Path path) {
        try {
            // lenient decoding: log files often carry stray bytes
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw unavailable("cannot read file: " + e.getMessage(), e);
        }
    }

    private static EvidenceUnavailableException unavailable(String reason, Throwable cause) {
        return new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT, reason, cause);
    }
}
