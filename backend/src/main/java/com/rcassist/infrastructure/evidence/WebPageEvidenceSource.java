package com.rcassist.infrastructure.evidence;

import com.rcassist.domain.analysis.exception.EvidenceUnavailableException;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.SourceKind;
import com.rcassist.domain.analysis.service.EvidenceSource;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Fetches a web page with Jsoup and keeps its readable text.
 */
@Slf4j
@Component
public class WebPageEvidenceSource implements EvidenceSource {

    private static final String BLOCK_ELEMENTS = "p, div, br, li, tr, pre, h1, h2, h3, h4, h5, h6";

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t\\u00A0]{2,}");

    private final String userAgent;
    private final int timeoutMillis;

    public WebPageEvidenceSource(RcaProperties properties) {
        this.userAgent = properties.evidence().userAgent();
        this.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, properties.evidence().fetchTimeout().toMillis());
    }

    @Override
    public SourceKind kind() {
        return SourceKind.URL;
    }

    @Override
    public EvidenceItem fetch(String identifier) {
        validate(identifier);

        Document document;
        try {
            document = Jsoup.connect(identifier)
                    .userAgent(userAgent)
                    .timeout(timeoutMillis)
                    .followRedirects(true)
                    .get();
        } catch (HttpStatusException e) {
            throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT,
                    "page answered HTTP " + e.getStatusCode(), e);
        } catch (IOException e) {
            throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT,
                    "page could not be fetched: " + e.getMessage(), e);
        }

        String text = extractText(document);
        if (text.isBlank()) {
            throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT, "page has no readable text");
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("title", document.title());
        metadata.put("fetchedAt", Instant.now().toString());

        log.info("[Evidence] Fetched {} ({} chars)", identifier, text.length());
        return new EvidenceItem(SourceKind.URL, identifier, text, metadata);
    }

    /**
     * Body text without scripts and styles, one non-empty line per block.
     */
    static String extractText(Document document) {
        document.select("script, style, noscript").remove();
        if (document.body() == null) {
            return "";
        }
        for (Element block : document.body().select(BLOCK_ELEMENTS)) {
            block.after(new TextNode("\n"));
        }
        return Arrays.stream(document.body().wholeText().split("\n"))
                .map(line -> MULTIPLE_SPACES.matcher(line).replaceAll(" ").strip())
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }

    private static void validate(String identifier) {
        try {
            URI uri = new URI(identifier);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT,
                        "only absolute http(s) URLs are supported");
            }
        } catch (URISyntaxException e) {
            throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT, "malformed URL", e);
        }
    }
}
