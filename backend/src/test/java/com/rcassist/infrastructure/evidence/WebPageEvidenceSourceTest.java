package com.rcassist.infrastructure.evidence;

import com.rcassist.domain.analysis.exception.EvidenceUnavailableException;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.infrastructure.config.RcaProperties;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebPageEvidenceSourceTest {

    @Test
    @DisplayName("scripts and styles are removed, one line per block")
    void extract_text() {
        String html = """
                <html><head><title>Status</title><style>body { color: red; }</style></head>
                <body><script>var tracking = 1;</script><h1>Incident 42</h1><p>Storage   latency spiked.</p>
                <ul><li>10:00 alert</li><li>10:05 failover</li></ul><noscript>enable js</noscript></body></html>
                """;

        String text = WebPageEvidenceSource.extractText(Jsoup.parse(html));

        assertThat(text).isEqualTo("Incident 42\nStorage latency spiked.\n10:00 alert\n10:05 failover");
    }

    @Test
    @DisplayName("only absolute http(s) URLs are fetched")
    void rejects_other_schemes() {
        WebPageEvidenceSource source = new WebPageEvidenceSource(new RcaProperties(null, null, null, null, null));

        assertThatThrownBy(() -> source.fetch("file:///etc/passwd"))
                .isInstanceOf(EvidenceUnavailableException.class)
                .satisfies(e -> assertThat(((EvidenceUnavailableException) e).getKind()).isEqualTo(ErrorKind.INSUFFICIENT_INPUT));
        assertThatThrownBy(() -> source.fetch("not a url"))
                .isInstanceOf(EvidenceUnavailableException.class);
    }
}
