package com.rcassist.infrastructure.config;

import com.rcassist.domain.analysis.model.InvocationOptions;
import com.rcassist.domain.analysis.model.ProviderName;
import com.rcassist.domain.analysis.model.SourceKind;
import com.rcassist.infrastructure.ai.ProviderType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolved application configuration under the {@code rca} prefix. Bound once at startup and
 * passed by constructor; nothing in the pipeline looks configuration up on its own.
 */
@ConfigurationProperties(prefix = "rca")
public record RcaProperties(
        Llm llm,
        Prompt prompt,
        Evidence evidence,
        Ticketing ticketing,
        Escalation escalation
) {
    public RcaProperties {
        llm = llm == null ? new Llm(null, null, null, 0, null, null) : llm;
        prompt = prompt == null ? new Prompt(null, null, null, 0) : prompt;
        evidence = evidence == null ? new Evidence(null, null, null, null, null) : evidence;
        ticketing = ticketing == null ? new Ticketing(false, null) : ticketing;
        escalation = escalation == null ? new Escalation(null, null, null, null, null, null) : escalation;
    }

    /**
     * @param providers    configured providers keyed by provider name; insertion order is kept
     * @param defaultOrder fallback order used when a request names no providers
     * @param timeout      bound for a single provider attempt
     * @param retryBackoff pause before the single retry of a transient failure
     */
    public record Llm(
            Map<String, Provider> providers,
            List<String> defaultOrder,
            Duration timeout,
            int maxTokens,
            Double temperature,
            Duration retryBackoff
    ) {
        public Llm {
            providers = providers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(providers));
            defaultOrder = defaultOrder == null ? List.of() : List.copyOf(defaultOrder);
            timeout = timeout == null ? Duration.ofSeconds(120) : timeout;
            maxTokens = maxTokens <= 0 ? 4000 : maxTokens;
            temperature = temperature == null ? 0.3 : temperature;
            retryBackoff = retryBackoff == null ? Duration.ofMillis(500) : retryBackoff;
        }

        public InvocationOptions invocationOptions() {
            return new InvocationOptions(timeout, maxTokens, temperature);
        }

        /**
         * Default order as provider names; when none is configured, every configured provider in
         * declaration order.
         */
        public List<ProviderName> defaultProviderOrder() {
            List<String> names = defaultOrder.isEmpty() ? List.copyOf(providers.keySet()) : defaultOrder;
            return names.stream().map(ProviderName::of).distinct().toList();
        }
    }

    /**
     * @param type    wire protocol of the provider
     * @param apiKey  credential; providers without one are not registered
     * @param model   model identifier sent with every request
     * @param baseUrl endpoint override for proxy-style providers, null for the vendor default
     */
    public record Provider(ProviderType type, String apiKey, String model, String baseUrl) {

        public boolean hasCredentials() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    /**
     * @param defaultTemplate  template used when a request names none
     * @param domainContext    context resource included in every prompt, blank for none
     * @param maxCharsPerKind  per-kind character budget for one evidence item ({@code file}, {@code url}, {@code ticket})
     * @param defaultMaxChars  budget for kinds without an explicit entry
     */
    public record Prompt(
            String defaultTemplate,
            String domainContext,
            Map<String, Integer> maxCharsPerKind,
            int defaultMaxChars
    ) {
        public Prompt {
            defaultTemplate = defaultTemplate == null ? "formal_rca" : defaultTemplate;
            domainContext = domainContext == null ? "" : domainContext;
            maxCharsPerKind = maxCharsPerKind == null ? Map.of() : Map.copyOf(maxCharsPerKind);
            defaultMaxChars = defaultMaxChars <= 0 ? 20_000 : defaultMaxChars;
        }

        public int maxCharsFor(SourceKind kind) {
            Integer configured = maxCharsPerKind.get(kind.key());
            return configured == null || configured <= 0 ? defaultMaxChars : configured;
        }
    }

    /**
     * @param allowedRoots      directories files may be read from
     * @param allowedExtensions lowercase extensions including the dot
     * @param maxFileSize       files above this size are rejected
     * @param fetchTimeout      bound for one evidence fetch
     * @param userAgent         user agent for web page fetches
     */
    public record Evidence(
            List<String> allowedRoots,
            List<String> allowedExtensions,
            DataSize maxFileSize,
            Duration fetchTimeout,
            String userAgent
    ) {
        public Evidence {
            allowedRoots = allowedRoots == null ? List.of("./uploads") : List.copyOf(allowedRoots);
            allowedExtensions = allowedExtensions == null
                    ? List.of(".pdf", ".txt", ".md", ".log")
                    : allowedExtensions.stream().map(String::toLowerCase).toList();
            maxFileSize = maxFileSize == null ? DataSize.ofMegabytes(50) : maxFileSize;
            fetchTimeout = fetchTimeout == null ? Duration.ofSeconds(30) : fetchTimeout;
            userAgent = userAgent == null ? "rca-assistant" : userAgent;
        }
    }

    /**
     * @param autoCreate master switch for severity-triggered ticket creation
     */
    public record Ticketing(boolean autoCreate, Jira jira) {
        public Ticketing {
            jira = jira == null ? new Jira(null, null, null, null, null, null, null, null) : jira;
        }
    }

    public record Jira(
            String url,
            String username,
            String apiToken,
            String escalationProject,
            String escalationIssueType,
            String defectProject,
            String defectIssueType,
            Duration timeout
    ) {
        public Jira {
            escalationProject = escalationProject == null ? "CPE" : escalationProject;
            escalationIssueType = escalationIssueType == null ? "Task" : escalationIssueType;
            defectProject = defectProject == null ? escalationProject : defectProject;
            defectIssueType = defectIssueType == null ? "Bug" : defectIssueType;
            timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        }
    }

    /**
     * @param severityScale       severities from least to most severe, compared case-insensitively
     * @param threshold           lowest severity that triggers ticket creation
     * @param severityField       structured field holding the severity
     * @param escalationFlagField structured field that can veto the escalation ticket
     * @param defectFlagField     structured field that requests a defect ticket
     * @param summaryFields       structured fields tried in order for the ticket summary
     */
    public record Escalation(
            List<String> severityScale,
            String threshold,
            String severityField,
            String escalationFlagField,
            String defectFlagField,
            List<String> summaryFields
    ) {
        public Escalation {
            severityScale = severityScale == null
                    ? List.of("low", "medium", "high", "critical")
                    : severityScale.stream().map(String::toLowerCase).toList();
            threshold = threshold == null ? "high" : threshold.toLowerCase();
            severityField = severityField == null ? "severity" : severityField;
            escalationFlagField = escalationFlagField == null ? "escalation_needed" : escalationFlagField;
            defectFlagField = defectFlagField == null ? "defect_tickets_needed" : defectFlagField;
            summaryFields = summaryFields == null
                    ? List.of("problem_statement", "executive_summary")
                    : List.copyOf(summaryFields);
        }
    }
}
