package com.rcassist.infrastructure.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.rcassist.domain.analysis.exception.EvidenceUnavailableException;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.SourceKind;
import com.rcassist.domain.analysis.service.EvidenceSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads a Jira issue, its linked issues included, as evidence text.
 */
@Slf4j
@Component
@Profile("jira")
public class JiraTicketEvidenceSource implements EvidenceSource {

    private static final Pattern TICKET_KEY = Pattern.compile("[A-Z][A-Z0-9_]+-\\d+");
    private static final String FIELDS = "summary,status,priority,issuetype,description,issuelinks";

    private final RestClient jiraRestClient;

    public JiraTicketEvidenceSource(@Qualifier("jiraRestClient") RestClient jiraRestClient) {
        this.jiraRestClient = jiraRestClient;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.TICKET;
    }

    @Override
    public EvidenceItem fetch(String identifier) {
        String key = identifier.strip().toUpperCase(Locale.ROOT);
        if (!TICKET_KEY.matcher(key).matches()) {
            throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT, "not a Jira issue key");
        }

        JsonNode issue;
        try {
            issue = jiraRestClient.get()
                    .uri("/rest/api/2/issue/{key}?fields={fields}", key, FIELDS)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            ErrorKind kind = status == 401 || status == 403 ? ErrorKind.CONFIGURATION_ERROR : ErrorKind.INSUFFICIENT_INPUT;
            throw new EvidenceUnavailableException(kind, "Jira answered HTTP " + status, e);
        } catch (RestClientException e) {
            throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT,
                    "Jira could not be reached: " + e.getMessage(), e);
        }
        if (issue == null) {
            throw new EvidenceUnavailableException(ErrorKind.INSUFFICIENT_INPUT, "Jira returned an empty body");
        }

        EvidenceItem item = toEvidence(key, issue);
        log.info("[Evidence] Read Jira ticket {} ({} linked)", key, item.metadata().get("linkedIssues"));
        return item;
    }

    static EvidenceItem toEvidence(String key, JsonNode issue) {
        JsonNode fields = issue.path("fields");
        String summary = fields.path("summary").asText("");
        String status = fields.path("status").path("name").asText("Unknown");
        String priority = fields.path("priority").path("name").asText("Unknown");
        String type = fields.path("issuetype").path("name").asText("");
        String description = fields.path("description").asText("");

        List<String> linked = linkedIssues(fields.path("issuelinks"));

        StringBuilder text = new StringBuilder()
                .append("Ticket: ").append(key).append('\n')
                .append("Summary: ").append(summary).append('\n');
        if (!type.isEmpty()) {
            text.append("Type: ").append(type).append('\n');
        }
        text.append("Status: ").append(status).append('\n')
                .append("Priority: ").append(priority).append('\n');
        if (!description.isBlank()) {
            text.append("\nDescription:\n").append(description.strip()).append('\n');
        }
        if (!linked.isEmpty()) {
            text.append("\nLinked Issues:\n");
            linked.forEach(line -> text.append("- ").append(line).append('\n'));
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("status", status);
        metadata.put("priority", priority);
        metadata.put("linkedIssues", String.valueOf(linked.size()));
        return new EvidenceItem(SourceKind.TICKET, key, text.toString().strip(), metadata);
    }

    private static List<String> linkedIssues(JsonNode links) {
        List<String> lines = new ArrayList<>();
        for (JsonNode link : links) {
            boolean outward = link.has("outwardIssue");
            JsonNode other = outward ? link.path("outwardIssue") : link.path("inwardIssue");
            if (other.isMissingNode()) {
                continue;
            }
            String relation = link.path("type").path(outward ? "outward" : "inward").asText("relates to");
            lines.add(String.format("%s %s: %s (%s)",
                    relation,
                    other.path("key").asText(),
                    other.path("fields").path("summary").asText(""),
                    other.path("fields").path("status").path("name").asText("Unknown")));
        }
        return lines;
    }
}
