package com.rcassist.infrastructure.ticketing;

import com.fasterxml.jackson.databind.JsonNode;
import com.rcassist.domain.analysis.exception.TicketingException;
import com.rcassist.domain.analysis.model.TicketKind;
import com.rcassist.domain.analysis.model.TicketReference;
import com.rcassist.domain.analysis.service.TicketingService;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.List;
import java.util.Map;

/**
 * Creates issues through the Jira REST API. Escalations and defects go to their own project and
 * issue type.
 */
@Service
@Profile("jira")
@Slf4j
public class JiraTicketingService implements TicketingService {

    private final RestClient jiraRestClient;
    private final RcaProperties.Jira jira;

    public JiraTicketingService(@Qualifier("jiraRestClient") RestClient jiraRestClient, RcaProperties properties) {
        this.jiraRestClient = jiraRestClient;
        this.jira = properties.ticketing().jira();
    }

    @Override
    public TicketReference createTicket(TicketKind kind, String summary, String description, List<String> linkedEvidence) {
        Map<String, Object> body = requestBody(kind, summary, description, linkedEvidence);

        JsonNode created;
        try {
            created = jiraRestClient.post()
                    .uri("/rest/api/2/issue")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            log.error("Jira rejected {} ticket: HTTP {} {}", kind, e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new TicketingException("Jira rejected the " + kind + " ticket (HTTP " + e.getStatusCode().value() + ")", e);
        } catch (RestClientException e) {
            log.error("Failed to create {} ticket: {}", kind, e.getMessage());
            throw new TicketingException("Jira could not be reached: " + e.getMessage(), e);
        }

        String key = created == null ? "" : created.path("key").asText("");
        if (key.isEmpty()) {
            throw new TicketingException("Jira did not return a key for the " + kind + " ticket");
        }
        log.info("Created {} ticket {}", kind, key);
        return new TicketReference(kind, key);
    }

    Map<String, Object> requestBody(TicketKind kind, String summary, String description, List<String> linkedEvidence) {
        String project = kind == TicketKind.ESCALATION ? jira.escalationProject() : jira.defectProject();
        String issueType = kind == TicketKind.ESCALATION ? jira.escalationIssueType() : jira.defectIssueType();

        StringBuilder fullDescription = new StringBuilder(description);
        if (!linkedEvidence.isEmpty()) {
            fullDescription.append("\n\nEvidence:\n");
            linkedEvidence.forEach(source -> fullDescription.append("* ").append(source).append('\n'));
        }

        return Map.of("fields", Map.of(
                "project", Map.of("key", project),
                "summary", summary,
                "description", fullDescription.toString().strip(),
                "issuetype", Map.of("name", issueType)));
    }
}
