package com.rcassist.application.analysis;

import com.rcassist.domain.analysis.model.TicketKind;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Decides which follow-up tickets an analysis warrants. The severity scale, threshold and field
 * names all come from configuration.
 */
@Slf4j
@Component
public class EscalationPolicy {

    static final int MAX_SUMMARY_LENGTH = 200;

    /**
     * A ticket to create.
     */
    public record TicketRequest(TicketKind kind, String summary, String description) {
    }

    private final boolean autoCreate;
    private final RcaProperties.Escalation config;

    public EscalationPolicy(RcaProperties properties) {
        this.autoCreate = properties.ticketing().autoCreate();
        this.config = properties.escalation();
    }

    public List<TicketRequest> plan(Map<String, Object> structuredFields, String issueDescription) {
        if (!autoCreate || structuredFields.isEmpty()) {
            return List.of();
        }
        Object severityValue = structuredFields.get(config.severityField());
        if (severityValue == null) {
            return List.of();
        }

        String severity = String.valueOf(severityValue).strip();
        int rank = rankOf(severity);
        int thresholdRank = config.severityScale().indexOf(config.threshold());
        if (rank < 0 || thresholdRank < 0) {
            log.warn("[Escalation] Severity '{}' or threshold '{}' not on scale {}",
                    severity, config.threshold(), config.severityScale());
            return List.of();
        }
        if (rank < thresholdRank) {
            log.info("[Escalation] Severity '{}' below threshold '{}', no tickets", severity, config.threshold());
            return List.of();
        }

        String summary = summary(config.severityScale().get(rank), structuredFields, issueDescription);
        String description = describe(structuredFields);

        List<TicketRequest> requests = new ArrayList<>();
        if (!isExplicitlyFalse(structuredFields.get(config.escalationFlagField()))) {
            requests.add(new TicketRequest(TicketKind.ESCALATION, summary, description));
        }
        if (isTruthy(structuredFields.get(config.defectFlagField()))) {
            requests.add(new TicketRequest(TicketKind.DEFECT, summary, description));
        }
        log.info("[Escalation] Severity '{}' at or above '{}', requesting {}",
                severity, config.threshold(), requests.stream().map(TicketRequest::kind).toList());
        return requests;
    }

    /**
     * Position on the scale; {@code "High - customer impact"} ranks as {@code high}.
     */
    int rankOf(String severity) {
        String normalized = severity.toLowerCase(Locale.ROOT);
        int exact = config.severityScale().indexOf(normalized);
        if (exact >= 0) {
            return exact;
        }
        String firstToken = normalized.split("[^\\p{L}\\p{N}]+", 2)[0];
        return config.severityScale().indexOf(firstToken);
    }

    private String summary(String severity, Map<String, Object> fields, String issueDescription) {
        String headline = config.summaryFields().stream()
                .map(fields::get)
                .filter(value -> value instanceof String s && !s.isBlank())
                .map(value -> ((String) value).strip())
                .findFirst()
                .or(() -> Optional.ofNullable(issueDescription).filter(d -> !d.isBlank()))
                .orElse("Root cause analysis");
        String firstLine = headline.lines().findFirst().orElse("").strip();
        String summary = "[RCA][" + severity.toUpperCase(Locale.ROOT) + "] " + firstLine;
        return summary.length() <= MAX_SUMMARY_LENGTH ? summary : summary.substring(0, MAX_SUMMARY_LENGTH - 3) + "...";
    }

    static String describe(Map<String, Object> fields) {
        StringBuilder sb = new StringBuilder();
        fields.forEach((key, value) -> sb.append(key).append(": ").append(render(value)).append('\n'));
        return sb.toString().strip();
    }

    private static String render(Object value) {
        if (value instanceof Collection<?> items) {
            return items.stream().map(EscalationPolicy::render).collect(Collectors.joining("; "));
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .map(e -> e.getKey() + "=" + render(e.getValue()))
                    .collect(Collectors.joining(", ", "{", "}"));
        }
        return String.valueOf(value);
    }

    static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String normalized = s.strip().toLowerCase(Locale.ROOT);
            return normalized.equals("true") || normalized.startsWith("yes");
        }
        return false;
    }

    static boolean isExplicitlyFalse(Object value) {
        if (value instanceof Boolean b) {
            return !b;
        }
        if (value instanceof String s) {
            String normalized = s.strip().toLowerCase(Locale.ROOT);
            return normalized.equals("false") || normalized.equals("no") || normalized.startsWith("no ")
                    || normalized.startsWith("no,") || normalized.startsWith("no.");
        }
        return false;
    }
}
