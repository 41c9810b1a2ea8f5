package com.rcassist.infrastructure.ai.prompt;

import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Merges template, issue description, domain context and evidence into one prompt.
 * Evidence text is capped per source kind with a visible marker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PromptAssembler {

    static final String TRUNCATION_MARKER = "\n[...truncated...]";
    static final String NO_EVIDENCE = "No source data available for analysis.";

    private final TemplateRegistry templateRegistry;
    private final EvidenceTextNormalizer normalizer;
    private final RcaProperties properties;

    /**
     * @throws TemplateNotFoundException when the template is unknown or empty
     */
    public String assemble(String templateId, String issueDescription, List<EvidenceItem> evidence) {
        AnalysisTemplate template = templateRegistry.require(templateId);
        if (template.body() == null || template.body().isBlank()) {
            throw new TemplateNotFoundException("Analysis template is empty: " + templateId);
        }

        StringBuilder prompt = new StringBuilder(template.body().strip());

        if (issueDescription != null && !issueDescription.isBlank()) {
            prompt.append("\n\n## Issue Description:\n").append(issueDescription.strip());
        }

        templateRegistry.context(properties.prompt().domainContext())
                .filter(context -> !context.isBlank())
                .ifPresent(context -> prompt.append("\n\n## Domain Context:\n").append(context.strip()));

        prompt.append("\n\n## Source Data for Analysis:\n");
        if (evidence.isEmpty()) {
            prompt.append(NO_EVIDENCE);
        } else {
            for (EvidenceItem item : evidence) {
                int budget = properties.prompt().maxCharsFor(item.sourceKind());
                prompt.append("\n--- ").append(item.sourceKind().name()).append(": ")
                        .append(item.identifier()).append(" ---\n")
                        .append(truncate(normalizer.normalize(item.text()), budget))
                        .append('\n');
            }
        }

        log.info("[Prompt] Assembled prompt - template: {}, evidence: {}, length: {} chars",
                templateId, evidence.size(), prompt.length());
        return prompt.toString();
    }

    static String truncate(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        // do not split a surrogate pair
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end) + TRUNCATION_MARKER;
    }
}
