package com.rcassist.domain.analysis.model;

import java.util.List;

/**
 * One user-initiated analysis run. Read-only once created.
 *
 * @param issueDescription   free-text description, may be blank when evidence is supplied
 * @param evidence           evidence to collect, in the order the user supplied it
 * @param templateId         analysis template to prompt with
 * @param providerPreference providers to try in order; empty means the configured default order
 */
public record AnalysisRequest(
        String issueDescription,
        List<EvidenceReference> evidence,
        String templateId,
        List<ProviderName> providerPreference
) {
    public AnalysisRequest {
        issueDescription = issueDescription == null ? "" : issueDescription.strip();
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        providerPreference = providerPreference == null ? List.of() : List.copyOf(providerPreference);
    }

    public boolean hasIssueDescription() {
        return !issueDescription.isBlank();
    }
}
