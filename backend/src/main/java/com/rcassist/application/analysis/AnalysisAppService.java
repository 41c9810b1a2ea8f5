package com.rcassist.application.analysis;

import com.rcassist.domain.analysis.model.AnalysisRequest;
import com.rcassist.domain.analysis.model.EvidenceReference;
import com.rcassist.domain.analysis.model.OutcomeResult;
import com.rcassist.domain.analysis.model.ProviderName;
import com.rcassist.infrastructure.ai.LlmGateway;
import com.rcassist.infrastructure.ai.ProviderOrder;
import com.rcassist.infrastructure.ai.prompt.AnalysisTemplate;
import com.rcassist.infrastructure.ai.prompt.TemplateRegistry;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisAppService {

    private final RcaOrchestrator orchestrator;
    private final RunRegistry runRegistry;
    private final TemplateRegistry templateRegistry;
    private final LlmGateway llmGateway;
    private final RcaProperties properties;

    /**
     * Builds the request from raw inputs and runs it. Files, URLs and tickets are collected in
     * that order.
     *
     * @param providers         explicit fallback order, wins over {@code preferredProvider}
     * @param preferredProvider tried first, followed by the rest of the default order
     * @param requestId         caller-chosen id under which the run can be cancelled, may be null
     */
    public OutcomeResult analyze(String issueDescription,
                                 List<String> files,
                                 List<String> urls,
                                 List<String> tickets,
                                 String templateId,
                                 List<String> providers,
                                 String preferredProvider,
                                 String requestId) {
        List<EvidenceReference> evidence = new ArrayList<>();
        nonBlank(files).forEach(file -> evidence.add(EvidenceReference.file(file)));
        nonBlank(urls).forEach(url -> evidence.add(EvidenceReference.url(url)));
        nonBlank(tickets).forEach(ticket -> evidence.add(EvidenceReference.ticket(ticket)));

        List<ProviderName> explicit = nonBlank(providers).stream().map(ProviderName::of).toList();
        ProviderName preferred = preferredProvider == null || preferredProvider.isBlank()
                ? null
                : ProviderName.of(preferredProvider);
        List<ProviderName> order = ProviderOrder.resolve(explicit, preferred, properties.llm().defaultProviderOrder());

        String template = templateId == null || templateId.isBlank()
                ? properties.prompt().defaultTemplate()
                : templateId.strip();

        AnalysisRequest request = new AnalysisRequest(issueDescription, evidence, template, order);
        if (requestId == null || requestId.isBlank()) {
            return orchestrator.run(request, RunCancellation.none());
        }

        String id = requestId.strip();
        RunCancellation cancellation = runRegistry.register(id);
        try {
            return orchestrator.run(request, cancellation);
        } finally {
            runRegistry.release(id, cancellation);
        }
    }

    public boolean cancel(String requestId) {
        return runRegistry.cancel(requestId.strip());
    }

    public List<String> availableTemplates() {
        return templateRegistry.all().stream().map(AnalysisTemplate::id).toList();
    }

    public List<String> availableProviders() {
        return llmGateway.configuredProviders().stream().map(ProviderName::value).toList();
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(v -> v != null && !v.isBlank()).toList();
    }
}
