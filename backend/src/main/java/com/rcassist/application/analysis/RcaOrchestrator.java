package com.rcassist.application.analysis;

import com.rcassist.domain.analysis.exception.TicketingException;
import com.rcassist.domain.analysis.model.AnalysisRequest;
import com.rcassist.domain.analysis.model.AnalysisResult;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.OutcomeResult;
import com.rcassist.domain.analysis.model.ParsedReply;
import com.rcassist.domain.analysis.model.ProviderName;
import com.rcassist.domain.analysis.model.RawModelReply;
import com.rcassist.domain.analysis.model.RunStage;
import com.rcassist.domain.analysis.model.TicketReference;
import com.rcassist.domain.analysis.service.TicketingService;
import com.rcassist.infrastructure.ai.LlmGateway;
import com.rcassist.infrastructure.ai.parsing.ResponseParser;
import com.rcassist.infrastructure.ai.prompt.PromptAssembler;
import com.rcassist.infrastructure.ai.prompt.TemplateNotFoundException;
import com.rcassist.infrastructure.config.RcaProperties;
import com.rcassist.infrastructure.evidence.EvidenceCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one analysis end to end:
 * <p>
 * collect evidence → assemble prompt → invoke providers → parse reply → escalation tickets
 * </p>
 * Evidence and ticketing failures degrade the outcome to a partial failure; missing input,
 * configuration problems and an all-providers failure end the run with a failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RcaOrchestrator {

    static final String RUN_ID_KEY = "runId";

    private final EvidenceCollector evidenceCollector;
    private final PromptAssembler promptAssembler;
    private final LlmGateway llmGateway;
    private final ResponseParser responseParser;
    private final EscalationPolicy escalationPolicy;
    private final TicketingService ticketingService;
    private final RcaProperties properties;

    public OutcomeResult run(AnalysisRequest request) {
        return run(request, RunCancellation.none());
    }

    /**
     * @throws RunCancelledException when {@code cancellation} fires before a stage starts
     */
    public OutcomeResult run(AnalysisRequest request, RunCancellation cancellation) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        String templateId = request.templateId() == null || request.templateId().isBlank()
                ? properties.prompt().defaultTemplate()
                : request.templateId();

        try (MDC.MDCCloseable ignored = MDC.putCloseable(RUN_ID_KEY, runId)) {
            RunContext ctx = new RunContext(runId, request, templateId);
            log.info("[Orchestrator] Run started - template: {}, evidence: {}, providers: {}",
                    templateId, request.evidence().size(), request.providerPreference());
            try {
                OutcomeResult outcome = execute(ctx, cancellation);
                log.info("[Orchestrator] Run finished in stage {} with {}", ctx.getStage(),
                        outcome.getClass().getSimpleName());
                return outcome;
            } catch (RuntimeException e) {
                if (!ctx.getStage().isTerminal()) {
                    ctx.advanceTo(RunStage.FAILED);
                }
                log.warn("[Orchestrator] Run aborted: {}", e.getMessage());
                throw e;
            }
        }
    }

    private OutcomeResult execute(RunContext ctx, RunCancellation cancellation) {
        AnalysisRequest request = ctx.getRequest();

        // 1. Collect evidence
        cancellation.throwIfCancelled(RunStage.COLLECTING);
        EvidenceCollector.CollectionResult collected = evidenceCollector.collect(request.evidence());
        ctx.setEvidence(new ArrayList<>(collected.items()));
        ctx.addDegradations(collected.warnings());
        if (collected.items().isEmpty() && !request.hasIssueDescription()) {
            String detail = request.evidence().isEmpty()
                    ? "no evidence supplied and the issue description is blank"
                    : "none of the " + request.evidence().size() + " evidence item(s) could be read and the issue description is blank";
            return fail(ctx, ErrorKind.INSUFFICIENT_INPUT, detail);
        }

        // 2. Assemble prompt
        advance(ctx, cancellation, RunStage.PROMPTING);
        try {
            ctx.setPrompt(promptAssembler.assemble(ctx.getTemplateId(), request.issueDescription(), ctx.getEvidence()));
        } catch (TemplateNotFoundException e) {
            return fail(ctx, ErrorKind.CONFIGURATION_ERROR, e.getMessage());
        }

        // 3. Invoke providers
        advance(ctx, cancellation, RunStage.INVOKING);
        List<ProviderName> preference = request.providerPreference().isEmpty()
                ? properties.llm().defaultProviderOrder()
                : request.providerPreference();
        if (preference.isEmpty()) {
            return fail(ctx, ErrorKind.CONFIGURATION_ERROR, "no LLM provider is configured");
        }
        RawModelReply reply = llmGateway.invoke(ctx.getPrompt(), preference, properties.llm().invocationOptions());
        ctx.setReply(reply);
        if (!reply.succeeded()) {
            return fail(ctx, ErrorKind.PROVIDER_UNAVAILABLE, String.format("%s failed with %s: %s",
                    reply.provider(), reply.error().orElse(ErrorKind.PROVIDER_UNAVAILABLE), reply.detail()));
        }

        // 4. Parse
        advance(ctx, cancellation, RunStage.PARSING);
        ParsedReply parsed = responseParser.parse(reply.text());
        ctx.setParsedReply(parsed);

        // 5. Post-process
        advance(ctx, cancellation, RunStage.POST_PROCESSING);
        createTickets(ctx, parsed);

        ctx.advanceTo(RunStage.DONE);
        return toOutcome(ctx);
    }

    private void createTickets(RunContext ctx, ParsedReply parsed) {
        List<EscalationPolicy.TicketRequest> requests =
                escalationPolicy.plan(parsed.structuredFields(), ctx.getRequest().issueDescription());
        for (EscalationPolicy.TicketRequest ticket : requests) {
            try {
                TicketReference created = ticketingService.createTicket(
                        ticket.kind(), ticket.summary(), ticket.description(), ctx.sourcesUsed());
                ctx.getCreatedTickets().add(created);
                log.info("[Orchestrator] {} ticket created: {}", ticket.kind(), created.ticketId());
            } catch (TicketingException e) {
                String warning = "ticket " + ticket.kind() + " not created: " + e.getMessage();
                log.warn("[Orchestrator] {}", warning);
                ctx.addDegradation(warning);
            }
        }
    }

    private OutcomeResult toOutcome(RunContext ctx) {
        ParsedReply parsed = ctx.getParsedReply();
        List<String> warnings = new ArrayList<>(ctx.getDegradations());
        warnings.addAll(parsed.warnings());

        AnalysisResult result = new AnalysisResult(
                parsed.structuredFields(),
                parsed.sections(),
                ctx.getReply().text(),
                ctx.getReply().provider(),
                warnings,
                ctx.sourcesUsed(),
                ctx.getCreatedTickets(),
                ctx.getTemplateId());

        if (ctx.getDegradations().isEmpty()) {
            return new OutcomeResult.Success(result);
        }
        return new OutcomeResult.PartialFailure(result, ctx.getDegradations());
    }

    private void advance(RunContext ctx, RunCancellation cancellation, RunStage next) {
        cancellation.throwIfCancelled(next);
        ctx.advanceTo(next);
        log.info("[Orchestrator] Stage {}", next);
    }

    private OutcomeResult fail(RunContext ctx, ErrorKind kind, String detail) {
        log.warn("[Orchestrator] Stage {} failed with {}: {}", ctx.getStage(), kind, detail);
        ctx.advanceTo(RunStage.FAILED);
        return new OutcomeResult.Failure(kind, detail);
    }
}
