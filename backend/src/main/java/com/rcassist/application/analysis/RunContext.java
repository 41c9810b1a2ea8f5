package com.rcassist.application.analysis;

import com.rcassist.domain.analysis.model.AnalysisRequest;
import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.ParsedReply;
import com.rcassist.domain.analysis.model.RawModelReply;
import com.rcassist.domain.analysis.model.RunStage;
import com.rcassist.domain.analysis.model.TicketReference;
import lombok.AccessLevel;
import lombok.Data;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one orchestration run, passed through the stages.
 * Stages only move forward.
 */
@Data
public class RunContext {

    // --- Input ---
    private final String runId;
    private final AnalysisRequest request;
    private final String templateId;

    @Setter(AccessLevel.NONE)
    private RunStage stage = RunStage.COLLECTING;

    // --- Collecting ---
    private List<EvidenceItem> evidence = new ArrayList<>();

    // --- Prompting ---
    private String prompt;

    // --- Invoking ---
    private RawModelReply reply;

    // --- Parsing ---
    private ParsedReply parsedReply;

    // --- Post-processing ---
    private List<TicketReference> createdTickets = new ArrayList<>();

    /** Collaborator failures (evidence, ticketing) that turn the outcome into a partial failure. */
    private List<String> degradations = new ArrayList<>();

    public void advanceTo(RunStage next) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already ended in " + stage);
        }
        if (next != RunStage.FAILED && next.ordinal() <= stage.ordinal()) {
            throw new IllegalStateException("Run " + runId + " cannot move from " + stage + " to " + next);
        }
        stage = next;
    }

    public void addDegradations(List<String> warnings) {
        degradations.addAll(warnings);
    }

    public void addDegradation(String warning) {
        degradations.add(warning);
    }

    public List<String> sourcesUsed() {
        return evidence.stream().map(EvidenceItem::sourceLabel).toList();
    }
}
