package com.rcassist.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rcassist.domain.analysis.model.AnalysisResult;
import com.rcassist.domain.analysis.model.OutcomeResult;

import java.util.List;

/**
 * JSON view of an {@link OutcomeResult}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisOutcomeResponse(
        String status,
        AnalysisResult analysis,
        List<String> warnings,
        Error error
) {

    public record Error(String kind, String message, String detail) {}

    public static AnalysisOutcomeResponse from(OutcomeResult outcome) {
        if (outcome instanceof OutcomeResult.Success success) {
            return new AnalysisOutcomeResponse("SUCCESS", success.result(), null, null);
        }
        if (outcome instanceof OutcomeResult.PartialFailure partial) {
            return new AnalysisOutcomeResponse("PARTIAL_FAILURE", partial.result(), partial.warnings(), null);
        }
        OutcomeResult.Failure failure = (OutcomeResult.Failure) outcome;
        return new AnalysisOutcomeResponse("FAILURE", null, null,
                new Error(failure.kind().name(), failure.kind().userMessage(), failure.detail()));
    }
}
