package com.rcassist.domain.analysis.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tagged result of one orchestration run.
 */
public sealed interface OutcomeResult
        permits OutcomeResult.Success, OutcomeResult.PartialFailure, OutcomeResult.Failure {

    /**
     * The analysis, present for {@link Success} and {@link PartialFailure}.
     */
    Optional<AnalysisResult> analysis();

    record Success(AnalysisResult result) implements OutcomeResult {
        public Success {
            Objects.requireNonNull(result, "result");
        }

        @Override
        public Optional<AnalysisResult> analysis() {
            return Optional.of(result);
        }
    }

    /**
     * The analysis completed but a collaborator (evidence source, ticketing) failed along the way.
     */
    record PartialFailure(AnalysisResult result, List<String> warnings) implements OutcomeResult {
        public PartialFailure {
            Objects.requireNonNull(result, "result");
            warnings = List.copyOf(warnings);
        }

        @Override
        public Optional<AnalysisResult> analysis() {
            return Optional.of(result);
        }
    }

    record Failure(ErrorKind kind, String detail) implements OutcomeResult {
        public Failure {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public Optional<AnalysisResult> analysis() {
            return Optional.empty();
        }
    }
}
