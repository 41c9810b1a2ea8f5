package com.rcassist.infrastructure.ai.prompt;

/**
 * Prompt template text, opaque to the pipeline.
 */
public record AnalysisTemplate(String id, String body) {
}
