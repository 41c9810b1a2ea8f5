package com.rcassist.domain.analysis.model;

/**
 * Stages of one orchestration run, in their only legal order. {@link #FAILED} is terminal and
 * reachable from every stage before {@link #DONE}.
 */
public enum RunStage {
    COLLECTING,
    PROMPTING,
    INVOKING,
    PARSING,
    POST_PROCESSING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
