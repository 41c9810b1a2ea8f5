package com.rcassist.domain.analysis.model;

public enum TicketKind {
    ESCALATION,
    DEFECT
}
