package com.rcassist.domain.analysis.model;

/**
 * A ticket created by post-processing.
 */
public record TicketReference(TicketKind kind, String ticketId) {}
