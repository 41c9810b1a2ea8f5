package com.rcassist.domain.analysis.service;

import com.rcassist.domain.analysis.exception.TicketingException;
import com.rcassist.domain.analysis.model.TicketKind;
import com.rcassist.domain.analysis.model.TicketReference;

import java.util.List;

/**
 * Creates follow-up tickets in the issue tracker.
 */
public interface TicketingService {

    /**
     * @param linkedEvidence source lines of the evidence the analysis was based on
     * @throws TicketingException when the tracker rejects or cannot be reached
     */
    TicketReference createTicket(TicketKind kind, String summary, String description, List<String> linkedEvidence);
}
