package com.rcassist.infrastructure.ticketing;

import com.rcassist.domain.analysis.model.TicketKind;
import com.rcassist.domain.analysis.model.TicketReference;
import com.rcassist.domain.analysis.service.TicketingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Logs tickets instead of creating them; active whenever the {@code jira} profile is off.
 */
@Service
@Profile("!jira")
@Slf4j
public class ConsoleTicketingService implements TicketingService {

    @Override
    public TicketReference createTicket(TicketKind kind, String summary, String description, List<String> linkedEvidence) {
        String ticketId = "LOCAL-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        log.info("""
                ========================================
                [DEV] {} ticket {}
                Summary: {}
                Evidence: {}
                ----------------------------------------
                {}
                ========================================""", kind, ticketId, summary, linkedEvidence, description);
        return new TicketReference(kind, ticketId);
    }
}
