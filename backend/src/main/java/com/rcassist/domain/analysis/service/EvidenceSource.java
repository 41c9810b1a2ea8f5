package com.rcassist.domain.analysis.service;

import com.rcassist.domain.analysis.exception.EvidenceUnavailableException;
import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.SourceKind;

/**
 * Resolves one kind of evidence reference into plain text.
 */
public interface EvidenceSource {

    SourceKind kind();

    /**
     * @param identifier path, URL or ticket key
     * @return the extracted evidence
     * @throws EvidenceUnavailableException when the item cannot be resolved
     */
    EvidenceItem fetch(String identifier);
}
