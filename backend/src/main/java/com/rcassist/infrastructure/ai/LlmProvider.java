package com.rcassist.infrastructure.ai;

import com.rcassist.domain.analysis.model.InvocationOptions;
import com.rcassist.domain.analysis.model.ProviderName;

/**
 * One concrete LLM backend. Implementations perform a single call and classify its failure;
 * retry, timeout and fallback belong to {@link LlmGateway}.
 */
public interface LlmProvider {

    ProviderName name();

    /**
     * @return the non-blank reply text
     * @throws ProviderCallException classified failure of this call
     */
    String complete(String prompt, InvocationOptions options);
}
