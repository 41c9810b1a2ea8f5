package com.rcassist.infrastructure.ai;

/**
 * Wire protocols the gateway can speak. Each value has one {@link LlmProvider} implementation.
 */
public enum ProviderType {
    /** OpenAI chat completions, also used by OpenRouter and OpenAI-compatible proxies via base URL. */
    OPENAI_COMPATIBLE,
    /** Anthropic Messages API. */
    ANTHROPIC
}
