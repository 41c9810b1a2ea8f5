package com.rcassist.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.InvocationOptions;
import com.rcassist.domain.analysis.model.ProviderName;
import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completions provider for OpenAI and every endpoint that speaks the same protocol
 * (OpenRouter, internal LLM proxies). The endpoint is chosen by the client's base URL.
 */
@Slf4j
public class OpenAiCompatibleProvider implements LlmProvider {

    static final String SYSTEM_PROMPT =
            "You are an expert technical analyst specializing in root cause analysis.";

    private final ProviderName name;
    private final OpenAIClient client;
    private final String model;

    public OpenAiCompatibleProvider(ProviderName name, OpenAIClient client, String model) {
        this.name = name;
        this.client = client;
        this.model = model;
    }

    @Override
    public ProviderName name() {
        return name;
    }

    @Override
    public String complete(String prompt, InvocationOptions options) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(options.temperature())
                .maxCompletionTokens(options.maxTokens())
                .addSystemMessage(SYSTEM_PROMPT)
                .addUserMessage(prompt)
                .build();

        ChatCompletion completion;
        try {
            completion = client.chat().completions().create(params);
        } catch (RuntimeException e) {
            throw ProviderErrorClassifier.classify(name, e);
        }

        completion.usage().ifPresent(usage ->
                log.info("[{}] Token usage - model: {}, prompt: {}, completion: {}, total: {}",
                        name, model, usage.promptTokens(), usage.completionTokens(), usage.totalTokens()));

        return completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .map(String::trim)
                .filter(content -> !content.isEmpty())
                .orElseThrow(() -> new ProviderCallException(ErrorKind.MALFORMED_PROVIDER_RESPONSE, false,
                        name + ": reply contained no message content"));
    }
}
