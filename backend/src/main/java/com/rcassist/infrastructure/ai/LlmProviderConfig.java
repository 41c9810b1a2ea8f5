package com.rcassist.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.rcassist.domain.analysis.model.ProviderName;
import com.rcassist.infrastructure.concurrent.MdcPropagatingExecutor;
import com.rcassist.infrastructure.config.RcaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one immutable client per configured provider at startup.
 */
@Slf4j
@Configuration
public class LlmProviderConfig {

    @Bean(destroyMethod = "close")
    public MdcPropagatingExecutor llmExecutor() {
        return new MdcPropagatingExecutor("llm");
    }

    @Bean
    public LlmGateway llmGateway(RcaProperties properties,
                                 @Qualifier("llmExecutor") MdcPropagatingExecutor llmExecutor) {
        RcaProperties.Llm llm = properties.llm();
        List<LlmProvider> providers = new ArrayList<>();

        for (Map.Entry<String, RcaProperties.Provider> entry : llm.providers().entrySet()) {
            ProviderName name = ProviderName.of(entry.getKey());
            RcaProperties.Provider config = entry.getValue();
            if (!config.hasCredentials()) {
                log.info("[Gateway] Provider '{}' has no API key, not registered", name);
                continue;
            }
            if (config.model() == null || config.model().isBlank()) {
                log.warn("[Gateway] Provider '{}' has no model configured, not registered", name);
                continue;
            }
            providers.add(createProvider(name, config, llm.timeout()));
            log.info("[Gateway] Initialized provider '{}' ({}, model: {})", name, config.type(), config.model());
        }

        if (providers.isEmpty()) {
            log.warn("[Gateway] No LLM provider initialized; every analysis will fail until one is configured");
        }
        return new LlmGateway(providers, llmExecutor, llm.retryBackoff());
    }

    static LlmProvider createProvider(ProviderName name, RcaProperties.Provider config, Duration timeout) {
        ProviderType type = config.type() == null ? ProviderType.OPENAI_COMPATIBLE : config.type();
        return switch (type) {
            case OPENAI_COMPATIBLE -> new OpenAiCompatibleProvider(name, openAiClient(config, timeout), config.model());
            case ANTHROPIC -> {
                SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
                requestFactory.setConnectTimeout(timeout);
                requestFactory.setReadTimeout(timeout);
                yield new AnthropicProvider(name,
                        AnthropicProvider.clientBuilder(config.baseUrl(), config.apiKey())
                                .requestFactory(requestFactory)
                                .build(),
                        config.model());
            }
        };
    }

    private static OpenAIClient openAiClient(RcaProperties.Provider config, Duration timeout) {
        OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                .apiKey(config.apiKey())
                .timeout(timeout)
                // the gateway owns retries
                .maxRetries(0);
        if (config.baseUrl() != null && !config.baseUrl().isBlank()) {
            builder.baseUrl(config.baseUrl());
        }
        return builder.build();
    }
}
