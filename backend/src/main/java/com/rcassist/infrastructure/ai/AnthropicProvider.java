package com.rcassist.infrastructure.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.InvocationOptions;
import com.rcassist.domain.analysis.model.ProviderName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API over a plain {@link RestClient}.
 */
@Slf4j
public class AnthropicProvider implements LlmProvider {

    static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";

    private final ProviderName name;
    private final RestClient restClient;
    private final String model;

    public AnthropicProvider(ProviderName name, RestClient restClient, String model) {
        this.name = name;
        this.restClient = restClient;
        this.model = model;
    }

    /**
     * Builds the client with the credential and version headers every call needs.
     */
    public static RestClient.Builder clientBuilder(String baseUrl, String apiKey) {
        return RestClient.builder()
                .baseUrl(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl)
                .defaultHeader("x-api-key", apiKey)
                .defaultHeader("anthropic-version", API_VERSION);
    }

    @Override
    public ProviderName name() {
        return name;
    }

    @Override
    public String complete(String prompt, InvocationOptions options) {
        Map<String, Object> body = Map.of(
                "model", model,
                "max_tokens", options.maxTokens(),
                "temperature", options.temperature(),
                "system", OpenAiCompatibleProvider.SYSTEM_PROMPT,
                "messages", List.of(Map.of("role", "user", "content", prompt)));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RuntimeException e) {
            throw ProviderErrorClassifier.classify(name, e);
        }

        if (response == null) {
            throw new ProviderCallException(ErrorKind.MALFORMED_PROVIDER_RESPONSE, false, name + ": empty response body");
        }
        JsonNode usage = response.path("usage");
        if (!usage.isMissingNode()) {
            log.info("[{}] Token usage - model: {}, input: {}, output: {}",
                    name, model, usage.path("input_tokens").asLong(), usage.path("output_tokens").asLong());
        }
        return extractText(response);
    }

    /**
     * Concatenates the text blocks of a Messages API response.
     */
    String extractText(JsonNode response) {
        JsonNode content = response.path("content");
        if (!content.isArray()) {
            throw new ProviderCallException(ErrorKind.MALFORMED_PROVIDER_RESPONSE, false,
                    name + ": response has no content array");
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                sb.append(block.path("text").asText());
            }
        }
        String text = sb.toString().trim();
        if (text.isEmpty()) {
            throw new ProviderCallException(ErrorKind.MALFORMED_PROVIDER_RESPONSE, false,
                    name + ": response contained no text blocks");
        }
        return text;
    }
}
