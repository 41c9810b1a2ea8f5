package com.rcassist.domain.analysis.model;

/**
 * Classification of every known failure condition, each with the message shown to the user.
 */
public enum ErrorKind {
    INSUFFICIENT_INPUT("Add at least one readable evidence source or describe the issue."),
    CONFIGURATION_ERROR("The analysis service is misconfigured. Check templates and provider settings."),
    PROVIDER_AUTH_ERROR("The language model rejected the credentials. Check the API key or try a different provider."),
    PROVIDER_QUOTA_ERROR("The language model quota is exhausted. Try a different provider or retry later."),
    PROVIDER_TIMEOUT("The language model did not answer in time. Retry or try a different provider."),
    PROVIDER_UNAVAILABLE("No language model provider could complete the analysis. Try a different provider."),
    MALFORMED_PROVIDER_RESPONSE("The language model returned an unusable response. Retry or try a different provider."),
    TICKETING_ERROR("Follow-up tickets could not be created. Create them manually."),
    INTERNAL_PARSE_WARNING("Parts of the model reply could not be structured; the raw text is still available.");

    private final String userMessage;

    ErrorKind(String userMessage) {
        this.userMessage = userMessage;
    }

    public String userMessage() {
        return userMessage;
    }

    public boolean isProviderError() {
        return this == PROVIDER_AUTH_ERROR
                || this == PROVIDER_QUOTA_ERROR
                || this == PROVIDER_TIMEOUT
                || this == PROVIDER_UNAVAILABLE
                || this == MALFORMED_PROVIDER_RESPONSE;
    }
}
