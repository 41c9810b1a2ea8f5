package com.rcassist.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.openai.errors.OpenAIInvalidDataException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.ProviderName;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * Maps SDK and HTTP client failures onto {@link ErrorKind}s.
 */
public final class ProviderErrorClassifier {

    private ProviderErrorClassifier() {
    }

    public static ProviderCallException classify(ProviderName provider, Throwable error) {
        if (error instanceof ProviderCallException pce) {
            return pce;
        }
        String message = provider + ": " + describe(error);

        if (error instanceof OpenAIServiceException se) {
            return fromStatus(se.statusCode(), message, error);
        }
        if (error instanceof RestClientResponseException re) {
            return fromStatus(re.getStatusCode().value(), message, error);
        }
        if (error instanceof OpenAIInvalidDataException || error instanceof JsonProcessingException) {
            return new ProviderCallException(ErrorKind.MALFORMED_PROVIDER_RESPONSE, false, message, error);
        }
        if (isTimeout(error)) {
            return new ProviderCallException(ErrorKind.PROVIDER_TIMEOUT, false, message, error);
        }
        if (error instanceof OpenAIIoException
                || error instanceof ResourceAccessException
                || error instanceof IOException
                || error instanceof UncheckedIOException) {
            return new ProviderCallException(ErrorKind.PROVIDER_UNAVAILABLE, true, message, error);
        }
        return new ProviderCallException(ErrorKind.PROVIDER_UNAVAILABLE, false, message, error);
    }

    static ProviderCallException fromStatus(int status, String message, Throwable cause) {
        String withStatus = message + " (HTTP " + status + ")";
        if (status == 401 || status == 403) {
            return new ProviderCallException(ErrorKind.PROVIDER_AUTH_ERROR, false, withStatus, cause);
        }
        if (status == 402 || status == 429) {
            return new ProviderCallException(ErrorKind.PROVIDER_QUOTA_ERROR, false, withStatus, cause);
        }
        if (status == 408) {
            return new ProviderCallException(ErrorKind.PROVIDER_TIMEOUT, false, withStatus, cause);
        }
        if (status == 404) {
            // unknown model id or wrong base URL
            return new ProviderCallException(ErrorKind.CONFIGURATION_ERROR, false, withStatus, cause);
        }
        if (status >= 500) {
            return new ProviderCallException(ErrorKind.PROVIDER_UNAVAILABLE, true, withStatus, cause);
        }
        return new ProviderCallException(ErrorKind.MALFORMED_PROVIDER_RESPONSE, false, withStatus, cause);
    }

    private static boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        String msg = error.getMessage();
        return msg == null || msg.isBlank() ? error.getClass().getSimpleName() : msg;
    }
}
