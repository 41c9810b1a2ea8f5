package com.rcassist.infrastructure.ai;

import com.rcassist.domain.analysis.model.ErrorKind;
import com.rcassist.domain.analysis.model.InvocationOptions;
import com.rcassist.domain.analysis.model.ProviderName;
import com.rcassist.domain.analysis.model.RawModelReply;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends one prompt to the configured providers in preference order and returns the first
 * successful reply, or the failure of the last attempt when every provider fails.
 * <p>
 * Each attempt is bounded by {@link InvocationOptions#timeout()}. Transient failures (I/O, 5xx)
 * get exactly one retry after a fixed backoff; everything else fails the attempt immediately.
 * Holds no per-invocation state.
 */
@Slf4j
public class LlmGateway {

    private final Map<ProviderName, LlmProvider> providers;
    private final ExecutorService executor;
    private final Duration retryBackoff;

    /**
     * @param executor must start every call immediately; a queued call would spend its timeout
     *                 waiting for a thread
     */
    public LlmGateway(List<LlmProvider> providers, ExecutorService executor, Duration retryBackoff) {
        Map<ProviderName, LlmProvider> byName = new LinkedHashMap<>();
        for (LlmProvider provider : providers) {
            byName.put(provider.name(), provider);
        }
        this.providers = Collections.unmodifiableMap(byName);
        this.executor = executor;
        this.retryBackoff = retryBackoff;
    }

    public Set<ProviderName> configuredProviders() {
        return providers.keySet();
    }

    public RawModelReply invoke(String prompt, List<ProviderName> preference, InvocationOptions options) {
        if (preference == null || preference.isEmpty()) {
            throw new IllegalArgumentException("Provider preference must name at least one provider");
        }

        RawModelReply last = null;
        for (ProviderName name : preference) {
            LlmProvider provider = providers.get(name);
            if (provider == null) {
                log.warn("[Gateway] Provider '{}' is not configured, skipping", name);
                last = RawModelReply.failure(name, ErrorKind.CONFIGURATION_ERROR,
                        name + ": provider is not configured", Duration.ZERO);
                continue;
            }

            last = attempt(provider, prompt, options);
            if (last.succeeded()) {
                log.info("[Gateway] {} succeeded in {}ms ({} chars)",
                        name, last.latency().toMillis(), last.text().length());
                return last;
            }
            log.warn("[Gateway] {} failed in {}ms with {}: {}",
                    name, last.latency().toMillis(), last.error().orElseThrow(), last.detail());
        }

        log.error("[Gateway] All {} provider(s) failed, last: {}", preference.size(), last.provider());
        return last;
    }

    private RawModelReply attempt(LlmProvider provider, String prompt, InvocationOptions options) {
        long start = System.nanoTime();
        try {
            String text = callWithTimeout(provider, prompt, options);
            return RawModelReply.success(provider.name(), text, elapsedSince(start));
        } catch (ProviderCallException first) {
            if (!first.isTransient()) {
                return RawModelReply.failure(provider.name(), first.getKind(), first.getMessage(), elapsedSince(start));
            }
            log.info("[Gateway] {} transient failure, retrying once in {}ms: {}",
                    provider.name(), retryBackoff.toMillis(), first.getMessage());
            if (!pause()) {
                return RawModelReply.failure(provider.name(), ErrorKind.PROVIDER_UNAVAILABLE,
                        provider.name() + ": interrupted before retry", elapsedSince(start));
            }
            try {
                String text = callWithTimeout(provider, prompt, options);
                return RawModelReply.success(provider.name(), text, elapsedSince(start));
            } catch (ProviderCallException second) {
                ErrorKind kind = second.isTransient() ? ErrorKind.PROVIDER_UNAVAILABLE : second.getKind();
                return RawModelReply.failure(provider.name(), kind, second.getMessage(), elapsedSince(start));
            }
        }
    }

    private String callWithTimeout(LlmProvider provider, String prompt, InvocationOptions options) {
        Future<String> future = executor.submit(() -> provider.complete(prompt, options));
        try {
            return future.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ProviderCallException(ErrorKind.PROVIDER_TIMEOUT, false,
                    provider.name() + ": no reply within " + options.timeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw ProviderErrorClassifier.classify(provider.name(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ProviderCallException(ErrorKind.PROVIDER_UNAVAILABLE, false,
                    provider.name() + ": interrupted while waiting for reply", e);
        }
    }

    private boolean pause() {
        if (retryBackoff.isZero() || retryBackoff.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(retryBackoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
