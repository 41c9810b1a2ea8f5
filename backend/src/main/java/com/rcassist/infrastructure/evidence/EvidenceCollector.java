package com.rcassist.infrastructure.evidence;

import com.rcassist.domain.analysis.exception.EvidenceUnavailableException;
import com.rcassist.domain.analysis.model.EvidenceItem;
import com.rcassist.domain.analysis.model.EvidenceReference;
import com.rcassist.domain.analysis.model.SourceKind;
import com.rcassist.domain.analysis.service.EvidenceSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves evidence references concurrently. Items that cannot be resolved become warnings;
 * resolved items keep the order of the request.
 */
@Slf4j
public class EvidenceCollector {

    public record CollectionResult(List<EvidenceItem> items, List<String> warnings) {
        public CollectionResult {
            items = List.copyOf(items);
            warnings = List.copyOf(warnings);
        }
    }

    private record Fetched(EvidenceItem item, String failure) {
    }

    private final Map<SourceKind, EvidenceSource> sources;
    private final ExecutorService executor;
    private final Duration fetchTimeout;

    /**
     * @param executor must start every task immediately; a queued task would spend its
     *                 timeout waiting for a thread
     */
    public EvidenceCollector(List<EvidenceSource> sources, ExecutorService executor, Duration fetchTimeout) {
        Map<SourceKind, EvidenceSource> byKind = new EnumMap<>(SourceKind.class);
        for (EvidenceSource source : sources) {
            byKind.put(source.kind(), source);
        }
        this.sources = byKind;
        this.executor = executor;
        this.fetchTimeout = fetchTimeout;
    }

    public CollectionResult collect(List<EvidenceReference> references) {
        List<Future<EvidenceItem>> futures = new ArrayList<>(references.size());
        List<Long> deadlines = new ArrayList<>(references.size());
        for (EvidenceReference reference : references) {
            EvidenceSource source = sources.get(reference.kind());
            futures.add(source == null ? null : executor.submit(() -> source.fetch(reference.identifier())));
            deadlines.add(System.nanoTime() + fetchTimeout.toNanos());
        }

        List<EvidenceItem> items = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (int i = 0; i < references.size(); i++) {
            Fetched fetched = await(futures.get(i), deadlines.get(i));
            if (fetched.item() != null) {
                items.add(fetched.item());
            } else {
                String warning = "evidence " + references.get(i) + " skipped: " + fetched.failure();
                log.warn("[Evidence] {}", warning);
                warnings.add(warning);
            }
        }

        log.info("[Evidence] Collected {}/{} item(s)", items.size(), references.size());
        return new CollectionResult(items, warnings);
    }

    private Fetched await(Future<EvidenceItem> future, long deadline) {
        if (future == null) {
            return new Fetched(null, "no evidence source configured");
        }
        try {
            long remaining = Math.max(0, deadline - System.nanoTime());
            return new Fetched(future.get(remaining, TimeUnit.NANOSECONDS), null);
        } catch (TimeoutException e) {
            future.cancel(true);
            return new Fetched(null, "timed out after " + fetchTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            return new Fetched(null, describe(e.getCause() == null ? e : e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new Fetched(null, "interrupted");
        }
    }

    private String describe(Throwable cause) {
        if (cause instanceof EvidenceUnavailableException) {
            return cause.getMessage();
        }
        log.error("[Evidence] Unexpected fetch failure", cause);
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }
}
