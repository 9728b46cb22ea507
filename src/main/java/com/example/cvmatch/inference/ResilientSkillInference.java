package com.example.cvmatch.inference;

import com.example.cvmatch.config.MatchingProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the {@link SkillInferenceClient} with a per-attempt timeout and exponential backoff.
 * When every attempt fails the result is empty and flagged as degraded; no exception escapes.
 */
public class ResilientSkillInference {

    private static final Logger log = LoggerFactory.getLogger(ResilientSkillInference.class);

    public record InferenceResult(Set<String> terms, boolean degraded) {
        public static final InferenceResult NONE = new InferenceResult(Set.of(), false);

        public InferenceResult {
            terms = Set.copyOf(terms);
        }
    }

    private final SkillInferenceClient client;
    private final MatchingProperties.Inference settings;
    private final Executor executor;

    public ResilientSkillInference(SkillInferenceClient client, MatchingProperties properties, Executor executor) {
        this.client = client;
        this.settings = properties.getInference();
        this.executor = executor;
    }

    public InferenceResult propose(String text, InferenceKind kind) {
        if (!settings.isEnabled()) return InferenceResult.NONE;

        int maxAttempts = Math.max(1, settings.getMaxAttempts());
        Duration backoff = settings.getInitialBackoff();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Set<String> terms = callOnce(text, kind);
                return new InferenceResult(terms == null ? Set.of() : new LinkedHashSet<>(terms), false);
            } catch (TimeoutException e) {
                log.warn("Inference attempt {}/{} for {} timed out after {} ms",
                        attempt, maxAttempts, kind, settings.getTimeout().toMillis());
            } catch (ExecutionException e) {
                log.warn("Inference attempt {}/{} for {} failed: {}",
                        attempt, maxAttempts, kind, e.getCause() == null ? e.toString() : e.getCause().toString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Inference for {} interrupted; continuing without it", kind);
                return new InferenceResult(Set.of(), true);
            }
            if (attempt < maxAttempts && !sleep(backoff)) {
                return new InferenceResult(Set.of(), true);
            }
            backoff = backoff.multipliedBy(2);
        }
        log.warn("Inference for {} unavailable after {} attempts; profile built from dictionary matches only",
                kind, maxAttempts);
        return new InferenceResult(Set.of(), true);
    }

    private Set<String> callOnce(String text, InferenceKind kind)
            throws InterruptedException, ExecutionException, TimeoutException {
        CompletableFuture<Set<String>> call = CompletableFuture.supplyAsync(() -> client.proposeTerms(text, kind), executor);
        try {
            return call.get(settings.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } finally {
            call.cancel(true);
        }
    }

    private static boolean sleep(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
