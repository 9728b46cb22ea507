package com.example.cvmatch.service;

import com.example.cvmatch.error.MatchingEngineException;
import com.example.cvmatch.error.PipelineTimeoutException;
import com.example.cvmatch.error.Stage;
import com.example.cvmatch.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs extraction and profiling, then scoring, then advice. A single analysis extracts both
 * documents concurrently; a batch runs pairs concurrently and each pair sequentially, so the
 * shared worker pool never waits on itself.
 */
@Service
public class MatchingPipeline {

    private static final Logger log = LoggerFactory.getLogger(MatchingPipeline.class);
    static final String PAIR_ID = "pairId";

    private final RequirementExtractor extractor;
    private final CandidateProfiler profiler;
    private final CompatibilityScorer scorer;
    private final AdvisoryGenerator advisor;
    private final MatchHistoryService history;
    private final Executor executor;

    public MatchingPipeline(RequirementExtractor extractor,
                            CandidateProfiler profiler,
                            CompatibilityScorer scorer,
                            AdvisoryGenerator advisor,
                            MatchHistoryService history,
                            @Qualifier("matchingExecutor") Executor executor) {
        this.extractor = extractor;
        this.profiler = profiler;
        this.scorer = scorer;
        this.advisor = advisor;
        this.history = history;
        this.executor = executor;
    }

    public MatchAnalysis analyze(JobPosting job, CandidateDocument candidate) {
        try (MDC.MDCCloseable ignored = pairScope()) {
            try {
                return start(job, candidate).join();
            } catch (CompletionException e) {
                throw unwrap(e);
            }
        }
    }

    /** Fails with {@link PipelineTimeoutException} when the analysis outlives {@code timeout}. */
    public MatchAnalysis analyze(JobPosting job, CandidateDocument candidate, Duration timeout) {
        try (MDC.MDCCloseable ignored = pairScope()) {
            CompletableFuture<MatchAnalysis> analysis = start(job, candidate);
            try {
                return analysis.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                analysis.cancel(true);
                log.warn("Analysis exceeded {} ms", timeout.toMillis());
                throw new PipelineTimeoutException("job/candidate pair", timeout);
            } catch (ExecutionException e) {
                throw unwrap(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MatchingEngineException(Stage.PIPELINE, "job/candidate pair", "Analysis interrupted", e);
            }
        }
    }

    /** One outcome per request, in request order. A failing pair never aborts the others. */
    public List<PairingOutcome> analyzeBatch(List<MatchRequest> requests) {
        List<CompletableFuture<PairingOutcome>> futures = new ArrayList<>();
        for (int i = 0; i < requests.size(); i++) {
            MatchRequest request = requests.get(i);
            String pairId = request.pairId() == null || request.pairId().isBlank()
                    ? "pair-" + (i + 1)
                    : request.pairId();
            futures.add(CompletableFuture.supplyAsync(() -> runPair(pairId, request), executor));
        }
        List<PairingOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();
        long failed = outcomes.stream().filter(o -> !o.isSuccess()).count();
        log.info("Batch of {} pairs completed: {} succeeded, {} failed", outcomes.size(), outcomes.size() - failed, failed);
        return outcomes;
    }

    private PairingOutcome runPair(String pairId, MatchRequest request) {
        MDC.put(PAIR_ID, pairId);
        try {
            JobRequirementProfile jobProfile = extractor.extract(request.job());
            CandidateProfile candidateProfile = profiler.profile(request.candidate());
            return PairingOutcome.success(pairId, scoreAndAdvise(jobProfile, candidateProfile));
        } catch (MatchingEngineException e) {
            log.warn("Pair {} failed at {}: {}", pairId, e.getStage(), e.getMessage());
            return PairingOutcome.failed(pairId, e.getStage().name(), e.getClass().getSimpleName(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Pair {} failed unexpectedly: {}", pairId, e.toString());
            return PairingOutcome.failed(pairId, Stage.PIPELINE.name(), e.getClass().getSimpleName(), e.getMessage());
        } finally {
            MDC.remove(PAIR_ID);
        }
    }

    private CompletableFuture<MatchAnalysis> start(JobPosting job, CandidateDocument candidate) {
        CompletableFuture<JobRequirementProfile> jobProfile =
                CompletableFuture.supplyAsync(() -> extractor.extract(job), executor);
        CompletableFuture<CandidateProfile> candidateProfile =
                CompletableFuture.supplyAsync(() -> profiler.profile(candidate), executor);
        return jobProfile.thenCombine(candidateProfile, this::scoreAndAdvise);
    }

    MatchAnalysis scoreAndAdvise(JobRequirementProfile jobProfile, CandidateProfile candidateProfile) {
        CompatibilityReport report = scorer.score(jobProfile, candidateProfile);
        OptimizationAdvice advice = advisor.advise(report, jobProfile, candidateProfile);
        CompatibilityReport advised = report.withAdvice(advice);
        history.record(jobProfile.jobTitle(), advised);
        log.info("Analysis completed title={} score={} verdict={}",
                jobProfile.jobTitle(), advised.overallScore(), advised.verdict());
        return new MatchAnalysis(jobProfile, candidateProfile, advised);
    }

    /** Assigns a fresh pair id unless the caller's MDC already carries one; null means nothing to close. */
    private static MDC.MDCCloseable pairScope() {
        if (MDC.get(PAIR_ID) != null) return null;
        return MDC.putCloseable(PAIR_ID, UUID.randomUUID().toString().substring(0, 8));
    }

    private static MatchingEngineException unwrap(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof MatchingEngineException engine) return engine;
        if (cause instanceof CancellationException) {
            return new MatchingEngineException(Stage.PIPELINE, "job/candidate pair", "Analysis was cancelled", cause);
        }
        return new MatchingEngineException(Stage.PIPELINE, "job/candidate pair",
                "Analysis failed: " + cause.getMessage(), cause);
    }
}
