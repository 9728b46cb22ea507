package com.example.cvmatch.service;

import com.example.cvmatch.TestFixtures;
import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.config.MdcPropagatingExecutor;
import com.example.cvmatch.error.ExtractionException;
import com.example.cvmatch.error.PipelineTimeoutException;
import com.example.cvmatch.error.Stage;
import com.example.cvmatch.model.CandidateDocument;
import com.example.cvmatch.model.JobPosting;
import com.example.cvmatch.model.MatchAnalysis;
import com.example.cvmatch.model.MatchRequest;
import com.example.cvmatch.model.PairingOutcome;
import com.example.cvmatch.model.ScoringFactor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MatchingPipelineTest {

    private MdcPropagatingExecutor executor;
    private MatchHistoryService history;
    private RequirementExtractor extractor;
    private CandidateProfiler profiler;
    private MatchingPipeline pipeline;

    @BeforeEach
    void setUp() {
        MatchingProperties properties = TestFixtures.properties();
        executor = new MdcPropagatingExecutor(4, "test-match");
        history = new MatchHistoryService(TestFixtures.CLOCK, TestFixtures.properties());
        extractor = new RequirementExtractor(TestFixtures.DICTIONARY, properties, TestFixtures.noInference(), TestFixtures.CLOCK);
        profiler = new CandidateProfiler(TestFixtures.DICTIONARY, properties, TestFixtures.noInference(), TestFixtures.CLOCK);
        pipeline = new MatchingPipeline(extractor, profiler,
                new CompatibilityScorer(TestFixtures.DICTIONARY, properties),
                new AdvisoryGenerator(TestFixtures.DICTIONARY), history, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Nested
    @DisplayName("Single analysis")
    class SingleAnalysis {

        @Test
        @DisplayName("should return profiles and an advised report, and record it")
        void analyze() {
            // WHEN
            MatchAnalysis analysis = pipeline.analyze(JobPosting.of(TestFixtures.JOB_TEXT),
                    CandidateDocument.of(TestFixtures.CV_TEXT));

            // THEN
            assertThat(analysis.jobProfile().jobTitle()).isEqualTo("Senior Backend Engineer");
            assertThat(analysis.candidateProfile().skills()).isNotEmpty();
            assertThat(analysis.report().factorScore(ScoringFactor.SKILL_MATCH)).isEqualTo(80);
            assertThat(analysis.report().advice()).isNotNull();
            assertThat(analysis.report().advice().sectionAdvice()).containsKey("skills");
            assertThat(history.findRecent(1)).singleElement()
                    .satisfies(e -> {
                        assertThat(e.jobTitle()).isEqualTo("Senior Backend Engineer");
                        assertThat(e.overallScore()).isEqualTo(analysis.report().overallScore());
                    });
        }

        @Test
        @DisplayName("should surface the extraction error of the failing side unwrapped")
        void extractionFailure() {
            assertThatThrownBy(() -> pipeline.analyze(JobPosting.of(TestFixtures.JOB_TEXT), CandidateDocument.of(" ")))
                    .isInstanceOf(ExtractionException.class)
                    .extracting(e -> ((ExtractionException) e).getStage())
                    .isEqualTo(Stage.CANDIDATE_PROFILING);
            assertThat(history.findRecent(Integer.MAX_VALUE)).isEmpty();
        }

        @Test
        @DisplayName("should fail with a timeout when the analysis takes too long")
        void timeout() {
            // GIVEN
            RequirementExtractor slowExtractor = mock(RequirementExtractor.class);
            when(slowExtractor.extract(any())).thenAnswer(invocation -> {
                Thread.sleep(2_000);
                return extractor.extract(invocation.getArgument(0));
            });
            MatchingPipeline slowPipeline = new MatchingPipeline(slowExtractor, profiler,
                    new CompatibilityScorer(TestFixtures.DICTIONARY, TestFixtures.properties()),
                    new AdvisoryGenerator(TestFixtures.DICTIONARY), history, executor);

            // WHEN / THEN
            assertThatThrownBy(() -> slowPipeline.analyze(JobPosting.of(TestFixtures.JOB_TEXT),
                    CandidateDocument.of(TestFixtures.CV_TEXT), Duration.ofMillis(100)))
                    .isInstanceOf(PipelineTimeoutException.class)
                    .hasMessage("Analysis did not complete within 100 ms");
        }
    }

    @Nested
    @DisplayName("Batch analysis")
    class BatchAnalysis {

        @Test
        @DisplayName("should isolate a failing pair and keep request order")
        void failingPairIsolated() {
            // GIVEN
            List<MatchRequest> requests = List.of(
                    new MatchRequest("alpha", JobPosting.of(TestFixtures.JOB_TEXT), CandidateDocument.of(TestFixtures.CV_TEXT)),
                    new MatchRequest(null, JobPosting.of("Too short"), CandidateDocument.of(TestFixtures.CV_TEXT)),
                    new MatchRequest(" ", JobPosting.of(TestFixtures.JOB_TEXT), CandidateDocument.of(TestFixtures.CV_TEXT)));

            // WHEN
            List<PairingOutcome> outcomes = pipeline.analyzeBatch(requests);

            // THEN
            assertThat(outcomes).extracting(PairingOutcome::pairId).containsExactly("alpha", "pair-2", "pair-3");
            assertThat(outcomes.get(0).isSuccess()).isTrue();
            assertThat(outcomes.get(2).isSuccess()).isTrue();

            PairingOutcome.Failure failure = outcomes.get(1).failure();
            assertThat(failure.stage()).isEqualTo("REQUIREMENT_EXTRACTION");
            assertThat(failure.errorType()).isEqualTo("ExtractionException");
            assertThat(failure.message()).isEqualTo("Job posting has 2 tokens; at least 20 are required");
            assertThat(outcomes.get(1).analysis()).isNull();
            assertThat(history.findRecent(Integer.MAX_VALUE)).hasSize(2);
        }

        @Test
        @DisplayName("should return nothing for an empty batch")
        void emptyBatch() {
            assertThat(pipeline.analyzeBatch(List.of())).isEmpty();
        }
    }
}
