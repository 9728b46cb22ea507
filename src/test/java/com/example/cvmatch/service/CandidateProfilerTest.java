package com.example.cvmatch.service;

import com.example.cvmatch.TestFixtures;
import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.error.ExtractionException;
import com.example.cvmatch.error.InferenceCollaboratorException;
import com.example.cvmatch.error.Stage;
import com.example.cvmatch.inference.InferenceKind;
import com.example.cvmatch.inference.ResilientSkillInference;
import com.example.cvmatch.inference.SkillInferenceClient;
import com.example.cvmatch.model.CandidateDocument;
import com.example.cvmatch.model.CandidateProfile;
import com.example.cvmatch.model.ExperienceLevel;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.model.SkillCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateProfilerTest {

    private final CandidateProfiler profiler = new CandidateProfiler(
            TestFixtures.DICTIONARY, TestFixtures.properties(), TestFixtures.noInference(), TestFixtures.CLOCK);

    @Mock
    private SkillInferenceClient inferenceClient;

    @Nested
    @DisplayName("Profiling a CV")
    class ProfilingCv {

        private final CandidateProfile profile = profiler.profile(CandidateDocument.of(TestFixtures.CV_TEXT));

        @Test
        @DisplayName("should collect dictionary skills in first-mention order")
        void skills() {
            assertThat(profile.skills()).extracting(Skill::name)
                    .containsExactly("Python", "Microservices", "Docker", "PostgreSQL", "SQL", "Git", "Agile");
        }

        @Test
        @DisplayName("should estimate seniority from employment dates")
        void seniority() {
            assertThat(profile.estimatedYears()).isEqualTo(9);
            assertThat(profile.experienceLevel()).isEqualTo(ExperienceLevel.SENIOR);
        }

        @Test
        @DisplayName("should take bullets from the experience section only")
        void bullets() {
            assertThat(profile.experienceBullets())
                    .hasSize(6)
                    .contains("Led a team of 5 engineers on a release of the payment processing pipeline")
                    .noneMatch(b -> b.startsWith("BSc"));
            assertThat(profile.textTerms()).contains("payment processing", "reliability");
        }
    }

    @Test
    @DisplayName("should merge pre-extracted skills, keeping unknown ones as uncategorized")
    void preExtractedSkills() {
        CandidateProfile profile = profiler.profile(
                new CandidateDocument(TestFixtures.CV_TEXT, List.of("k8s", "Rust Embedded", "python")));

        assertThat(profile.skills()).extracting(Skill::name)
                .containsExactly("Python", "Microservices", "Docker", "PostgreSQL", "SQL", "Git", "Agile",
                        "Kubernetes", "Rust Embedded");
        assertThat(profile.skills().get(8).category()).isEqualTo(SkillCategory.UNCATEGORIZED);
        assertThat(profile.skills().get(0).surfaceForms()).contains("Python", "python");
    }

    @Test
    @DisplayName("should fall back to the whole document when there is no experience heading")
    void noExperienceHeading() {
        CandidateProfile profile = profiler.profile(CandidateDocument.of(
                "Backend developer who built payment services in Java. Led a small team through two "
                        + "platform migrations. Wrote the deployment tooling for the data team."));

        assertThat(profile.experienceBullets()).containsExactly(
                "Backend developer who built payment services in Java",
                "Led a small team through two platform migrations",
                "Wrote the deployment tooling for the data team");
        assertThat(profile.experienceLevel()).isEqualTo(ExperienceLevel.UNSPECIFIED);
        assertThat(profile.estimatedYears()).isNull();
    }

    @Test
    @DisplayName("should not count education date ranges as employment")
    void educationRangeIgnored() {
        // GIVEN
        String cv = """
                Sam Lee

                Experience
                Junior Developer, Initech (2025 - present)
                - Wrote integration tests for the billing service in Java

                Education
                BSc Computer Science, University of Leeds, 2016 - 2020
                - Final year project on distributed caching and message queues
                """;

        // WHEN
        CandidateProfile profile = profiler.profile(CandidateDocument.of(cv));

        // THEN
        assertThat(profile.estimatedYears()).isEqualTo(1);
        assertThat(profile.experienceLevel()).isEqualTo(ExperienceLevel.ENTRY);
    }

    @Test
    @DisplayName("should reject an empty document")
    void emptyDocument() {
        assertThatThrownBy(() -> profiler.profile(CandidateDocument.of("")))
                .isInstanceOf(ExtractionException.class)
                .hasMessage("Candidate document text is empty")
                .extracting(e -> ((ExtractionException) e).getStage())
                .isEqualTo(Stage.CANDIDATE_PROFILING);
    }

    @Test
    @DisplayName("should still build a profile, flagged as degraded, when inference keeps failing")
    void degradedInference() {
        // GIVEN
        when(inferenceClient.proposeTerms(anyString(), eq(InferenceKind.CANDIDATE_DOCUMENT)))
                .thenThrow(new InferenceCollaboratorException("candidate document", "model unavailable"));
        MatchingProperties properties = TestFixtures.properties();
        properties.getInference().setEnabled(true);
        properties.getInference().setInitialBackoff(Duration.ofMillis(1));
        CandidateProfiler withInference = new CandidateProfiler(TestFixtures.DICTIONARY, properties,
                new ResilientSkillInference(inferenceClient, properties, Runnable::run), TestFixtures.CLOCK);

        // WHEN
        CandidateProfile profile = withInference.profile(CandidateDocument.of(TestFixtures.CV_TEXT));

        // THEN
        assertThat(profile.inferenceDegraded()).isTrue();
        assertThat(profile.skills()).extracting(Skill::name).contains("Python", "Docker");
        verify(inferenceClient, times(2)).proposeTerms(anyString(), eq(InferenceKind.CANDIDATE_DOCUMENT));
    }
}
