package com.example.cvmatch.inference;

import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.config.MdcPropagatingExecutor;
import com.example.cvmatch.error.InferenceCollaboratorException;
import com.example.cvmatch.inference.ResilientSkillInference.InferenceResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResilientSkillInferenceTest {

    @Mock
    private SkillInferenceClient client;

    private MatchingProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MatchingProperties();
        properties.getInference().setEnabled(true);
        properties.getInference().setMaxAttempts(3);
        properties.getInference().setInitialBackoff(Duration.ofMillis(1));
    }

    @Test
    @DisplayName("should not call the collaborator when inference is disabled")
    void disabled() {
        properties.getInference().setEnabled(false);
        ResilientSkillInference inference = new ResilientSkillInference(client, properties, Runnable::run);

        assertThat(inference.propose("text", InferenceKind.JOB_POSTING)).isEqualTo(InferenceResult.NONE);
        verifyNoInteractions(client);
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("should return the proposal of the first successful attempt")
        void firstAttempt() {
            when(client.proposeTerms("cv", InferenceKind.CANDIDATE_DOCUMENT)).thenReturn(Set.of("GraphQL"));
            ResilientSkillInference inference = new ResilientSkillInference(client, properties, Runnable::run);

            InferenceResult result = inference.propose("cv", InferenceKind.CANDIDATE_DOCUMENT);

            assertThat(result.terms()).containsExactly("GraphQL");
            assertThat(result.degraded()).isFalse();
        }

        @Test
        @DisplayName("should retry after a failure and succeed")
        void recovers() {
            // GIVEN
            when(client.proposeTerms(anyString(), eq(InferenceKind.JOB_POSTING)))
                    .thenThrow(new InferenceCollaboratorException("job posting", "rate limited"))
                    .thenReturn(Set.of("Terraform"));
            ResilientSkillInference inference = new ResilientSkillInference(client, properties, Runnable::run);

            // WHEN
            InferenceResult result = inference.propose("posting", InferenceKind.JOB_POSTING);

            // THEN
            assertThat(result.terms()).containsExactly("Terraform");
            assertThat(result.degraded()).isFalse();
            verify(client, times(2)).proposeTerms("posting", InferenceKind.JOB_POSTING);
        }

        @Test
        @DisplayName("should give up after the configured attempts and flag the result")
        void exhausted() {
            when(client.proposeTerms(anyString(), eq(InferenceKind.JOB_POSTING)))
                    .thenThrow(new IllegalStateException("boom"));
            ResilientSkillInference inference = new ResilientSkillInference(client, properties, Runnable::run);

            InferenceResult result = inference.propose("posting", InferenceKind.JOB_POSTING);

            assertThat(result.terms()).isEmpty();
            assertThat(result.degraded()).isTrue();
            verify(client, times(3)).proposeTerms("posting", InferenceKind.JOB_POSTING);
        }

        @Test
        @DisplayName("should treat a slow collaborator as failed")
        void timeout() throws Exception {
            // GIVEN
            properties.getInference().setMaxAttempts(1);
            properties.getInference().setTimeout(Duration.ofMillis(50));
            when(client.proposeTerms(anyString(), eq(InferenceKind.JOB_POSTING))).thenAnswer(invocation -> {
                Thread.sleep(1_000);
                return Set.of("Kubernetes");
            });
            MdcPropagatingExecutor executor = new MdcPropagatingExecutor(1, "test-inference");
            ResilientSkillInference inference = new ResilientSkillInference(client, properties, executor);

            try {
                // WHEN
                InferenceResult result = inference.propose("posting", InferenceKind.JOB_POSTING);

                // THEN
                assertThat(result.degraded()).isTrue();
                assertThat(result.terms()).isEmpty();
            } finally {
                executor.shutdown();
            }
        }
    }
}
