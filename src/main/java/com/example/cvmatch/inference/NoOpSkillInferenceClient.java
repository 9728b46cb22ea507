package com.example.cvmatch.inference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/** Default collaborator: proposes nothing, so profiles come from dictionary matching alone. */
public class NoOpSkillInferenceClient implements SkillInferenceClient {

    private static final Logger log = LoggerFactory.getLogger(NoOpSkillInferenceClient.class);

    public NoOpSkillInferenceClient() {
        log.info("Skill inference is disabled; using dictionary matching only");
    }

    @Override
    public Set<String> proposeTerms(String text, InferenceKind kind) {
        return Set.of();
    }
}
