package com.example.cvmatch.inference;

import java.util.Set;

/**
 * Optional collaborator that proposes additional skill terms for a document, typically backed
 * by a hosted language model. Proposals are merged with dictionary matches and never trusted
 * on their own.
 *
 * <p>Implementations signal failure by throwing
 * {@link com.example.cvmatch.error.InferenceCollaboratorException}; any other runtime
 * exception is treated the same way.
 */
public interface SkillInferenceClient {

    Set<String> proposeTerms(String text, InferenceKind kind);
}
