package com.example.cvmatch.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of scoring one (job, candidate) pair. Never mutated: {@link #withAdvice} returns a
 * copy carrying the advisory output.
 */
public record CompatibilityReport(
        int overallScore,
        Map<String, Integer> factorScores,
        List<Skill> matchedSkills,
        List<Skill> missingRequiredSkills,
        List<Skill> missingPreferredSkills,
        List<String> missingKeywords,
        List<ResponsibilityMatch> responsibilityMatches,
        MatchVerdict verdict,
        @JsonInclude(JsonInclude.Include.NON_NULL) OptimizationAdvice advice
) {
    public CompatibilityReport {
        factorScores           = Collections.unmodifiableMap(new LinkedHashMap<>(factorScores));
        matchedSkills          = List.copyOf(matchedSkills);
        missingRequiredSkills  = List.copyOf(missingRequiredSkills);
        missingPreferredSkills = List.copyOf(missingPreferredSkills);
        missingKeywords        = List.copyOf(missingKeywords);
        responsibilityMatches  = List.copyOf(responsibilityMatches);
    }

    public int factorScore(ScoringFactor factor) {
        return factorScores.getOrDefault(factor.key(), 0);
    }

    public CompatibilityReport withAdvice(OptimizationAdvice optimizationAdvice) {
        return new CompatibilityReport(overallScore, factorScores, matchedSkills,
                missingRequiredSkills, missingPreferredSkills, missingKeywords,
                responsibilityMatches, verdict, optimizationAdvice);
    }
}
