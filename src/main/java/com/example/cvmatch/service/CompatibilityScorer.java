package com.example.cvmatch.service;

import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.error.ScoringException;
import com.example.cvmatch.model.CandidateProfile;
import com.example.cvmatch.model.CompatibilityReport;
import com.example.cvmatch.model.ExperienceLevel;
import com.example.cvmatch.model.JobRequirementProfile;
import com.example.cvmatch.model.MatchVerdict;
import com.example.cvmatch.model.ResponsibilityMatch;
import com.example.cvmatch.model.ScoringFactor;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.text.SkillDictionary;
import com.example.cvmatch.text.TokenSimilarity;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Scores a candidate against a job on four weighted factors. Pure and deterministic: the same
 * pair always yields an equal report.
 */
@Service
public class CompatibilityScorer {

    private static final int MAX_PREFERRED_BONUS = 10;

    private final MatchingProperties.Weights weights;
    private final TokenSimilarity similarity;

    public CompatibilityScorer(SkillDictionary dictionary, MatchingProperties properties) {
        this.weights = properties.getWeights();
        this.similarity = new TokenSimilarity(dictionary);
    }

    public CompatibilityReport score(JobRequirementProfile job, CandidateProfile candidate) {
        validate(job, candidate);

        Set<Skill> held = new HashSet<>(candidate.skills());

        List<Skill> matched = new ArrayList<>();
        List<Skill> missingRequired = new ArrayList<>();
        List<Skill> missingPreferred = new ArrayList<>();
        for (Skill s : job.requiredSkills()) {
            (held.contains(s) ? matched : missingRequired).add(s);
        }
        for (Skill s : job.preferredSkills()) {
            (held.contains(s) ? matched : missingPreferred).add(s);
        }
        sortByNameLengthDesc(missingRequired);
        sortByNameLengthDesc(missingPreferred);

        int requiredHits = job.requiredSkills().size() - missingRequired.size();
        int preferredHits = job.preferredSkills().size() - missingPreferred.size();
        double skillMatch = 100.0 * requiredHits / Math.max(1, job.requiredSkills().size());
        if (!job.preferredSkills().isEmpty()) {
            skillMatch += (double) MAX_PREFERRED_BONUS * preferredHits / job.preferredSkills().size();
        }

        List<String> missingKeywords = job.industryKeywords().stream()
                .filter(k -> !candidate.textTerms().contains(k))
                .toList();
        int keywordHits = job.industryKeywords().size() - missingKeywords.size();
        double keywordCoverage = 100.0 * keywordHits / Math.max(1, job.industryKeywords().size());

        List<ResponsibilityMatch> responsibilityMatches = matchResponsibilities(job, candidate);
        double responsibilityAlignment = responsibilityMatches.stream()
                .mapToDouble(ResponsibilityMatch::overlap)
                .average()
                .orElse(0.0) * 100.0;

        Map<String, Integer> factors = new LinkedHashMap<>();
        factors.put(ScoringFactor.SKILL_MATCH.key(), clamp(Math.round(skillMatch)));
        factors.put(ScoringFactor.EXPERIENCE_ALIGNMENT.key(),
                experienceAlignment(job.experienceLevel(), candidate.experienceLevel()));
        factors.put(ScoringFactor.KEYWORD_COVERAGE.key(), clamp(Math.round(keywordCoverage)));
        factors.put(ScoringFactor.RESPONSIBILITY_ALIGNMENT.key(), clamp(Math.round(responsibilityAlignment)));

        double weighted = 0.0;
        for (ScoringFactor factor : ScoringFactor.values()) {
            weighted += weights.weightOf(factor) * factors.get(factor.key());
        }
        int overall = clamp(Math.round(weighted));

        return new CompatibilityReport(
                overall,
                factors,
                matched,
                missingRequired,
                missingPreferred,
                missingKeywords,
                responsibilityMatches,
                MatchVerdict.forScore(overall),
                null);
    }

    /** 100 when equal or either side unknown, 70 one band apart, 40 two bands apart. */
    static int experienceAlignment(ExperienceLevel required, ExperienceLevel actual) {
        if (!required.isSpecified() || !actual.isSpecified()) return 100;
        return switch (Math.abs(required.band() - actual.band())) {
            case 0  -> 100;
            case 1  -> 70;
            default -> 40;
        };
    }

    private List<ResponsibilityMatch> matchResponsibilities(JobRequirementProfile job, CandidateProfile candidate) {
        List<Set<String>> bulletTokens = candidate.experienceBullets().stream()
                .map(similarity::contentTokens)
                .toList();
        List<ResponsibilityMatch> out = new ArrayList<>();
        for (String duty : job.responsibilities()) {
            Set<String> dutyTokens = similarity.contentTokens(duty);
            String bestBullet = null;
            double best = 0.0;
            for (int i = 0; i < bulletTokens.size(); i++) {
                double overlap = TokenSimilarity.jaccard(dutyTokens, bulletTokens.get(i));
                if (bestBullet == null || overlap > best) {
                    best = overlap;
                    bestBullet = candidate.experienceBullets().get(i);
                }
            }
            out.add(new ResponsibilityMatch(duty, bestBullet, best));
        }
        return out;
    }

    // List.sort is stable, so extraction order survives among equal lengths
    private static void sortByNameLengthDesc(List<Skill> skills) {
        skills.sort(Comparator.comparingInt((Skill s) -> s.name().length()).reversed());
    }

    private static int clamp(long value) {
        return (int) Math.max(0, Math.min(100, value));
    }

    private static void validate(JobRequirementProfile job, CandidateProfile candidate) {
        if (job == null) throw new ScoringException("job profile", "Job profile is null");
        if (candidate == null) throw new ScoringException("candidate profile", "Candidate profile is null");
        if (job.requiredSkills() == null || job.preferredSkills() == null || job.responsibilities() == null
                || job.industryKeywords() == null || job.experienceLevel() == null) {
            throw new ScoringException("job profile", "Job profile is missing required collections");
        }
        if (candidate.skills() == null || candidate.experienceBullets() == null
                || candidate.textTerms() == null || candidate.experienceLevel() == null) {
            throw new ScoringException("candidate profile", "Candidate profile is missing required collections");
        }
        Set<Skill> required = new HashSet<>(job.requiredSkills());
        for (Skill s : job.preferredSkills()) {
            if (required.contains(s)) {
                throw new ScoringException("job profile",
                        "Skill '" + s.name() + "' is listed as both required and preferred");
            }
        }
    }
}
