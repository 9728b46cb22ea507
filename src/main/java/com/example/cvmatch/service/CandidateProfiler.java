package com.example.cvmatch.service;

import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.error.ExtractionException;
import com.example.cvmatch.error.Stage;
import com.example.cvmatch.inference.InferenceKind;
import com.example.cvmatch.inference.ResilientSkillInference;
import com.example.cvmatch.model.CandidateDocument;
import com.example.cvmatch.model.CandidateProfile;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.text.ExperienceLevelDetector;
import com.example.cvmatch.text.KeyPhraseExtractor;
import com.example.cvmatch.text.Section;
import com.example.cvmatch.text.SectionKind;
import com.example.cvmatch.text.SectionSegmenter;
import com.example.cvmatch.text.SkillDictionary;
import com.example.cvmatch.text.SkillMatcher;
import com.example.cvmatch.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;

@Service
public class CandidateProfiler {

    private static final Logger log = LoggerFactory.getLogger(CandidateProfiler.class);
    private static final String INPUT = "candidate document";

    private final SkillDictionary dictionary;
    private final MatchingProperties properties;
    private final ResilientSkillInference inference;
    private final SkillMatcher skillMatcher;
    private final SectionSegmenter segmenter;
    private final ExperienceLevelDetector experienceDetector;
    private final KeyPhraseExtractor keyPhrases;

    public CandidateProfiler(SkillDictionary dictionary,
                             MatchingProperties properties,
                             ResilientSkillInference inference,
                             Clock clock) {
        this.dictionary = dictionary;
        this.properties = properties;
        this.inference = inference;
        this.skillMatcher = new SkillMatcher(dictionary);
        this.segmenter = new SectionSegmenter(properties);
        this.experienceDetector = new ExperienceLevelDetector(dictionary, clock);
        this.keyPhrases = new KeyPhraseExtractor(dictionary);
    }

    public CandidateProfile profile(CandidateDocument document) {
        String text = document == null ? null : document.text();
        validate(text);

        List<Skill> matched = skillMatcher.match(text);
        List<Skill> supplied = document.preExtractedSkills().stream()
                .map(dictionary::resolve)
                .flatMap(Optional::stream)
                .toList();

        ResilientSkillInference.InferenceResult inferred = inference.propose(text, InferenceKind.CANDIDATE_DOCUMENT);
        List<Skill> inferredSkills = inferred.terms().stream()
                .sorted()
                .map(dictionary::resolve)
                .flatMap(Optional::stream)
                .toList();

        List<Skill> skills = SkillMatcher.unionOf(matched, supplied, inferredSkills);
        List<Section> employment = experienceSections(text);
        String employmentText = employment.isEmpty() ? text
                : String.join("\n", employment.stream().map(Section::body).toList());
        ExperienceLevelDetector.ExperienceEstimate experience = experienceDetector.forCandidate(text, employmentText);

        CandidateProfile profile = new CandidateProfile(
                skills,
                experience.level(),
                experience.years(),
                experienceBullets(text, employment),
                keyPhrases.terms(text),
                inferred.degraded());
        log.debug("Profiled candidate skills={} level={} years={} bullets={}",
                skills.size(), experience.level(), experience.years(), profile.experienceBullets().size());
        return profile;
    }

    private void validate(String text) {
        if (text == null || text.isBlank()) {
            throw new ExtractionException(Stage.CANDIDATE_PROFILING, INPUT, "Candidate document text is empty");
        }
        int tokens = TextNormalizer.countTokens(text);
        if (tokens < properties.getMinTokens()) {
            throw new ExtractionException(Stage.CANDIDATE_PROFILING, INPUT,
                    "Candidate document has " + tokens + " tokens; at least " + properties.getMinTokens() + " are required");
        }
    }

    private List<Section> experienceSections(String text) {
        return segmenter.segment(text).stream()
                .filter(s -> s.kind() == SectionKind.EXPERIENCE)
                .toList();
    }

    /** Items of the experience sections; the whole document when the CV has none. */
    private List<String> experienceBullets(String text, List<Section> experience) {
        if (experience.isEmpty()) return SectionSegmenter.splitItems(text);

        Set<String> seen = new HashSet<>();
        List<String> bullets = new ArrayList<>();
        for (Section section : experience) {
            for (String item : SectionSegmenter.splitItems(section.body())) {
                if (seen.add(TextNormalizer.normalize(item))) bullets.add(item);
            }
        }
        return bullets;
    }
}
