package com.example.cvmatch.service;

import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.error.ExtractionException;
import com.example.cvmatch.error.Stage;
import com.example.cvmatch.inference.InferenceKind;
import com.example.cvmatch.inference.ResilientSkillInference;
import com.example.cvmatch.model.ExperienceLevel;
import com.example.cvmatch.model.IndustryCategory;
import com.example.cvmatch.model.JobPosting;
import com.example.cvmatch.model.JobRequirementProfile;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.text.ExperienceLevelDetector;
import com.example.cvmatch.text.IndustryClassifier;
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
import java.util.regex.Pattern;

/**
 * Turns a job posting into a {@link JobRequirementProfile}. Skills under preferred headings, or
 * on a requirement line carrying a preferred marker, are preferred; every other skill found
 * under a requirement-like heading is required.
 */
@Service
public class RequirementExtractor {

    private static final Logger log = LoggerFactory.getLogger(RequirementExtractor.class);
    private static final String INPUT = "job posting";
    private static final int MAX_TITLE_TOKENS = 8;
    private static final Pattern DEGREE = Pattern.compile(
            "\\b(?:bachelor|master|ph\\.?d|doctorate|degree|diploma|b\\.?sc|m\\.?sc|mba)s?\\b",
            Pattern.CASE_INSENSITIVE);

    private final SkillDictionary dictionary;
    private final MatchingProperties properties;
    private final ResilientSkillInference inference;
    private final SkillMatcher skillMatcher;
    private final SectionSegmenter segmenter;
    private final ExperienceLevelDetector experienceDetector;
    private final KeyPhraseExtractor keyPhrases;
    private final IndustryClassifier industryClassifier;
    private final List<List<String>> preferredMarkers;

    public RequirementExtractor(SkillDictionary dictionary,
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
        this.industryClassifier = new IndustryClassifier(dictionary);
        this.preferredMarkers = properties.getPreferredMarkers().stream()
                .map(TextNormalizer::words)
                .filter(w -> !w.isEmpty())
                .toList();
    }

    public JobRequirementProfile extract(JobPosting posting) {
        String text = posting == null ? null : posting.text();
        validate(text);

        List<Section> sections = segmenter.segment(text);
        boolean hasRequirementHeading = sections.stream().anyMatch(s -> s.kind().isRequirementLike());

        List<Skill> required = new ArrayList<>();
        List<Skill> preferred = new ArrayList<>();
        Set<String> responsibilityKeys = new HashSet<>();
        List<String> responsibilities = new ArrayList<>();

        for (Section section : sections) {
            SectionKind kind = section.kind();
            if (kind == SectionKind.PREFERRED) {
                preferred.addAll(skillMatcher.match(section.body()));
                continue;
            }
            if (!hasRequirementHeading || kind.isRequirementLike()) {
                for (String fragment : SectionSegmenter.fragments(section.body())) {
                    List<Skill> found = skillMatcher.match(fragment);
                    if (hasPreferredMarker(fragment)) preferred.addAll(found);
                    else required.addAll(found);
                }
            }
            if (kind == SectionKind.RESPONSIBILITIES) {
                for (String item : SectionSegmenter.splitItems(section.body())) {
                    if (responsibilityKeys.add(TextNormalizer.normalize(item))) responsibilities.add(item);
                }
            }
        }

        ResilientSkillInference.InferenceResult inferred = inference.propose(text, InferenceKind.JOB_POSTING);
        List<Skill> inferredSkills = inferred.terms().stream()
                .sorted()
                .map(dictionary::resolve)
                .flatMap(Optional::stream)
                .toList();

        List<Skill> requiredSkills = SkillMatcher.unionOf(required, inferredSkills);
        Set<Skill> requiredSet = new HashSet<>(requiredSkills);
        List<Skill> preferredSkills = SkillMatcher.unionOf(preferred).stream()
                .filter(s -> !requiredSet.contains(s))
                .toList();

        String title = posting.title() != null && !posting.title().isBlank()
                ? posting.title().strip()
                : titleHint(sections);
        ExperienceLevel level = experienceDetector.forJob(title, text).level();
        List<String> keywords = keyPhrases.topPhrases(text,
                SkillMatcher.unionOf(requiredSkills, preferredSkills), properties.getIndustryKeywordLimit());
        List<String> culture = cultureSignals(text);
        IndustryCategory category = industryClassifier.classify((title == null ? "" : title + "\n") + text);

        JobRequirementProfile profile = new JobRequirementProfile(
                title,
                posting.company(),
                requiredSkills,
                preferredSkills,
                level,
                educationRequirement(sections, hasRequirementHeading),
                responsibilities,
                keywords,
                culture,
                category,
                inferred.degraded());
        log.debug("Extracted job profile title={} required={} preferred={} level={} category={}",
                title, requiredSkills.size(), preferredSkills.size(), level, category);
        return profile;
    }

    private void validate(String text) {
        if (text == null || text.isBlank()) {
            throw new ExtractionException(Stage.REQUIREMENT_EXTRACTION, INPUT, "Job posting text is empty");
        }
        int tokens = TextNormalizer.countTokens(text);
        if (tokens < properties.getMinTokens()) {
            throw new ExtractionException(Stage.REQUIREMENT_EXTRACTION, INPUT,
                    "Job posting has " + tokens + " tokens; at least " + properties.getMinTokens() + " are required");
        }
    }

    private boolean hasPreferredMarker(String fragment) {
        List<String> words = TextNormalizer.words(fragment);
        return preferredMarkers.stream().anyMatch(marker -> TextNormalizer.containsPhrase(words, marker));
    }

    private List<String> cultureSignals(String text) {
        List<String> words = TextNormalizer.words(text);
        List<String> found = new ArrayList<>();
        dictionary.cultureSignals().forEach((signal, phrase) -> {
            if (TextNormalizer.containsPhrase(words, phrase)) found.add(signal);
        });
        return found;
    }

    /** First degree line of the education or requirement sections. */
    private static String educationRequirement(List<Section> sections, boolean hasRequirementHeading) {
        for (Section section : sections) {
            SectionKind kind = section.kind();
            boolean relevant = kind == SectionKind.EDUCATION || kind.isRequirementLike()
                    || (!hasRequirementHeading && kind != SectionKind.PREFERRED);
            if (!relevant) continue;
            for (String item : SectionSegmenter.splitItems(section.body())) {
                if (DEGREE.matcher(item).find()) return item.strip();
            }
        }
        return null;
    }

    /** A short first line before any heading that is not a sentence is taken as the job title. */
    private static String titleHint(List<Section> sections) {
        if (sections.isEmpty() || sections.get(0).kind() != SectionKind.PREAMBLE) return null;
        String first = sections.get(0).body().lines().findFirst().orElse("").strip();
        int tokens = TextNormalizer.countTokens(first);
        if (tokens == 0 || tokens > MAX_TITLE_TOKENS) return null;
        if (first.endsWith(".") || first.endsWith(":")) return null;
        return first;
    }
}
