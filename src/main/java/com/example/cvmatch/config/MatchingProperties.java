package com.example.cvmatch.config;

import com.example.cvmatch.model.ScoringFactor;
import com.example.cvmatch.text.SectionKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Engine settings bound from the {@code matching} prefix. Defaults mirror
 * {@code application.yml} so the engine also works when built by hand in tests.
 */
@ConfigurationProperties(prefix = "matching")
public class MatchingProperties {

    /** Minimum token count for a job posting or candidate document. */
    private int minTokens = 20;

    /** Number of noun phrases kept as industry keywords. */
    private int industryKeywordLimit = 15;

    /** Worker pool size; 0 or less means one thread per available processor. */
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    private String dictionaryLocation = "classpath:skill-dictionary.json";

    /** Match history entries kept in memory; the oldest are dropped beyond this. */
    private int historyLimit = 500;

    private Weights weights = new Weights();

    private Inference inference = new Inference();

    private List<String> preferredMarkers = new ArrayList<>(List.of(
            "nice to have", "a plus", "preferred", "bonus", "desirable"));

    private Map<SectionKind, List<String>> sectionHeaders = defaultSectionHeaders();

    public static class Weights {
        private double skillMatch = 0.40;
        private double experienceAlignment = 0.25;
        private double keywordCoverage = 0.20;
        private double responsibilityAlignment = 0.15;

        public double weightOf(ScoringFactor factor) {
            return switch (factor) {
                case SKILL_MATCH              -> skillMatch;
                case EXPERIENCE_ALIGNMENT     -> experienceAlignment;
                case KEYWORD_COVERAGE         -> keywordCoverage;
                case RESPONSIBILITY_ALIGNMENT -> responsibilityAlignment;
            };
        }

        public double getSkillMatch() { return skillMatch; }
        public void setSkillMatch(double skillMatch) { this.skillMatch = skillMatch; }
        public double getExperienceAlignment() { return experienceAlignment; }
        public void setExperienceAlignment(double experienceAlignment) { this.experienceAlignment = experienceAlignment; }
        public double getKeywordCoverage() { return keywordCoverage; }
        public void setKeywordCoverage(double keywordCoverage) { this.keywordCoverage = keywordCoverage; }
        public double getResponsibilityAlignment() { return responsibilityAlignment; }
        public void setResponsibilityAlignment(double responsibilityAlignment) { this.responsibilityAlignment = responsibilityAlignment; }
    }

    public static class Inference {
        private boolean enabled = false;
        private int maxAttempts = 2;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration timeout = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    private static Map<SectionKind, List<String>> defaultSectionHeaders() {
        Map<SectionKind, List<String>> m = new EnumMap<>(SectionKind.class);
        m.put(SectionKind.REQUIREMENTS, new ArrayList<>(List.of(
                "requirements", "qualifications", "required qualifications", "minimum qualifications",
                "about you", "what you bring", "what we are looking for", "must have", "skills")));
        m.put(SectionKind.PREFERRED, new ArrayList<>(List.of(
                "nice to have", "preferred qualifications", "preferred", "bonus points", "good to have")));
        m.put(SectionKind.RESPONSIBILITIES, new ArrayList<>(List.of(
                "responsibilities", "key responsibilities", "what you will do", "your role", "duties")));
        m.put(SectionKind.EXPERIENCE, new ArrayList<>(List.of(
                "experience", "work experience", "professional experience", "work history",
                "employment", "employment history")));
        m.put(SectionKind.EDUCATION, new ArrayList<>(List.of("education", "certifications")));
        m.put(SectionKind.SUMMARY, new ArrayList<>(List.of(
                "summary", "profile", "objective", "about the company", "about us")));
        m.put(SectionKind.OTHER, new ArrayList<>(List.of("benefits", "what we offer", "projects", "languages")));
        return m;
    }

    public int getMinTokens() { return minTokens; }
    public void setMinTokens(int minTokens) { this.minTokens = minTokens; }

    public int getIndustryKeywordLimit() { return industryKeywordLimit; }
    public void setIndustryKeywordLimit(int industryKeywordLimit) { this.industryKeywordLimit = industryKeywordLimit; }

    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

    public String getDictionaryLocation() { return dictionaryLocation; }
    public void setDictionaryLocation(String dictionaryLocation) { this.dictionaryLocation = dictionaryLocation; }

    public int getHistoryLimit() { return historyLimit; }
    public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }

    public Weights getWeights() { return weights; }
    public void setWeights(Weights weights) { this.weights = weights; }

    public Inference getInference() { return inference; }
    public void setInference(Inference inference) { this.inference = inference; }

    public List<String> getPreferredMarkers() { return preferredMarkers; }
    public void setPreferredMarkers(List<String> preferredMarkers) { this.preferredMarkers = preferredMarkers; }

    public Map<SectionKind, List<String>> getSectionHeaders() { return sectionHeaders; }
    public void setSectionHeaders(Map<SectionKind, List<String>> sectionHeaders) { this.sectionHeaders = sectionHeaders; }
}
