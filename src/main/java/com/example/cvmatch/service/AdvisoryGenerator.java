package com.example.cvmatch.service;

import com.example.cvmatch.model.CandidateProfile;
import com.example.cvmatch.model.CompatibilityReport;
import com.example.cvmatch.model.CvSection;
import com.example.cvmatch.model.IndustryCategory;
import com.example.cvmatch.model.JobRequirementProfile;
import com.example.cvmatch.model.OptimizationAdvice;
import com.example.cvmatch.model.Priority;
import com.example.cvmatch.model.ResponsibilityMatch;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.model.SkillRecommendation;
import com.example.cvmatch.text.SkillDictionary;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Template-driven CV rewrite guidance. Output depends only on its inputs and the dictionary,
 * so the same report always produces the same advice.
 */
@Service
public class AdvisoryGenerator {

    static final String REQUIRED_RATIONALE = "required by the target role but absent from the candidate profile";
    static final String PREFERRED_RATIONALE = "preferred by the target role but absent from the candidate profile";

    static final List<String> ATS_TIPS = List.of(
            "Use exact keyword matches from the job description",
            "Include keywords in multiple sections (summary, experience, skills)",
            "Use both acronyms and full forms (e.g., 'AI' and 'Artificial Intelligence')",
            "Match the job description's language and terminology");

    private static final List<String> GENERAL_TAILORING = List.of(
            "Reorder bullet points so the achievements most relevant to this role come first",
            "Mirror the wording of the job description where it truthfully describes your work",
            "Quantify achievements with numbers and percentages where possible",
            "De-emphasize experience that is not relevant to this role");

    private static final int SUMMARY_SKILLS = 3;
    private static final int INTERVIEW_SKILLS = 3;
    private static final int CULTURE_SIGNALS = 2;
    private static final int TAILORING_KEYWORDS = 3;

    private final SkillDictionary dictionary;

    public AdvisoryGenerator(SkillDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public OptimizationAdvice advise(CompatibilityReport report, JobRequirementProfile job, CandidateProfile candidate) {
        Optional<ResponsibilityMatch> weakestDuty = weakestDuty(report);

        return new OptimizationAdvice(
                skillRecommendations(report),
                keywordRecommendations(report),
                sectionAdvice(report, job, weakestDuty),
                tailoringSuggestions(job),
                interviewFocusAreas(report, job, weakestDuty),
                ATS_TIPS);
    }

    // ------------------------------------------------------------------ skills & keywords

    private List<SkillRecommendation> skillRecommendations(CompatibilityReport report) {
        List<SkillRecommendation> out = new ArrayList<>();
        for (Skill s : report.missingRequiredSkills()) {
            out.add(new SkillRecommendation(s, Priority.HIGH, REQUIRED_RATIONALE, dictionary.learningSuggestion(s)));
        }
        for (Skill s : report.missingPreferredSkills()) {
            out.add(new SkillRecommendation(s, Priority.MEDIUM, PREFERRED_RATIONALE, dictionary.learningSuggestion(s)));
        }
        return out;
    }

    private static List<String> keywordRecommendations(CompatibilityReport report) {
        return report.missingKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .distinct()
                .collect(Collectors.toList());
    }

    // ------------------------------------------------------------------ per-section advice

    private static Map<String, List<String>> sectionAdvice(CompatibilityReport report,
                                                           JobRequirementProfile job,
                                                           Optional<ResponsibilityMatch> weakestDuty) {
        Map<String, List<String>> sections = new LinkedHashMap<>();

        if (!report.missingRequiredSkills().isEmpty()) {
            String skills = joinNames(report.missingRequiredSkills().stream().limit(SUMMARY_SKILLS).toList());
            sections.put(CvSection.SUMMARY.key(), List.of(
                    "Mention " + skills + " in your summary to show fit for " + rolePhrase(job)));
        }

        List<String> skillLines = new ArrayList<>();
        for (Skill s : report.missingRequiredSkills()) {
            skillLines.add("Add " + s.name() + " to your skills section if you have worked with it");
        }
        for (Skill s : report.missingPreferredSkills()) {
            skillLines.add("Consider listing " + s.name() + " in your skills section; the role prefers it");
        }
        if (!skillLines.isEmpty()) sections.put(CvSection.SKILLS.key(), skillLines);

        weakestDuty.ifPresent(m -> sections.put(CvSection.EXPERIENCE.key(), List.of(
                "Rephrase an experience bullet to use measurable outcomes tied to " + quoted(m.responsibility()))));

        return sections;
    }

    // ------------------------------------------------------------------ tailoring

    private static List<String> tailoringSuggestions(JobRequirementProfile job) {
        List<String> out = new ArrayList<>();
        if (job.jobTitle() != null) {
            out.add("Customize your professional summary to highlight your fit for the " + job.jobTitle() + " role");
        }
        if (job.educationRequirement() != null) {
            out.add("Make sure your education section clearly shows " + quoted(job.educationRequirement()));
        }
        if (!job.cultureSignals().isEmpty()) {
            out.add("Highlight experiences that demonstrate "
                    + String.join(" and ", job.cultureSignals().subList(0, Math.min(CULTURE_SIGNALS, job.cultureSignals().size()))));
        }
        if (!job.responsibilities().isEmpty()) {
            out.add("Lead your experience section with achievements related to " + quoted(job.responsibilities().get(0)));
        }
        if (!job.industryKeywords().isEmpty()) {
            out.add("Incorporate industry terms such as "
                    + String.join(", ", job.industryKeywords().subList(0, Math.min(TAILORING_KEYWORDS, job.industryKeywords().size()))));
        }
        out.add(industryPhrasing(job.industryCategory()));
        out.addAll(GENERAL_TAILORING);
        return out;
    }

    static String industryPhrasing(IndustryCategory category) {
        return switch (category) {
            case SOFTWARE   -> "Describe the systems you shipped and the scale they run at";
            case DATA       -> "Quantify the size of the datasets you handled and the decisions your analysis informed";
            case FINANCE    -> "Stress accuracy and the financial impact of your work";
            case HEALTHCARE -> "Highlight patient outcomes and your familiarity with compliance requirements";
            case MARKETING  -> "Lead with campaign results such as reach or conversion uplift";
            case GENERAL    -> "Frame each achievement around the outcome it produced for the business";
        };
    }

    // ------------------------------------------------------------------ interview focus

    private static List<String> interviewFocusAreas(CompatibilityReport report,
                                                    JobRequirementProfile job,
                                                    Optional<ResponsibilityMatch> weakestDuty) {
        List<String> out = new ArrayList<>();
        Set<Skill> missing = new HashSet<>(report.missingRequiredSkills());
        job.requiredSkills().stream()
                .filter(s -> !missing.contains(s))
                .limit(INTERVIEW_SKILLS)
                .forEach(s -> out.add("Prepare specific examples demonstrating your " + s.name() + " experience"));
        report.missingRequiredSkills().stream()
                .limit(INTERVIEW_SKILLS)
                .forEach(s -> out.add("Be ready to explain how you are building your " + s.name() + " skills"));
        weakestDuty.ifPresent(m -> out.add("Practice discussing how you have handled " + quoted(m.responsibility())));

        switch (job.experienceLevel()) {
            case SENIOR -> out.add("Prepare examples of leading teams and mentoring others");
            case ENTRY  -> out.add("Emphasize your learning agility and eagerness to grow");
            default     -> { }
        }
        if (!job.cultureSignals().isEmpty()) {
            out.add("Be ready to show how you work in a culture that values "
                    + String.join(" and ", job.cultureSignals().subList(0, Math.min(CULTURE_SIGNALS, job.cultureSignals().size()))));
        }
        return out;
    }

    // ------------------------------------------------------------------ helpers

    /** Lowest-overlap responsibility, first one on ties; absent when every duty is fully covered. */
    private static Optional<ResponsibilityMatch> weakestDuty(CompatibilityReport report) {
        ResponsibilityMatch weakest = null;
        for (ResponsibilityMatch m : report.responsibilityMatches()) {
            if (weakest == null || m.overlap() < weakest.overlap()) weakest = m;
        }
        return weakest == null || weakest.overlap() >= 1.0 ? Optional.empty() : Optional.of(weakest);
    }

    private static String rolePhrase(JobRequirementProfile job) {
        return job.jobTitle() == null ? "the target role" : "the " + job.jobTitle() + " role";
    }

    static String joinNames(List<Skill> skills) {
        List<String> names = skills.stream().map(Skill::name).toList();
        if (names.size() <= 1) return String.join("", names);
        return String.join(", ", names.subList(0, names.size() - 1)) + " and " + names.get(names.size() - 1);
    }

    private static String quoted(String text) {
        return "\"" + text + "\"";
    }
}
