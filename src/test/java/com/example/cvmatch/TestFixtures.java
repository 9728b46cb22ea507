package com.example.cvmatch;

import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.inference.NoOpSkillInferenceClient;
import com.example.cvmatch.inference.ResilientSkillInference;
import com.example.cvmatch.model.CandidateProfile;
import com.example.cvmatch.model.ExperienceLevel;
import com.example.cvmatch.model.IndustryCategory;
import com.example.cvmatch.model.JobRequirementProfile;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.text.SkillDictionary;
import com.example.cvmatch.text.SkillDictionaryLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ClassPathResource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/** Shared fixtures: the real classpath dictionary, default settings and sample documents. */
public final class TestFixtures {

    public static final SkillDictionary DICTIONARY = SkillDictionaryLoader.load(
            new ClassPathResource("skill-dictionary.json"), new ObjectMapper());

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-06-01T10:00:00Z"), ZoneOffset.UTC);

    public static final String JOB_TEXT = """
            Senior Backend Engineer

            Acme Payments is a fast-paced fintech startup building a modern payments platform. \
            We value ownership and a collaborative, remote-friendly culture.

            Responsibilities:
            - Design and build scalable microservices for payment processing
            - Manage a team of 5 engineers
            - Improve the reliability of our payment processing pipeline

            Requirements:
            - 5+ years of experience in backend development
            - Strong Python and SQL skills
            - Experience with Docker and Kubernetes
            - Kafka is a plus

            Nice to have:
            - Terraform
            - Experience with AWS
            """;

    public static final String CV_TEXT = """
            Jane Doe
            Backend Developer

            Summary
            Backend developer with 6 years of experience building payment processing systems in Python.

            Experience
            Software Engineer, Globex (2019 - present)
            - Led a team of 5 engineers on a release of the payment processing pipeline
            - Built microservices in Python with Docker and PostgreSQL
            - Improved reliability of payment processing by 30%

            Junior Developer, Initech (2017 - 2019)
            - Developed SQL reports for finance teams

            Skills
            Python, SQL, Docker, Git, Agile

            Education
            BSc Computer Science, 2017
            """;

    private TestFixtures() {
    }

    public static MatchingProperties properties() {
        return new MatchingProperties();
    }

    public static ResilientSkillInference noInference() {
        return new ResilientSkillInference(new NoOpSkillInferenceClient(), properties(), Runnable::run);
    }

    /** Dictionary skill by display name or alias, or an uncategorized one when unknown. */
    public static Skill skill(String name) {
        return DICTIONARY.resolve(name).orElseThrow();
    }

    public static List<Skill> skills(String... names) {
        return Arrays.stream(names).map(TestFixtures::skill).toList();
    }

    public static JobRequirementProfile job(List<Skill> required, List<Skill> preferred) {
        return new JobRequirementProfile("Platform Engineer", null, required, preferred,
                ExperienceLevel.UNSPECIFIED, null, List.of(), List.of(), List.of(), IndustryCategory.GENERAL, false);
    }

    public static CandidateProfile candidate(List<Skill> skills) {
        return new CandidateProfile(skills, ExperienceLevel.UNSPECIFIED, null, List.of(), Set.of(), false);
    }

    /** Same profile with {@code extra} appended to its skills, for what-if scoring. */
    public static CandidateProfile withSkill(CandidateProfile profile, Skill extra) {
        if (profile.skills().contains(extra)) return profile;
        List<Skill> merged = new ArrayList<>(profile.skills());
        merged.add(extra);
        return new CandidateProfile(merged, profile.experienceLevel(), profile.estimatedYears(),
                profile.experienceBullets(), profile.textTerms(), profile.inferenceDegraded());
    }
}
