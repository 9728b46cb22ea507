package com.example.cvmatch.text;

import com.example.cvmatch.TestFixtures;
import com.example.cvmatch.model.ExperienceLevel;
import com.example.cvmatch.model.IndustryCategory;
import com.example.cvmatch.model.Skill;
import com.example.cvmatch.model.SkillCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SkillDictionaryTest {

    private final SkillDictionary dictionary = TestFixtures.DICTIONARY;

    @Nested
    @DisplayName("Loading the bundled dictionary")
    class Loading {

        @Test
        @DisplayName("should expose a version and the skill table")
        void versionAndSkills() {
            assertThat(dictionary.version()).isNotBlank();
            assertThat(dictionary.skills()).hasSizeGreaterThan(50);
            assertThat(dictionary.maxAliasTokens()).isGreaterThanOrEqualTo(4);
        }

        @Test
        @DisplayName("should load the auxiliary vocabularies")
        void vocabularies() {
            assertThat(dictionary.isStopWord("the")).isTrue();
            assertThat(dictionary.canonicalToken("managed")).isEqualTo("lead");
            assertThat(dictionary.seniorityPhrases()).containsKeys(ExperienceLevel.ENTRY, ExperienceLevel.SENIOR);
            assertThat(dictionary.cultureSignals()).containsKey("work-life balance");
            assertThat(dictionary.industryTriggers()).containsKey(IndustryCategory.FINANCE);
        }
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("should collapse aliases onto one skill")
        void aliases() {
            assertThat(dictionary.lookup("js")).map(Skill::name).hasValue("JavaScript");
            assertThat(dictionary.lookup("k8s")).map(Skill::name).hasValue("Kubernetes");
            assertThat(dictionary.lookup("rest apis")).map(Skill::name).hasValue("REST API");
        }

        @Test
        @DisplayName("should only match case-sensitive names in their exact spelling")
        void caseSensitive() {
            assertThat(dictionary.lookup("go")).isEmpty();
            assertThat(dictionary.lookupCaseSensitive("Go")).map(Skill::name).hasValue("Go");
            assertThat(dictionary.lookupCaseSensitive("GO")).isEmpty();
        }

        @Test
        @DisplayName("resolve should map known terms and keep unknown ones as uncategorized")
        void resolve() {
            assertThat(dictionary.resolve("Golang")).map(Skill::name).hasValue("Go");

            Skill unknown = dictionary.resolve("Underwater Basket Weaving").orElseThrow();
            assertThat(unknown.id()).isEqualTo("underwater basket weaving");
            assertThat(unknown.category()).isEqualTo(SkillCategory.UNCATEGORIZED);
            assertThat(unknown.surfaceForms()).containsExactly("Underwater Basket Weaving");

            assertThat(dictionary.resolve("  !! ")).isEmpty();
            assertThat(dictionary.resolve("++")).isEmpty();
            assertThat(dictionary.resolve(" # ")).isEmpty();
            assertThat(dictionary.resolve(null)).isEmpty();
        }

        @Test
        @DisplayName("learning suggestion should use the category template or the generic one")
        void learningSuggestions() {
            assertThat(dictionary.learningSuggestion(TestFixtures.skill("Kubernetes")))
                    .contains("Kubernetes").contains("official tutorials");
            assertThat(dictionary.learningSuggestion(TestFixtures.skill("Underwater Basket Weaving")))
                    .isEqualTo("Consider taking an online course or working on projects involving Underwater Basket Weaving.");
        }
    }

    @Test
    @DisplayName("should reject an alias shared by two skills")
    void rejectsAmbiguousAlias() {
        DictionaryDocument doc = new DictionaryDocument("test",
                List.of(new DictionaryDocument.SkillEntry("Java", SkillCategory.LANGUAGE, List.of("jvm"), null),
                        new DictionaryDocument.SkillEntry("Kotlin", SkillCategory.LANGUAGE, List.of("jvm"), null)),
                null, null, null, null, null, Map.of(), null);

        assertThatThrownBy(() -> new SkillDictionary(doc))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jvm");
    }
}
