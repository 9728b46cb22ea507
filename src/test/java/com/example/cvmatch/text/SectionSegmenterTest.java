package com.example.cvmatch.text;

import com.example.cvmatch.TestFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SectionSegmenterTest {

    private final SectionSegmenter segmenter = new SectionSegmenter(TestFixtures.properties());

    @Nested
    @DisplayName("segment")
    class Segment {

        @Test
        @DisplayName("should split a posting on its heading lines")
        void headingLines() {
            List<Section> sections = segmenter.segment(TestFixtures.JOB_TEXT);

            assertThat(sections).extracting(Section::kind).containsExactly(
                    SectionKind.PREAMBLE, SectionKind.RESPONSIBILITIES,
                    SectionKind.REQUIREMENTS, SectionKind.PREFERRED);
            assertThat(sections.get(0).body()).startsWith("Senior Backend Engineer");
            assertThat(sections.get(3).heading()).isEqualTo("Nice to have");
            assertThat(sections.get(3).body()).contains("Terraform").doesNotContain("Kafka");
        }

        @Test
        @DisplayName("should find headings followed by a colon in collapsed text")
        void inlineHeadings() {
            List<Section> sections = segmenter.segment(
                    "We need a developer. Requirements: Python and SQL. Nice to have: Docker.");

            assertThat(sections).extracting(Section::kind).containsExactly(
                    SectionKind.PREAMBLE, SectionKind.REQUIREMENTS, SectionKind.PREFERRED);
            assertThat(sections.get(1).body()).isEqualTo("Python and SQL.");
            assertThat(sections.get(2).body()).isEqualTo("Docker.");
        }

        @Test
        @DisplayName("should accept markdown headings and prefer the longest heading phrase")
        void markdownHeading() {
            List<Section> sections = segmenter.segment("## Key Responsibilities\n- Own the billing service");

            assertThat(sections).hasSize(1);
            assertThat(sections.get(0).kind()).isEqualTo(SectionKind.RESPONSIBILITIES);
            assertThat(sections.get(0).heading()).isEqualTo("Key Responsibilities");
        }

        @Test
        @DisplayName("should return nothing for blank input")
        void blank() {
            assertThat(segmenter.segment("   ")).isEmpty();
            assertThat(segmenter.segment(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("splitItems")
    class SplitItems {

        @Test
        @DisplayName("should strip bullets, drop one-word items and remove repeats")
        void bulletsAndRepeats() {
            String body = "- Built APIs in Java\n- Built APIs in Java.\n- Go\n• Led a team; mentored juniors";

            assertThat(SectionSegmenter.splitItems(body))
                    .containsExactly("Built APIs in Java", "Led a team", "mentored juniors");
        }

        @Test
        @DisplayName("should split sentences but keep date ranges intact")
        void sentencesAndDates() {
            assertThat(SectionSegmenter.splitItems("Shipped features. Mentored two engineers."))
                    .containsExactly("Shipped features", "Mentored two engineers");
            assertThat(SectionSegmenter.splitItems("Software Engineer, Globex (2019 - present)"))
                    .containsExactly("Software Engineer, Globex (2019 - present)");
        }
    }
}
