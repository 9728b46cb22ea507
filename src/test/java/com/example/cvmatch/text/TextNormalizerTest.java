package com.example.cvmatch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("should fold case, accents and punctuation")
        void foldsCaseAccentsAndPunctuation() {
            assertThat(TextNormalizer.normalize("Node.js")).isEqualTo("node js");
            assertThat(TextNormalizer.normalize("  Café   Olé ")).isEqualTo("cafe ole");
            assertThat(TextNormalizer.normalize("CI/CD")).isEqualTo("ci cd");
        }

        @Test
        @DisplayName("should keep + and # inside tokens")
        void keepsLanguageSigils() {
            assertThat(TextNormalizer.words("C++ and C#")).containsExactly("c++", "and", "c#");
        }

        @Test
        @DisplayName("should treat null as empty")
        void nullIsEmpty() {
            assertThat(TextNormalizer.normalize(null)).isEmpty();
            assertThat(TextNormalizer.countTokens(null)).isZero();
            assertThat(TextNormalizer.normalize("  -- !! ")).isEmpty();
        }
    }

    @Nested
    @DisplayName("tokenize")
    class Tokenize {

        @Test
        @DisplayName("should report offsets into the folded text")
        void offsets() {
            List<Token> tokens = TextNormalizer.tokenize("Go, Java");

            assertThat(tokens).extracting(Token::raw).containsExactly("Go", "Java");
            assertThat(tokens.get(1).start()).isEqualTo(4);
            assertThat(tokens.get(1).end()).isEqualTo(8);
        }

        @Test
        @DisplayName("should drop tokens made only of sigils")
        void dropsSigilOnlyTokens() {
            assertThat(TextNormalizer.words("+ # python")).containsExactly("python");
        }
    }

    @Test
    @DisplayName("singular should strip plain plurals and leave other endings alone")
    void singular() {
        assertThat(TextNormalizer.singular("engineers")).isEqualTo("engineer");
        assertThat(TextNormalizer.singular("technologies")).isEqualTo("technology");
        assertThat(TextNormalizer.singular("business")).isEqualTo("business");
        assertThat(TextNormalizer.singular("status")).isEqualTo("status");
        assertThat(TextNormalizer.singular("analytics")).isEqualTo("analytics");
        assertThat(TextNormalizer.singular("bus")).isEqualTo("bus");
    }

    @Test
    @DisplayName("countPhrase should count contiguous runs only")
    void countPhrase() {
        List<String> words = List.of("data", "science", "and", "data", "engineering", "data", "science");

        assertThat(TextNormalizer.countPhrase(words, List.of("data", "science"))).isEqualTo(2);
        assertThat(TextNormalizer.containsPhrase(words, List.of("science", "data"))).isFalse();
        assertThat(TextNormalizer.countPhrase(words, List.of())).isZero();
    }
}
