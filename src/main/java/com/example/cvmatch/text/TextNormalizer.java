package com.example.cvmatch.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Case, accent and punctuation folding shared by every component, so a term is normalized
 * once when a profile is built and compared by plain equality afterwards.
 */
public final class TextNormalizer {

    private static final Pattern TOKEN      = Pattern.compile("[\\p{L}\\p{N}+#]+");
    private static final Pattern MARKS      = Pattern.compile("\\p{M}+");
    private static final Pattern ALNUM      = Pattern.compile("[\\p{L}\\p{N}]");

    private TextNormalizer() {
    }

    /** Strips accents; offsets of the result are what {@link Token} positions refer to. */
    public static String fold(String text) {
        if (text == null) return "";
        return MARKS.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD)).replaceAll("");
    }

    /** Lowercase, accent-free, punctuation collapsed to single spaces: "Node.js" becomes "node js". */
    public static String normalize(String term) {
        if (term == null) return "";
        String lower = fold(term).toLowerCase(Locale.ROOT);
        return tokenize(lower).stream().map(Token::norm).collect(Collectors.joining(" "));
    }

    public static List<Token> tokenize(String text) {
        String folded = fold(text);
        List<Token> tokens = new ArrayList<>();
        Matcher m = TOKEN.matcher(folded);
        while (m.find()) {
            String raw = m.group();
            if (!ALNUM.matcher(raw).find()) continue;
            tokens.add(new Token(raw, raw.toLowerCase(Locale.ROOT), m.start(), m.end()));
        }
        return tokens;
    }

    public static List<String> words(String text) {
        return tokenize(text).stream().map(Token::norm).toList();
    }

    public static int countTokens(String text) {
        return text == null || text.isBlank() ? 0 : tokenize(text).size();
    }

    /**
     * Naive English singular of one token. Leaves short tokens and common non-plural endings
     * ("ss", "us", "is", "ics", "ous") untouched.
     */
    public static String singular(String token) {
        int n = token.length();
        if (n <= 3 || !token.endsWith("s")) return token;
        if (token.endsWith("ss") || token.endsWith("us") || token.endsWith("is")
                || token.endsWith("ics") || token.endsWith("ous")) {
            return token;
        }
        if (token.endsWith("ies") && n > 4) return token.substring(0, n - 3) + "y";
        return token.substring(0, n - 1);
    }

    /** Number of places {@code phrase} occurs as a contiguous run in {@code words}. */
    public static int countPhrase(List<String> words, List<String> phrase) {
        if (phrase.isEmpty() || phrase.size() > words.size()) return 0;
        int count = 0;
        outer:
        for (int i = 0; i <= words.size() - phrase.size(); i++) {
            for (int j = 0; j < phrase.size(); j++) {
                if (!words.get(i + j).equals(phrase.get(j))) continue outer;
            }
            count++;
        }
        return count;
    }

    public static boolean containsPhrase(List<String> words, List<String> phrase) {
        return countPhrase(words, phrase) > 0;
    }
}
