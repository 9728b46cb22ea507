package com.example.cvmatch.text;

import com.example.cvmatch.model.ExperienceLevel;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seniority detection. Job postings combine explicit year requirements with seniority words;
 * candidate documents use stated years of experience and listed employment date ranges.
 */
public final class ExperienceLevelDetector {

    private static final String YEARS = "(?:years?|yrs?)";

    private static final Pattern RANGE = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\s*(?:-|–|—|to)\\s*(\\d{1,2})\\s*\\+?\\s*" + YEARS);
    private static final Pattern PLUS = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\s*\\+\\s*" + YEARS);
    private static final Pattern MINIMUM = Pattern.compile(
            "(?:at least|minimum(?: of)?|min\\.?|over|more than)\\s+(\\d{1,2})\\s*\\+?\\s*" + YEARS);
    private static final Pattern EXPLICIT = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\s*" + YEARS + "\\s+(?:of\\s+)?(?:[a-z]+\\s+){0,3}?experience");
    private static final Pattern DATE_RANGE = Pattern.compile(
            "((?:19|20)\\d{2})\\s*(?:-|–|—|to|until)\\s*(?:[a-z]{3,9}\\.?\\s+)?((?:19|20)\\d{2}|present|current|now|today)");

    public record ExperienceEstimate(ExperienceLevel level, Integer years) {
        static final ExperienceEstimate NONE = new ExperienceEstimate(ExperienceLevel.UNSPECIFIED, null);
    }

    private final SkillDictionary dictionary;
    private final Clock clock;

    public ExperienceLevelDetector(SkillDictionary dictionary, Clock clock) {
        this.dictionary = dictionary;
        this.clock = clock;
    }

    /**
     * Level required by a posting. Numeric requirements map through their lower bound; when
     * numeric and lexical evidence disagree the higher band wins.
     */
    public ExperienceEstimate forJob(String title, String text) {
        String lower = TextNormalizer.fold(text).toLowerCase(Locale.ROOT);
        Integer years = requiredYears(lower);
        ExperienceLevel numeric = ExperienceLevel.fromYears(years);

        List<String> words = new ArrayList<>(TextNormalizer.words(title == null ? "" : title));
        words.addAll(TextNormalizer.words(text));
        ExperienceLevel lexical = lexicalLevel(words);

        return new ExperienceEstimate(ExperienceLevel.higherOf(numeric, lexical), years);
    }

    /**
     * Level of a candidate from the larger of stated years and years covered by date ranges.
     * Stated years are read from the whole document, date ranges only from {@code employmentText}.
     */
    public ExperienceEstimate forCandidate(String text, String employmentText) {
        Integer stated = statedYears(TextNormalizer.fold(text).toLowerCase(Locale.ROOT));
        Integer covered = coveredYears(TextNormalizer.fold(employmentText).toLowerCase(Locale.ROOT));
        Integer years = stated == null ? covered
                : covered == null ? stated
                : Math.max(stated, covered);
        if (years == null) return ExperienceEstimate.NONE;
        return new ExperienceEstimate(ExperienceLevel.fromYears(years), years);
    }

    // ------------------------------------------------------------------ numeric

    Integer requiredYears(String lower) {
        Integer best = null;
        List<int[]> rangeSpans = new ArrayList<>();
        Matcher r = RANGE.matcher(lower);
        while (r.find()) {
            rangeSpans.add(new int[]{r.start(), r.end()});
            best = max(best, Integer.parseInt(r.group(1)));
        }
        for (Pattern p : List.of(PLUS, MINIMUM, EXPLICIT)) {
            Matcher m = p.matcher(lower);
            while (m.find()) {
                if (insideAny(m.start(), rangeSpans)) continue;
                best = max(best, Integer.parseInt(m.group(1)));
            }
        }
        return best;
    }

    private Integer statedYears(String lower) {
        Integer best = null;
        for (Pattern p : List.of(EXPLICIT, PLUS, MINIMUM)) {
            Matcher m = p.matcher(lower);
            while (m.find()) best = max(best, Integer.parseInt(m.group(1)));
        }
        return best;
    }

    /** Total years covered by employment ranges, overlaps merged, open ranges ending this year. */
    Integer coveredYears(String lower) {
        int currentYear = Year.now(clock).getValue();
        List<int[]> ranges = new ArrayList<>();
        Matcher m = DATE_RANGE.matcher(lower);
        while (m.find()) {
            int from = Integer.parseInt(m.group(1));
            String endText = m.group(2);
            int to = Character.isDigit(endText.charAt(0)) ? Integer.parseInt(endText) : currentYear;
            if (from > to || to > currentYear + 1) continue;
            ranges.add(new int[]{from, to});
        }
        if (ranges.isEmpty()) return null;

        ranges.sort(Comparator.comparingInt(a -> a[0]));
        int total = 0;
        int curFrom = ranges.get(0)[0];
        int curTo = ranges.get(0)[1];
        for (int[] range : ranges.subList(1, ranges.size())) {
            if (range[0] <= curTo) {
                curTo = Math.max(curTo, range[1]);
            } else {
                total += curTo - curFrom;
                curFrom = range[0];
                curTo = range[1];
            }
        }
        total += curTo - curFrom;
        return total;
    }

    // ------------------------------------------------------------------ lexical

    ExperienceLevel lexicalLevel(List<String> words) {
        ExperienceLevel level = ExperienceLevel.UNSPECIFIED;
        for (Map.Entry<ExperienceLevel, List<List<String>>> e : dictionary.seniorityPhrases().entrySet()) {
            for (List<String> phrase : e.getValue()) {
                if (TextNormalizer.containsPhrase(words, phrase)) {
                    level = ExperienceLevel.higherOf(level, e.getKey());
                    break;
                }
            }
        }
        return level;
    }

    private static boolean insideAny(int pos, List<int[]> spans) {
        for (int[] s : spans) {
            if (pos >= s[0] && pos < s[1]) return true;
        }
        return false;
    }

    private static Integer max(Integer a, int b) {
        return a == null ? b : Math.max(a, b);
    }
}
