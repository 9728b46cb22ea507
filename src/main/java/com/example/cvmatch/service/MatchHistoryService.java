package com.example.cvmatch.service;

import com.example.cvmatch.config.MatchingProperties;
import com.example.cvmatch.model.CompatibilityReport;
import com.example.cvmatch.model.MatchHistoryEntry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Process-local record of completed analyses, used to follow how a CV's score for a role
 * changes across revisions. Holds at most {@code matching.history-limit} entries, dropping
 * the oldest first. Lost on restart.
 */
@Service
public class MatchHistoryService {

    static final String UNTITLED = "(untitled)";

    // oldest first; guarded by itself
    private final Deque<MatchHistoryEntry> store = new ArrayDeque<>();
    private final int limit;
    private final Clock clock;
    private long sequence;

    public MatchHistoryService(Clock clock, MatchingProperties properties) {
        this.clock = clock;
        this.limit = Math.max(1, properties.getHistoryLimit());
    }

    public MatchHistoryEntry record(String jobTitle, CompatibilityReport report) {
        synchronized (store) {
            String id = String.format("M%04d", ++sequence);
            MatchHistoryEntry entry = new MatchHistoryEntry(
                    id,
                    clock.instant(),
                    jobTitle == null || jobTitle.isBlank() ? UNTITLED : jobTitle.strip(),
                    report.overallScore(),
                    report.verdict(),
                    report.missingRequiredSkills().size(),
                    report.missingPreferredSkills().size());
            store.addLast(entry);
            while (store.size() > limit) store.removeFirst();
            return entry;
        }
    }

    /** Most recent first. */
    public List<MatchHistoryEntry> findRecent(int limit) {
        List<MatchHistoryEntry> recent = new ArrayList<>();
        synchronized (store) {
            Iterator<MatchHistoryEntry> it = store.descendingIterator();
            while (it.hasNext() && recent.size() < limit) recent.add(it.next());
        }
        return recent;
    }

    /** Oldest first, title compared case-insensitively. */
    public List<MatchHistoryEntry> findByJobTitle(String jobTitle) {
        String title = jobTitle == null ? UNTITLED : jobTitle.strip();
        synchronized (store) {
            return store.stream()
                    .filter(e -> e.jobTitle().equalsIgnoreCase(title))
                    .collect(Collectors.toList());
        }
    }

    /** Score trajectory for one job title: first, latest and best score plus the net change. */
    public Map<String, Object> scoreTrend(String jobTitle) {
        List<MatchHistoryEntry> entries = findByJobTitle(jobTitle);
        Map<String, Object> trend = new LinkedHashMap<>();
        trend.put("jobTitle", jobTitle);
        trend.put("attempts", entries.size());
        if (entries.isEmpty()) return trend;

        int first = entries.get(0).overallScore();
        int latest = entries.get(entries.size() - 1).overallScore();
        trend.put("firstScore", first);
        trend.put("latestScore", latest);
        trend.put("bestScore", entries.stream().mapToInt(MatchHistoryEntry::overallScore).max().orElse(latest));
        trend.put("change", latest - first);
        trend.put("latestVerdict", entries.get(entries.size() - 1).verdict());
        trend.put("scores", entries.stream().map(MatchHistoryEntry::overallScore).collect(Collectors.toList()));
        return trend;
    }
}
