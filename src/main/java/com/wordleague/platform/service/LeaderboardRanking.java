package com.wordleague.platform.service;

import com.wordleague.platform.model.LeaderboardEntry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.text.Collator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders leaderboard entries and assigns competition ranks ("1224").
 * <p>
 * Entries that have a score come first, fewest mistakes first; equal scores keep their input order.
 * Entries without a score follow, ordered by display name with a locale-aware collator, and never
 * receive a rank. Among scored entries a tie shares the rank of its first member, which is that
 * member's 1-based position among scored entries.
 */
@Component
public class LeaderboardRanking {
    
    private final Locale locale;
    
    public LeaderboardRanking(@Value("${wordleague.leaderboard.locale:en}") String languageTag) {
        this.locale = Locale.forLanguageTag(languageTag);
    }
    
    public List<LeaderboardEntry> rank(List<LeaderboardEntry> entries) {
        List<LeaderboardEntry> sorted = new ArrayList<>(entries);
        sorted.sort(entryOrder());
        assignRanks(sorted);
        return sorted;
    }
    
    Comparator<LeaderboardEntry> entryOrder() {
        // Collator instances are not thread-safe to share; one per ordering
        Collator collator = Collator.getInstance(locale);
        return (a, b) -> {
            if (a.hasPlayed() != b.hasPlayed()) {
                return a.hasPlayed() ? -1 : 1;
            }
            if (a.hasPlayed()) {
                return Integer.compare(a.getMistakes(), b.getMistakes());
            }
            return collator.compare(nameOf(a), nameOf(b));
        };
    }
    
    private void assignRanks(List<LeaderboardEntry> sorted) {
        int playedCount = 0;
        Integer previousMistakes = null;
        Integer currentRank = null;
        for (LeaderboardEntry entry : sorted) {
            if (!entry.hasPlayed()) {
                entry.setRank(null);
                continue;
            }
            playedCount++;
            if (!entry.getMistakes().equals(previousMistakes)) {
                currentRank = playedCount;
            }
            entry.setRank(currentRank);
            previousMistakes = entry.getMistakes();
        }
    }
    
    private static String nameOf(LeaderboardEntry entry) {
        return entry.getDisplayName() != null ? entry.getDisplayName() : "";
    }
}
