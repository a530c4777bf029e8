package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.IndexQuery;
import com.adlanda.channelknowledge.model.SearchHit;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Filters and orders similarity candidates, shared by all index implementations.
 *
 * With recency preferred, the score is {@code similarity + max(0, cap * (1 - ageDays / horizon))}.
 * Equal scores go to the more recently updated entry.
 */
public class FreshnessRanker {

    private static final Comparator<LocalDate> NEWEST_FIRST =
            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder());

    private final double minSimilarity;
    private final double bonusCap;
    private final int horizonDays;

    public FreshnessRanker(double minSimilarity, double bonusCap, int horizonDays) {
        if (horizonDays < 1) {
            throw new IllegalArgumentException("horizonDays must be positive");
        }
        this.minSimilarity = minSimilarity;
        this.bonusCap = bonusCap;
        this.horizonDays = horizonDays;
    }

    public List<SearchHit> rank(List<Candidate> candidates, IndexQuery query, LocalDate today) {
        return candidates.stream()
                .filter(c -> c.similarity() >= minSimilarity)
                .filter(c -> query.category() == null || query.category().equals(c.chunk().category()))
                .filter(c -> !(query.excludeExpired() && c.chunk().isExpired(today)))
                .filter(c -> withinMaxAge(c.chunk(), query.maxAgeDays(), today))
                .map(c -> toHit(c, query.preferRecent(), today))
                .sorted(Comparator.comparingDouble(SearchHit::score).reversed()
                        .thenComparing(hit -> hit.chunk().updatedDate(), NEWEST_FIRST))
                .limit(query.topK())
                .toList();
    }

    public double freshnessBonus(LocalDate updated, LocalDate today) {
        if (updated == null) {
            return 0.0;
        }
        long age = Math.max(0, ChronoUnit.DAYS.between(updated, today));
        return Math.max(0.0, bonusCap * (1.0 - (double) age / horizonDays));
    }

    public double getMinSimilarity() {
        return minSimilarity;
    }

    private SearchHit toHit(Candidate candidate, boolean preferRecent, LocalDate today) {
        double score = candidate.similarity();
        if (preferRecent) {
            score += freshnessBonus(candidate.chunk().updatedDate(), today);
        }
        return new SearchHit(candidate.id(), candidate.chunk(), candidate.metadata(),
                candidate.similarity(), score, candidate.chunk().isExpired(today));
    }

    private static boolean withinMaxAge(Chunk chunk, Integer maxAgeDays, LocalDate today) {
        if (maxAgeDays == null || chunk.updatedDate() == null) {
            return true;
        }
        return ChronoUnit.DAYS.between(chunk.updatedDate(), today) <= maxAgeDays;
    }

    /**
     * An entry with its raw similarity to the query vector.
     */
    public record Candidate(UUID id, Chunk chunk, Map<String, Object> metadata, double similarity) {}
}
