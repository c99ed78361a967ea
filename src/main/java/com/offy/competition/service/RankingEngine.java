package com.offy.competition.service;

import com.offy.competition.model.RankedEntry;
import com.offy.competition.model.RankingCandidate;
import com.offy.competition.model.ZeroLogPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Competition ranking ("1,2,2,4") of challenge participants by average daily minutes, lowest first.
 */
@Component
public class RankingEngine {

    public List<RankedEntry> rank(List<RankingCandidate> candidates) {
        return rank(candidates, ZeroLogPolicy.RANK_AS_ZERO_AVERAGE);
    }

    /**
     * Ranks the candidates. Equal averages share a rank and the next distinct average is ranked
     * one past the number of strictly better entries. Every entry holding the minimum average
     * is a winner. Ties keep input order.
     * <p>
     * Under {@link ZeroLogPolicy#EXCLUDE} candidates without logged days are appended after
     * the ranked ones with no rank or average.
     */
    public List<RankedEntry> rank(List<RankingCandidate> candidates, ZeroLogPolicy zeroLogPolicy) {
        if (candidates == null || candidates.isEmpty()) {
            return new ArrayList<>();
        }

        List<Averaged> ranked = new ArrayList<>();
        List<RankingCandidate> unranked = new ArrayList<>();
        for (RankingCandidate candidate : candidates) {
            if (candidate.getDaysLogged() <= 0 && zeroLogPolicy == ZeroLogPolicy.EXCLUDE) {
                unranked.add(candidate);
            } else {
                ranked.add(new Averaged(candidate.getId(), average(candidate)));
            }
        }

        // List.sort is stable, so equal averages keep their input order
        ranked.sort(Comparator.comparingDouble(Averaged::average));

        List<RankedEntry> result = new ArrayList<>(candidates.size());
        if (!ranked.isEmpty()) {
            double minimum = ranked.get(0).average();
            int currentRank = 1;
            for (int i = 0; i < ranked.size(); i++) {
                Averaged entry = ranked.get(i);
                if (i > 0 && Double.compare(entry.average(), ranked.get(i - 1).average()) != 0) {
                    currentRank = i + 1;
                }
                result.add(RankedEntry.builder()
                    .id(entry.id())
                    .average(entry.average())
                    .rank(currentRank)
                    .winner(Double.compare(entry.average(), minimum) == 0)
                    .build());
            }
        }

        for (RankingCandidate candidate : unranked) {
            result.add(RankedEntry.builder()
                .id(candidate.getId())
                .winner(false)
                .build());
        }
        return result;
    }

    static double average(RankingCandidate candidate) {
        if (candidate.getDaysLogged() <= 0) {
            return 0.0;
        }
        return (double) candidate.getTotalMinutes() / candidate.getDaysLogged();
    }

    private static final class Averaged {
        private final Long id;
        private final double average;

        private Averaged(Long id, double average) {
            this.id = id;
            this.average = average;
        }

        Long id() {
            return id;
        }

        double average() {
            return average;
        }
    }
}
