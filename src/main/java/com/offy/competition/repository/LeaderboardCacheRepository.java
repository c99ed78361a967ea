package com.offy.competition.repository;

import com.offy.competition.model.LeaderboardEntry;

import java.util.List;
import java.util.Optional;

public interface LeaderboardCacheRepository {
    Optional<List<LeaderboardEntry>> get(String key);
    void put(String key, List<LeaderboardEntry> entries, int ttlSeconds);
    void evict(String key);
    boolean isAvailable();
}
