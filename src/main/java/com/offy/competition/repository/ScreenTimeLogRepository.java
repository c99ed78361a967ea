package com.offy.competition.repository;

import com.offy.competition.model.ScreenTimeLog;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ScreenTimeLogRepository {
    ScreenTimeLog save(ScreenTimeLog log);
    Optional<ScreenTimeLog> findByUserIdAndAppNameAndLogDate(Long userId, String appName, LocalDate logDate);
    List<ScreenTimeLog> findByUserIdBetween(Long userId, LocalDate from, LocalDate to);
    List<ScreenTimeLog> findAllBetween(LocalDate from, LocalDate to);
}
