package com.offy.competition.repository.impl;

import com.offy.competition.model.ScreenTimeLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface SpringDataScreenTimeLogRepository extends JpaRepository<ScreenTimeLog, Long> {
    Optional<ScreenTimeLog> findByUserIdAndAppNameAndLogDate(Long userId, String appName, LocalDate logDate);
    List<ScreenTimeLog> findByUserIdAndLogDateBetweenOrderByLogDateAsc(Long userId, LocalDate from, LocalDate to);
    List<ScreenTimeLog> findByLogDateBetween(LocalDate from, LocalDate to);
}
