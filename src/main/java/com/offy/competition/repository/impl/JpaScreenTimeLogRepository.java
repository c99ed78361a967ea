package com.offy.competition.repository.impl;

import com.offy.competition.model.ScreenTimeLog;
import com.offy.competition.repository.ScreenTimeLogRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaScreenTimeLogRepository implements ScreenTimeLogRepository {

    private final SpringDataScreenTimeLogRepository jpaRepository;

    @Autowired
    public JpaScreenTimeLogRepository(SpringDataScreenTimeLogRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public ScreenTimeLog save(ScreenTimeLog log) {
        return jpaRepository.save(log);
    }

    @Override
    public Optional<ScreenTimeLog> findByUserIdAndAppNameAndLogDate(Long userId, String appName, LocalDate logDate) {
        return jpaRepository.findByUserIdAndAppNameAndLogDate(userId, appName, logDate);
    }

    @Override
    public List<ScreenTimeLog> findByUserIdBetween(Long userId, LocalDate from, LocalDate to) {
        return jpaRepository.findByUserIdAndLogDateBetweenOrderByLogDateAsc(userId, from, to);
    }

    @Override
    public List<ScreenTimeLog> findAllBetween(LocalDate from, LocalDate to) {
        return jpaRepository.findByLogDateBetween(from, to);
    }
}
