package com.offy.competition.repository.impl;

import com.offy.competition.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpringDataUserRepository extends JpaRepository<AppUser, Long> {
}
