package com.offy.competition.repository;

import com.offy.competition.model.AppUser;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UserRepository {
    AppUser save(AppUser user);
    Optional<AppUser> findById(Long userId);
    List<AppUser> findAllById(Collection<Long> userIds);
}
