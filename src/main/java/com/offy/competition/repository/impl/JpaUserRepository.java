package com.offy.competition.repository.impl;

import com.offy.competition.model.AppUser;
import com.offy.competition.repository.UserRepository;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class JpaUserRepository implements UserRepository {

    private final SpringDataUserRepository jpaRepository;

    @Autowired
    public JpaUserRepository(SpringDataUserRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public AppUser save(AppUser user) {
        return jpaRepository.save(user);
    }

    @Override
    public Optional<AppUser> findById(Long userId) {
        return jpaRepository.findById(userId);
    }

    @Override
    public List<AppUser> findAllById(Collection<Long> userIds) {
        if (userIds == null || userIds.isEmpty()) {
            return List.of();
        }
        return jpaRepository.findAllById(userIds);
    }
}
