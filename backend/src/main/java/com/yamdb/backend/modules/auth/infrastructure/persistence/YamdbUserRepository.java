package com.yamdb.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.yamdb.backend.modules.auth.domain.YamdbUser;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface YamdbUserRepository extends JpaRepository<YamdbUser, UUID> {

    Optional<YamdbUser> findByUsername(String username);

    boolean existsByUsername(String username);

    Optional<YamdbUser> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select u from YamdbUser u where u.username = :username")
    Optional<YamdbUser> findByUsernameForUpdate(@Param("username") String username);

    Page<YamdbUser> findByUsernameStartingWithIgnoreCase(String prefix, Pageable pageable);
}
