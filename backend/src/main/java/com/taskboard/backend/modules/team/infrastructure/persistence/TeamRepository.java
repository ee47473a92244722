package com.taskboard.backend.modules.team.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.taskboard.backend.modules.team.domain.Team;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamRepository extends JpaRepository<Team, UUID> {

    @Query("select t from Team t where t.id = :teamId and t.deletedAt is null")
    Optional<Team> findActiveById(@Param("teamId") UUID teamId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from Team t where t.id = :teamId")
    Optional<Team> findByIdForUpdate(@Param("teamId") UUID teamId);

    boolean existsBySlug(String slug);
}
