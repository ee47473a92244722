package com.taskboard.backend.modules.team.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.taskboard.backend.modules.team.domain.TeamMembership;
import com.taskboard.backend.modules.team.domain.TeamRole;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamMembershipRepository extends JpaRepository<TeamMembership, UUID> {

    /**
     * Any membership row for the pair, deleted ones included.
     */
    @Query("""
            select m from TeamMembership m
              join fetch m.user
              join fetch m.team
             where m.team.id = :teamId
               and m.user.id = :userId
            """)
    Optional<TeamMembership> findByTeamIdAndUserId(@Param("teamId") UUID teamId, @Param("userId") UUID userId);

    @Query("""
            select m from TeamMembership m
              join fetch m.user
             where m.team.id = :teamId
               and m.deletedAt is null
             order by m.createdAt asc
            """)
    List<TeamMembership> findVisibleByTeamId(@Param("teamId") UUID teamId);

    @Query("""
            select m from TeamMembership m
              join fetch m.team t
             where m.user.id = :userId
               and m.deletedAt is null
               and m.joinedAt is not null
               and t.deletedAt is null
             order by t.name asc
            """)
    List<TeamMembership> findActiveByUserId(@Param("userId") UUID userId);

    @Query("""
            select count(m) from TeamMembership m
             where m.team.id = :teamId
               and m.role = :role
               and m.deletedAt is null
               and m.joinedAt is not null
            """)
    long countActiveByTeamIdAndRole(@Param("teamId") UUID teamId, @Param("role") TeamRole role);

    @Query("""
            select case when count(m) > 0 then true else false end
              from TeamMembership m
             where m.team.id = :teamId
               and m.user.id = :userId
               and m.deletedAt is null
               and m.joinedAt is not null
            """)
    boolean existsActiveMembership(@Param("teamId") UUID teamId, @Param("userId") UUID userId);
}
