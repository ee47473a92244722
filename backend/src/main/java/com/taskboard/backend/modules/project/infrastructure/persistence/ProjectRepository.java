package com.taskboard.backend.modules.project.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.taskboard.backend.modules.project.domain.Project;
import com.taskboard.backend.modules.project.domain.ProjectStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

    @Query("""
            select p from Project p
              join fetch p.team t
             where p.id = :projectId
               and p.deletedAt is null
               and t.deletedAt is null
            """)
    Optional<Project> findActiveById(@Param("projectId") UUID projectId);

    @Query("""
            select p from Project p
             where p.team.id = :teamId
               and p.deletedAt is null
               and (:status is null or p.status = :status)
             order by p.position asc, p.createdAt asc
            """)
    List<Project> findByTeam(@Param("teamId") UUID teamId, @Param("status") ProjectStatus status);

    @Query("""
            select case when count(p) > 0 then true else false end
              from Project p
             where p.team.id = :teamId
               and lower(p.name) = lower(:name)
               and p.deletedAt is null
               and (:excludeId is null or p.id <> :excludeId)
            """)
    boolean existsActiveName(@Param("teamId") UUID teamId,
                             @Param("name") String name,
                             @Param("excludeId") UUID excludeId);
}
