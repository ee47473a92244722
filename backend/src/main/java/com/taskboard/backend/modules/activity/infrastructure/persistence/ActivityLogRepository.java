package com.taskboard.backend.modules.activity.infrastructure.persistence;

import java.util.UUID;

import com.taskboard.backend.modules.activity.domain.ActivityLog;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ActivityLogRepository extends JpaRepository<ActivityLog, UUID> {

    @Query(value = """
            select a from ActivityLog a
              left join fetch a.actor
             where a.teamId = :teamId
             order by a.createdAt desc, a.id desc
            """,
            countQuery = "select count(a) from ActivityLog a where a.teamId = :teamId")
    Page<ActivityLog> findByTeamIdNewestFirst(@Param("teamId") UUID teamId, Pageable pageable);
}
