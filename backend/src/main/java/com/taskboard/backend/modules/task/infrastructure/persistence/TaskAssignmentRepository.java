package com.taskboard.backend.modules.task.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.TaskAssignment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskAssignmentRepository extends JpaRepository<TaskAssignment, UUID> {

    @Query("""
            select a from TaskAssignment a
              join fetch a.assignee
             where a.task.id = :taskId
             order by a.assignedAt asc
            """)
    List<TaskAssignment> findByTaskId(@Param("taskId") UUID taskId);

    @Query("""
            select a from TaskAssignment a
              join fetch a.assignee
             where a.task.id in :taskIds
            """)
    List<TaskAssignment> findByTaskIds(@Param("taskIds") Collection<UUID> taskIds);

    @Query("select a from TaskAssignment a where a.task.id = :taskId and a.assignee.id = :assigneeId")
    Optional<TaskAssignment> findByTaskIdAndAssigneeId(@Param("taskId") UUID taskId, @Param("assigneeId") UUID assigneeId);

    @Query("""
            select case when count(a) > 0 then true else false end
              from TaskAssignment a
             where a.task.id = :taskId
               and a.assignee.id = :assigneeId
            """)
    boolean existsByTaskIdAndAssigneeId(@Param("taskId") UUID taskId, @Param("assigneeId") UUID assigneeId);

    @Query("select count(a) from TaskAssignment a where a.task.id = :taskId")
    long countByTaskId(@Param("taskId") UUID taskId);

    @Modifying
    @Query("""
            delete from TaskAssignment a
             where a.assignee.id = :assigneeId
               and a.task.id in (select t.id from Task t where t.team.id = :teamId)
            """)
    int deleteByTeamIdAndAssigneeId(@Param("teamId") UUID teamId, @Param("assigneeId") UUID assigneeId);

    @Modifying
    @Query("delete from TaskAssignment a where a.task.id in :taskIds")
    int deleteByTaskIds(@Param("taskIds") Collection<UUID> taskIds);
}
