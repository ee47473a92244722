package com.taskboard.backend.modules.task.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.Task;
import com.taskboard.backend.modules.task.domain.TaskPriority;
import com.taskboard.backend.modules.task.domain.TaskStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

    @Query("""
            select t from Task t
              join fetch t.team tm
              left join fetch t.project
             where t.id = :taskId
               and t.deletedAt is null
               and tm.deletedAt is null
            """)
    Optional<Task> findActiveById(@Param("taskId") UUID taskId);

    @Query(value = """
            select t from Task t
             where t.team.id = :teamId
               and t.deletedAt is null
               and (:includeArchived = true or t.archived = false)
               and (:projectId is null or t.project.id = :projectId)
               and (:status is null or t.status = :status)
               and (:priority is null or t.priority = :priority)
               and (:assigneeId is null or exists (
                       select 1 from TaskAssignment a
                        where a.task = t and a.assignee.id = :assigneeId))
             order by t.position asc, t.createdAt asc
            """,
            countQuery = """
            select count(t) from Task t
             where t.team.id = :teamId
               and t.deletedAt is null
               and (:includeArchived = true or t.archived = false)
               and (:projectId is null or t.project.id = :projectId)
               and (:status is null or t.status = :status)
               and (:priority is null or t.priority = :priority)
               and (:assigneeId is null or exists (
                       select 1 from TaskAssignment a
                        where a.task = t and a.assignee.id = :assigneeId))
            """)
    Page<Task> searchTeamTasks(@Param("teamId") UUID teamId,
                               @Param("projectId") UUID projectId,
                               @Param("status") TaskStatus status,
                               @Param("priority") TaskPriority priority,
                               @Param("assigneeId") UUID assigneeId,
                               @Param("includeArchived") boolean includeArchived,
                               Pageable pageable);

    @Query(value = """
            select t from Task t
              join t.team tm
             where t.deletedAt is null
               and tm.deletedAt is null
               and (:status is null or t.status = :status)
               and exists (select 1 from TaskAssignment a where a.task = t and a.assignee.id = :userId)
             order by t.dueDate asc nulls last, t.createdAt asc
            """,
            countQuery = """
            select count(t) from Task t
              join t.team tm
             where t.deletedAt is null
               and tm.deletedAt is null
               and (:status is null or t.status = :status)
               and exists (select 1 from TaskAssignment a where a.task = t and a.assignee.id = :userId)
            """)
    Page<Task> findAssignedTo(@Param("userId") UUID userId,
                              @Param("status") TaskStatus status,
                              Pageable pageable);

    @Query("select t.id from Task t where t.project.id = :projectId and t.deletedAt is null")
    List<UUID> findActiveIdsByProjectId(@Param("projectId") UUID projectId);

    @Modifying
    @Query("update Task t set t.deletedAt = :now where t.id in :taskIds and t.deletedAt is null")
    int softDeleteAll(@Param("taskIds") Collection<UUID> taskIds, @Param("now") OffsetDateTime now);

    @Query("""
            select t.project.id as projectId,
                   count(t) as total,
                   sum(case when t.status in :completed then 1 else 0 end) as completed
              from Task t
             where t.project.id in :projectIds
               and t.deletedAt is null
             group by t.project.id
            """)
    List<ProjectTaskStats> summarizeByProject(@Param("projectIds") Collection<UUID> projectIds,
                                              @Param("completed") Collection<TaskStatus> completed);

    interface ProjectTaskStats {
        UUID getProjectId();

        long getTotal();

        Long getCompleted();
    }
}
