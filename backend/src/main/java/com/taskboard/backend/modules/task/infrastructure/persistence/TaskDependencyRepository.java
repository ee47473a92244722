package com.taskboard.backend.modules.task.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.taskboard.backend.modules.task.domain.TaskDependency;
import com.taskboard.backend.modules.task.domain.TaskStatus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskDependencyRepository extends JpaRepository<TaskDependency, UUID> {

    @Query("""
            select d from TaskDependency d
             where d.dependent.id = :dependentId
               and d.prerequisite.id = :prerequisiteId
            """)
    Optional<TaskDependency> findByPair(@Param("dependentId") UUID dependentId,
                                        @Param("prerequisiteId") UUID prerequisiteId);

    @Query("""
            select case when count(d) > 0 then true else false end
              from TaskDependency d
             where d.dependent.id = :dependentId
               and d.prerequisite.id = :prerequisiteId
            """)
    boolean existsByPair(@Param("dependentId") UUID dependentId, @Param("prerequisiteId") UUID prerequisiteId);

    @Query("""
            select d from TaskDependency d
              join fetch d.prerequisite p
             where d.dependent.id = :taskId
               and p.deletedAt is null
             order by d.createdAt asc
            """)
    List<TaskDependency> findPrerequisites(@Param("taskId") UUID taskId);

    @Query("""
            select d from TaskDependency d
              join fetch d.dependent t
             where d.prerequisite.id = :taskId
               and t.deletedAt is null
             order by d.createdAt asc
            """)
    List<TaskDependency> findDependents(@Param("taskId") UUID taskId);

    /**
     * Direct prerequisite ids of the given tasks; used to walk the graph.
     */
    @Query("select d.prerequisite.id from TaskDependency d where d.dependent.id in :taskIds")
    List<UUID> findPrerequisiteIds(@Param("taskIds") Collection<UUID> taskIds);

    @Query("""
            select distinct d.dependent.id from TaskDependency d
              join d.prerequisite p
             where d.dependent.id in :taskIds
               and p.deletedAt is null
               and p.status not in :completed
            """)
    List<UUID> findBlockedTaskIds(@Param("taskIds") Collection<UUID> taskIds,
                                  @Param("completed") Collection<TaskStatus> completed);

    @Query("""
            select d.prerequisite.id as taskId, count(d) as total
              from TaskDependency d
              join d.dependent t
             where d.prerequisite.id in :taskIds
               and t.deletedAt is null
               and t.status in :active
             group by d.prerequisite.id
            """)
    List<TaskCount> countActiveDependents(@Param("taskIds") Collection<UUID> taskIds,
                                          @Param("active") Collection<TaskStatus> active);

    @Modifying
    @Query("delete from TaskDependency d where d.dependent.id in :taskIds or d.prerequisite.id in :taskIds")
    int deleteByTaskIds(@Param("taskIds") Collection<UUID> taskIds);

    interface TaskCount {
        UUID getTaskId();

        long getTotal();
    }
}
