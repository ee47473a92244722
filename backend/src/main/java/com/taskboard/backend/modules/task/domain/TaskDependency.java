package com.taskboard.backend.modules.task.domain;

import java.util.UUID;

import com.taskboard.backend.global.jpa.AbstractTimestampedEntity;
import com.taskboard.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * {@code dependent} cannot finish before {@code prerequisite}. The edge blocks while the prerequisite is not completed.
 */
@Entity
@Table(name = "task_dependency",
        uniqueConstraints = @UniqueConstraint(name = "uq_task_dependency_pair", columnNames = {"dependent_task_id", "prerequisite_task_id"}))
public class TaskDependency extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "dependent_task_id", nullable = false, updatable = false)
    private Task dependent;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prerequisite_task_id", nullable = false, updatable = false)
    private Task prerequisite;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "created_by")
    private AppUser createdBy;

    public static TaskDependency of(Task dependent, Task prerequisite, AppUser createdBy) {
        if (dependent == prerequisite || (dependent.getId() != null && dependent.getId().equals(prerequisite.getId()))) {
            throw new IllegalArgumentException("a task cannot depend on itself");
        }
        TaskDependency dependency = new TaskDependency();
        dependency.dependent = dependent;
        dependency.prerequisite = prerequisite;
        dependency.createdBy = createdBy;
        return dependency;
    }

    public boolean isBlocking() {
        return !prerequisite.isDeleted() && !prerequisite.getStatus().isCompleted();
    }

    public UUID getId() {
        return id;
    }

    public Task getDependent() {
        return dependent;
    }

    public Task getPrerequisite() {
        return prerequisite;
    }

    public AppUser getCreatedBy() {
        return createdBy;
    }
}
