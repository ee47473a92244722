package com.taskboard.backend.modules.task.domain;

import java.time.OffsetDateTime;
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

@Entity
@Table(name = "task_assignment",
        uniqueConstraints = @UniqueConstraint(name = "uq_task_assignment_task_assignee", columnNames = {"task_id", "assignee_id"}))
public class TaskAssignment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false, updatable = false)
    private Task task;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "assignee_id", nullable = false, updatable = false)
    private AppUser assignee;

    @Column(name = "assigned_at", nullable = false)
    private OffsetDateTime assignedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assigned_by")
    private AppUser assignedBy;

    public static TaskAssignment of(Task task, AppUser assignee, AppUser assignedBy, OffsetDateTime now) {
        TaskAssignment assignment = new TaskAssignment();
        assignment.task = task;
        assignment.assignee = assignee;
        assignment.assignedBy = assignedBy;
        assignment.assignedAt = now;
        return assignment;
    }

    public UUID getId() {
        return id;
    }

    public Task getTask() {
        return task;
    }

    public AppUser getAssignee() {
        return assignee;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public AppUser getAssignedBy() {
        return assignedBy;
    }
}
