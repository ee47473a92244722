package com.taskboard.backend.modules.task.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.global.jpa.AbstractTimestampedEntity;
import com.taskboard.backend.modules.auth.domain.AppUser;
import com.taskboard.backend.modules.project.domain.Project;
import com.taskboard.backend.modules.team.domain.Team;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "task")
public class Task extends AbstractTimestampedEntity {

    private static final long SECONDS_PER_DAY = 86_400L;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "team_id", nullable = false, updatable = false)
    private Team team;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "creator_id", nullable = false, updatable = false)
    private AppUser creator;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "project_id")
    private Project project;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TaskStatus status = TaskStatus.TODO;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 16)
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Column(name = "due_date")
    private OffsetDateTime dueDate;

    @Column(name = "started_at")
    private OffsetDateTime startedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "estimated_hours")
    private Integer estimatedHours;

    @Column(name = "actual_hours")
    private Integer actualHours;

    @Column(name = "is_archived", nullable = false)
    private boolean archived;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    public static Task create(Team team, AppUser creator, String title) {
        Task task = new Task();
        task.team = team;
        task.creator = creator;
        task.title = title;
        return task;
    }

    /**
     * Moves the task to {@code target} and maintains the lifecycle timestamps.
     * Callers check {@link TaskStatus#canTransitionTo(TaskStatus)} and blocking beforehand.
     */
    public void applyStatus(TaskStatus target, OffsetDateTime now) {
        switch (target) {
            case TODO -> {
                startedAt = null;
                completedAt = null;
            }
            case IN_PROGRESS, IN_REVIEW -> {
                if (startedAt == null) {
                    startedAt = now;
                }
                completedAt = null;
            }
            case DONE, CANCELLED -> completedAt = now;
        }
        status = target;
    }

    public boolean isOverdue(OffsetDateTime now) {
        return dueDate != null && status.isActive() && now.isAfter(dueDate);
    }

    /**
     * Whole days until the due date, floored, so any time past the due date is negative; null without a due date.
     */
    public Long getDaysUntilDue(OffsetDateTime now) {
        if (dueDate == null) {
            return null;
        }
        return Math.floorDiv(Duration.between(now, dueDate).getSeconds(), SECONDS_PER_DAY);
    }

    public boolean belongsToTeam(UUID teamId) {
        return team.getId().equals(teamId);
    }

    public void softDelete(OffsetDateTime now) {
        deletedAt = now;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public UUID getId() {
        return id;
    }

    public Team getTeam() {
        return team;
    }

    public AppUser getCreator() {
        return creator;
    }

    public Project getProject() {
        return project;
    }

    public void setProject(Project project) {
        this.project = project;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public TaskPriority getPriority() {
        return priority;
    }

    public void setPriority(TaskPriority priority) {
        this.priority = priority;
    }

    public OffsetDateTime getDueDate() {
        return dueDate;
    }

    public void setDueDate(OffsetDateTime dueDate) {
        this.dueDate = dueDate;
    }

    public OffsetDateTime getStartedAt() {
        return startedAt;
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public Integer getEstimatedHours() {
        return estimatedHours;
    }

    public void setEstimatedHours(Integer estimatedHours) {
        this.estimatedHours = estimatedHours;
    }

    public Integer getActualHours() {
        return actualHours;
    }

    public void setActualHours(Integer actualHours) {
        this.actualHours = actualHours;
    }

    public boolean isArchived() {
        return archived;
    }

    public void setArchived(boolean archived) {
        this.archived = archived;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }
}
