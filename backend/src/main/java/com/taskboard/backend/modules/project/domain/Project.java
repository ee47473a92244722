package com.taskboard.backend.modules.project.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskboard.backend.global.jpa.AbstractTimestampedEntity;
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
import org.springframework.data.annotation.CreatedBy;
import org.springframework.data.annotation.LastModifiedBy;

@Entity
@Table(name = "project")
public class Project extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "team_id", nullable = false, updatable = false)
    private Team team;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ProjectStatus status = ProjectStatus.PLANNING;

    @Column(name = "start_date")
    private OffsetDateTime startDate;

    @Column(name = "end_date")
    private OffsetDateTime endDate;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "color", length = 7)
    private String color;

    @Column(name = "position", nullable = false)
    private int position;

    @Column(name = "estimated_hours")
    private Integer estimatedHours;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @CreatedBy
    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @LastModifiedBy
    @Column(name = "updated_by")
    private UUID updatedBy;

    public static Project create(Team team, String name) {
        Project project = new Project();
        project.team = team;
        project.name = name;
        return project;
    }

    public boolean isOverdue(OffsetDateTime now) {
        return endDate != null && status.isActive() && now.isAfter(endDate);
    }

    public Long getDurationDays() {
        if (startDate == null || endDate == null) {
            return null;
        }
        return Duration.between(startDate, endDate).toDays();
    }

    public Long getDaysRemaining(OffsetDateTime now) {
        if (endDate == null || !status.isActive()) {
            return null;
        }
        return Math.max(0L, Duration.between(now, endDate).toDays());
    }

    public boolean hasValidTimeline() {
        return startDate == null || endDate == null || !startDate.isAfter(endDate);
    }

    /**
     * Stamps a missing start date with {@code now}, never later than a planned end date.
     */
    public void start(OffsetDateTime now) {
        status = ProjectStatus.ACTIVE;
        if (startDate == null) {
            startDate = endDate != null && now.isAfter(endDate) ? endDate : now;
        }
    }

    /**
     * Stamps a missing end date with {@code now}, never earlier than a planned start date.
     */
    public void complete(OffsetDateTime now) {
        status = ProjectStatus.COMPLETED;
        if (endDate == null) {
            endDate = startDate != null && now.isBefore(startDate) ? startDate : now;
        }
    }

    public void cancel() {
        status = ProjectStatus.CANCELLED;
        active = false;
    }

    public void hold() {
        status = ProjectStatus.ON_HOLD;
    }

    public boolean canResume() {
        return status == ProjectStatus.ON_HOLD;
    }

    public void resume() {
        if (!canResume()) {
            throw new IllegalStateException("only projects on hold can be resumed");
        }
        status = ProjectStatus.ACTIVE;
    }

    public void softDelete(OffsetDateTime now) {
        deletedAt = now;
        active = false;
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public ProjectStatus getStatus() {
        return status;
    }

    public OffsetDateTime getStartDate() {
        return startDate;
    }

    public void setStartDate(OffsetDateTime startDate) {
        this.startDate = startDate;
    }

    public OffsetDateTime getEndDate() {
        return endDate;
    }

    public void setEndDate(OffsetDateTime endDate) {
        this.endDate = endDate;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
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

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public UUID getCreatedBy() {
        return createdBy;
    }

    public UUID getUpdatedBy() {
        return updatedBy;
    }
}
