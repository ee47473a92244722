package com.taskboard.backend.modules.task.domain;

public enum TaskPriority {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    URGENT(4);

    private final int score;

    TaskPriority(int score) {
        this.score = score;
    }

    public int getScore() {
        return score;
    }

    public boolean isHigherThan(TaskPriority other) {
        return score > other.score;
    }
}
