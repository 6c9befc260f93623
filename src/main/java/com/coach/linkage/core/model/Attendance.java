package com.coach.linkage.core.model;

import java.util.Objects;

/**
 * One coach seen at one game. At most one row exists per (gameId, coachId).
 */
public record Attendance(String id, String gameId, String coachId) {
    public Attendance {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(gameId, "gameId is required");
        Objects.requireNonNull(coachId, "coachId is required");
    }
}
