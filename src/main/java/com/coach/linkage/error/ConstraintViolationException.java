package com.coach.linkage.error;

/**
 * Thrown by a store when a write would break a uniqueness constraint,
 * such as two attendance rows for the same (game, coach).
 */
public class ConstraintViolationException extends LinkageException {

    private final String constraint;

    public ConstraintViolationException(String constraint, String message) {
        super(message);
        this.constraint = constraint;
    }

    public String getConstraint() {
        return constraint;
    }
}
