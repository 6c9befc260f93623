package com.coach.linkage.core.model;

import com.coach.linkage.error.ValidationException;

/**
 * Name checks applied before a coach is matched or written.
 */
public final class CoachValidator {

    private CoachValidator() {
    }

    public static boolean hasRequiredNames(Coach coach) {
        return !isBlank(coach.getFirstName()) && !isBlank(coach.getLastName());
    }

    /**
     * @throws ValidationException if the first or last name is empty after trimming
     */
    public static void requireNames(Coach coach) {
        if (isBlank(coach.getFirstName())) {
            throw new ValidationException("First name is required for coach " + describe(coach));
        }
        if (isBlank(coach.getLastName())) {
            throw new ValidationException("Last name is required for coach " + describe(coach));
        }
    }

    private static String describe(Coach coach) {
        return coach.getId() != null ? coach.getId() : "'" + coach.displayName() + "'";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
