package com.coach.linkage.store;

/**
 * Table and column names shared by the repositories.
 */
public final class Tables {

    private Tables() {
    }

    public static final String ID = "id";

    public static final String COACHES = "coaches";
    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String TITLE = "title";
    public static final String SCHOOL_ID = "school_id";

    public static final String SCHOOLS = "schools";
    public static final String SCHOOL = "school";
    public static final String CITY = "city";
    public static final String STATE = "state";
    public static final String DIVISION = "division";
    public static final String CONFERENCE = "conference";

    public static final String ATTENDANCE = "attendance";
    public static final String GAME_ID = "game_id";
    public static final String COACH_ID = "coach_id";

    static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
