package com.coach.linkage.core.model;

import java.util.Objects;

/**
 * A college coach tracked for recruiting-visit attendance.
 * Instances are immutable; merges produce an updated copy via {@link #builder(Coach)}.
 * A coach built without an id is new and gets its id from the store on insert.
 */
public class Coach implements LinkableRecord {
    private final String id;
    private final String firstName;
    private final String lastName;
    private final String email;
    private final String phone;
    private final String title;
    private final String schoolId;

    private Coach(Builder builder) {
        this.id = builder.id;
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.email = builder.email;
        this.phone = builder.phone;
        this.title = builder.title;
        this.schoolId = builder.schoolId;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getTitle() {
        return title;
    }

    public String getSchoolId() {
        return schoolId;
    }

    public String fullName() {
        return (firstName == null ? "" : firstName.trim()) + " " + (lastName == null ? "" : lastName.trim());
    }

    @Override
    public String displayName() {
        return fullName().trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Coach coach = (Coach) o;
        return Objects.equals(id, coach.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Coach{" +
                "id='" + id + '\'' +
                ", firstName='" + firstName + '\'' +
                ", lastName='" + lastName + '\'' +
                ", schoolId='" + schoolId + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Coach coach) {
        return new Builder()
                .id(coach.id)
                .firstName(coach.firstName)
                .lastName(coach.lastName)
                .email(coach.email)
                .phone(coach.phone)
                .title(coach.title)
                .schoolId(coach.schoolId);
    }

    public static class Builder {
        private String id;
        private String firstName;
        private String lastName;
        private String email;
        private String phone;
        private String title;
        private String schoolId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder schoolId(String schoolId) {
            this.schoolId = schoolId;
            return this;
        }

        public Coach build() {
            return new Coach(this);
        }
    }
}
