package com.coach.linkage.core.model;

import java.util.Objects;

/**
 * A college or university in the canonical school registry.
 */
public class School implements LinkableRecord {
    private final String id;
    private final String name;
    private final String city;
    private final String state;
    private final String division;
    private final String conference;

    private School(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.city = builder.city;
        this.state = builder.state;
        this.division = builder.division;
        this.conference = builder.conference;
    }

    @Override
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getCity() {
        return city;
    }

    public String getState() {
        return state;
    }

    public String getDivision() {
        return division;
    }

    public String getConference() {
        return conference;
    }

    @Override
    public String displayName() {
        return name != null ? name : id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        School school = (School) o;
        return Objects.equals(id, school.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "School{id='" + id + "', name='" + name + "', state='" + state + "'}";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(School school) {
        return new Builder()
                .id(school.id)
                .name(school.name)
                .city(school.city)
                .state(school.state)
                .division(school.division)
                .conference(school.conference);
    }

    public static class Builder {
        private String id;
        private String name;
        private String city;
        private String state;
        private String division;
        private String conference;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder city(String city) {
            this.city = city;
            return this;
        }

        public Builder state(String state) {
            this.state = state;
            return this;
        }

        public Builder division(String division) {
            this.division = division;
            return this;
        }

        public Builder conference(String conference) {
            this.conference = conference;
            return this;
        }

        public School build() {
            Objects.requireNonNull(id, "id is required");
            return new School(this);
        }
    }
}
