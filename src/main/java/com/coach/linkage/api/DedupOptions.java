package com.coach.linkage.api;

import com.coach.linkage.merge.MergePolicy;

/**
 * Tunable thresholds for duplicate detection, merging and import matching.
 * Defaults reproduce the behavior operators are used to; override through {@link #builder()}.
 */
public class DedupOptions {

    private static final int DEFAULT_INITIAL_NAME_MAX_LENGTH = MergePolicy.DEFAULT_INITIAL_NAME_MAX_LENGTH;
    private static final int DEFAULT_LAST_NAME_MAX_DISTANCE = 1;
    private static final int DEFAULT_FIRST_NAME_MAX_DISTANCE = 2;
    private static final int DEFAULT_MAX_INPUT_LENGTH = 256;
    private static final double DEFAULT_SCHOOL_SIMILARITY_THRESHOLD = 0.90;
    private static final double DEFAULT_SCHOOL_CONTAINMENT_RATIO = 0.60;
    private static final int DEFAULT_MATCH_CACHE_SIZE = 5_000;
    private static final String DEFAULT_COACH_SUPPRESSION_KEY = "dismissedCoachPairs";
    private static final String DEFAULT_SCHOOL_SUPPRESSION_KEY = "dismissedSchoolPairs";

    private final int initialNameMaxLength;
    private final int lastNameMaxDistance;
    private final int firstNameMaxDistance;
    private final int maxInputLength;
    private final double schoolSimilarityThreshold;
    private final double schoolContainmentRatio;
    private final int matchCacheSize;
    private final String coachSuppressionKey;
    private final String schoolSuppressionKey;

    private DedupOptions(Builder builder) {
        this.initialNameMaxLength = builder.initialNameMaxLength;
        this.lastNameMaxDistance = builder.lastNameMaxDistance;
        this.firstNameMaxDistance = builder.firstNameMaxDistance;
        this.maxInputLength = builder.maxInputLength;
        this.schoolSimilarityThreshold = builder.schoolSimilarityThreshold;
        this.schoolContainmentRatio = builder.schoolContainmentRatio;
        this.matchCacheSize = builder.matchCacheSize;
        this.coachSuppressionKey = builder.coachSuppressionKey;
        this.schoolSuppressionKey = builder.schoolSuppressionKey;
    }

    /**
     * A keeper first name at most this long is treated as an initial and
     * replaced by the loser's longer first name on merge.
     */
    public int getInitialNameMaxLength() {
        return initialNameMaxLength;
    }

    public int getLastNameMaxDistance() {
        return lastNameMaxDistance;
    }

    public int getFirstNameMaxDistance() {
        return firstNameMaxDistance;
    }

    /**
     * Strings longer than this are truncated before computing edit distance.
     */
    public int getMaxInputLength() {
        return maxInputLength;
    }

    public double getSchoolSimilarityThreshold() {
        return schoolSimilarityThreshold;
    }

    public double getSchoolContainmentRatio() {
        return schoolContainmentRatio;
    }

    public int getMatchCacheSize() {
        return matchCacheSize;
    }

    public String getCoachSuppressionKey() {
        return coachSuppressionKey;
    }

    public String getSchoolSuppressionKey() {
        return schoolSuppressionKey;
    }

    public static DedupOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int initialNameMaxLength = DEFAULT_INITIAL_NAME_MAX_LENGTH;
        private int lastNameMaxDistance = DEFAULT_LAST_NAME_MAX_DISTANCE;
        private int firstNameMaxDistance = DEFAULT_FIRST_NAME_MAX_DISTANCE;
        private int maxInputLength = DEFAULT_MAX_INPUT_LENGTH;
        private double schoolSimilarityThreshold = DEFAULT_SCHOOL_SIMILARITY_THRESHOLD;
        private double schoolContainmentRatio = DEFAULT_SCHOOL_CONTAINMENT_RATIO;
        private int matchCacheSize = DEFAULT_MATCH_CACHE_SIZE;
        private String coachSuppressionKey = DEFAULT_COACH_SUPPRESSION_KEY;
        private String schoolSuppressionKey = DEFAULT_SCHOOL_SUPPRESSION_KEY;

        public Builder initialNameMaxLength(int initialNameMaxLength) {
            requireNonNegative(initialNameMaxLength, "initialNameMaxLength");
            this.initialNameMaxLength = initialNameMaxLength;
            return this;
        }

        public Builder lastNameMaxDistance(int lastNameMaxDistance) {
            requireNonNegative(lastNameMaxDistance, "lastNameMaxDistance");
            this.lastNameMaxDistance = lastNameMaxDistance;
            return this;
        }

        public Builder firstNameMaxDistance(int firstNameMaxDistance) {
            requireNonNegative(firstNameMaxDistance, "firstNameMaxDistance");
            this.firstNameMaxDistance = firstNameMaxDistance;
            return this;
        }

        public Builder maxInputLength(int maxInputLength) {
            if (maxInputLength <= 0) {
                throw new IllegalArgumentException("maxInputLength must be > 0");
            }
            this.maxInputLength = maxInputLength;
            return this;
        }

        public Builder schoolSimilarityThreshold(double schoolSimilarityThreshold) {
            requireRatio(schoolSimilarityThreshold, "schoolSimilarityThreshold");
            this.schoolSimilarityThreshold = schoolSimilarityThreshold;
            return this;
        }

        public Builder schoolContainmentRatio(double schoolContainmentRatio) {
            requireRatio(schoolContainmentRatio, "schoolContainmentRatio");
            this.schoolContainmentRatio = schoolContainmentRatio;
            return this;
        }

        public Builder matchCacheSize(int matchCacheSize) {
            if (matchCacheSize <= 0) {
                throw new IllegalArgumentException("matchCacheSize must be > 0");
            }
            this.matchCacheSize = matchCacheSize;
            return this;
        }

        public Builder coachSuppressionKey(String coachSuppressionKey) {
            this.coachSuppressionKey = requireKey(coachSuppressionKey, "coachSuppressionKey");
            return this;
        }

        public Builder schoolSuppressionKey(String schoolSuppressionKey) {
            this.schoolSuppressionKey = requireKey(schoolSuppressionKey, "schoolSuppressionKey");
            return this;
        }

        public DedupOptions build() {
            if (coachSuppressionKey.equals(schoolSuppressionKey)) {
                throw new IllegalArgumentException("Coach and school suppression keys must differ");
            }
            return new DedupOptions(this);
        }

        private static void requireNonNegative(int value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
        }

        private static void requireRatio(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }

        private static String requireKey(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value;
        }
    }
}
