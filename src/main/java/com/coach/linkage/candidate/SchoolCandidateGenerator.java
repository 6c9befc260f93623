package com.coach.linkage.candidate;

import com.coach.linkage.api.DedupOptions;
import com.coach.linkage.core.model.MatchType;
import com.coach.linkage.core.model.School;
import com.coach.linkage.rules.NormalizationEngine;
import com.coach.linkage.rules.SchoolNameRules;
import com.coach.linkage.similarity.LevenshteinDistance;
import com.coach.linkage.suppression.SuppressionStore;

import java.util.Locale;
import java.util.Objects;

/**
 * Finds likely duplicate schools across the whole registry.
 *
 * <p>EXACT when the names are equal as typed or after {@link SchoolNameRules} normalization.
 * FUZZY when normalized names are at least {@code schoolSimilarityThreshold} similar, or,
 * for two schools in the same state, when one normalized name contains the other and
 * covers at least {@code schoolContainmentRatio} of it, or when the names differ only by a
 * known abbreviation.</p>
 */
public class SchoolCandidateGenerator extends CandidateGenerator<School> {

    // Every school belongs to one partition: the whole registry is compared.
    private static final Object SINGLE_PARTITION = "all";

    static final int IDENTICAL_POINTS = 100;
    static final int NORMALIZED_IDENTICAL_POINTS = 90;
    static final int SAME_STATE_POINTS = 20;
    static final int SAME_DIVISION_POINTS = 10;
    static final int SAME_CONFERENCE_POINTS = 15;
    static final int SIMILARITY_POINTS = 50;

    private final NormalizationEngine normalizer;
    private final LevenshteinDistance levenshtein;
    private final double similarityThreshold;
    private final double containmentRatio;

    public SchoolCandidateGenerator(SuppressionStore suppressionStore) {
        this(suppressionStore, SchoolNameRules.createEngine(), new LevenshteinDistance(), DedupOptions.defaults());
    }

    public SchoolCandidateGenerator(SuppressionStore suppressionStore, NormalizationEngine normalizer,
                                    LevenshteinDistance levenshtein, DedupOptions options) {
        super(suppressionStore);
        this.normalizer = normalizer;
        this.levenshtein = levenshtein;
        this.similarityThreshold = options.getSchoolSimilarityThreshold();
        this.containmentRatio = options.getSchoolContainmentRatio();
    }

    @Override
    protected Object partitionKey(School school) {
        return SINGLE_PARTITION;
    }

    @Override
    protected boolean isValid(School school) {
        return school.getName() != null && !school.getName().isBlank();
    }

    @Override
    protected MatchType classify(School a, School b) {
        String norm1 = normalizer.normalize(a.getName());
        String norm2 = normalizer.normalize(b.getName());
        if (lower(a.getName()).equals(lower(b.getName())) || norm1.equals(norm2)) {
            return MatchType.EXACT;
        }

        if (levenshtein.similarity(norm1, norm2) >= similarityThreshold) {
            return MatchType.FUZZY;
        }

        if (sameState(a, b)) {
            if (norm1.contains(norm2) || norm2.contains(norm1)) {
                int shorter = Math.min(norm1.length(), norm2.length());
                int longer = Math.max(norm1.length(), norm2.length());
                if ((double) shorter / longer >= containmentRatio) {
                    return MatchType.FUZZY;
                }
            }
            if (SchoolNameRules.areAbbreviationVariants(a.getName(), b.getName())) {
                return MatchType.FUZZY;
            }
        }
        return MatchType.NONE;
    }

    @Override
    protected int score(School a, School b) {
        String norm1 = normalizer.normalize(a.getName());
        String norm2 = normalizer.normalize(b.getName());
        int score = 0;
        if (lower(a.getName()).equals(lower(b.getName()))) {
            score += IDENTICAL_POINTS;
        } else if (norm1.equals(norm2)) {
            score += NORMALIZED_IDENTICAL_POINTS;
        }
        if (sameState(a, b)) score += SAME_STATE_POINTS;
        if (a.getDivision() != null && Objects.equals(a.getDivision(), b.getDivision())) score += SAME_DIVISION_POINTS;
        if (a.getConference() != null && Objects.equals(a.getConference(), b.getConference())) score += SAME_CONFERENCE_POINTS;
        score += (int) Math.round(levenshtein.similarity(norm1, norm2) * SIMILARITY_POINTS);
        return score;
    }

    private static boolean sameState(School a, School b) {
        return a.getState() != null && !a.getState().isBlank()
                && b.getState() != null
                && a.getState().equalsIgnoreCase(b.getState());
    }

    private static String lower(String s) {
        return s.trim().toLowerCase(Locale.ROOT);
    }
}
