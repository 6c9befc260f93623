package com.coach.linkage.candidate;

import com.coach.linkage.core.model.Coach;
import com.coach.linkage.core.model.CoachValidator;
import com.coach.linkage.core.model.MatchType;
import com.coach.linkage.names.NameVariantResolver;
import com.coach.linkage.similarity.NameMatchScorer;
import com.coach.linkage.suppression.SuppressionStore;

/**
 * Finds likely duplicate coaches within each school.
 * Coaches at different schools are never paired, and neither are coaches without a school.
 */
public class CoachCandidateGenerator extends CandidateGenerator<Coach> {

    private final NameVariantResolver nameVariantResolver;
    private final NameMatchScorer nameMatchScorer;

    public CoachCandidateGenerator(SuppressionStore suppressionStore) {
        this(suppressionStore, new NameVariantResolver(), new NameMatchScorer());
    }

    public CoachCandidateGenerator(SuppressionStore suppressionStore,
                                   NameVariantResolver nameVariantResolver,
                                   NameMatchScorer nameMatchScorer) {
        super(suppressionStore);
        this.nameVariantResolver = nameVariantResolver;
        this.nameMatchScorer = nameMatchScorer;
    }

    @Override
    protected Object partitionKey(Coach coach) {
        return coach.getSchoolId();
    }

    @Override
    protected boolean isValid(Coach coach) {
        return CoachValidator.hasRequiredNames(coach);
    }

    @Override
    protected MatchType classify(Coach a, Coach b) {
        return nameVariantResolver.classify(a.getLastName(), b.getLastName(), a.getFirstName(), b.getFirstName());
    }

    @Override
    protected int score(Coach a, Coach b) {
        return nameMatchScorer.score(a, b);
    }
}
