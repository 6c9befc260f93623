package com.coach.linkage.importer;

import com.coach.linkage.core.model.ConfidenceTier;
import com.coach.linkage.core.model.School;

/**
 * A registry school resolved for a free-text name.
 */
public record SchoolMatch(School school, ConfidenceTier tier) {
}
