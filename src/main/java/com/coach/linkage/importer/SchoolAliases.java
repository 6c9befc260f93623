package com.coach.linkage.importer;

import java.util.Map;

/**
 * Common short names of schools mapped to their registry names.
 * Keys and values are lowercase.
 */
public final class SchoolAliases {

    private static final Map<String, String> ALIASES = Map.of(
            "mizzou", "university of missouri",
            "pitt", "university of pittsburgh",
            "penn state", "pennsylvania state university",
            "osu", "ohio state university",
            "usc", "university of southern california",
            "ucla", "university of california, los angeles",
            "unc", "university of north carolina",
            "lsu", "louisiana state university",
            "ole miss", "university of mississippi",
            "umass", "university of massachusetts"
    );

    private SchoolAliases() {
    }

    /**
     * Returns the registry name for a normalized alias, or the input unchanged.
     */
    public static String expand(String normalized) {
        return ALIASES.getOrDefault(normalized, normalized);
    }

    public static Map<String, String> all() {
        return ALIASES;
    }
}
