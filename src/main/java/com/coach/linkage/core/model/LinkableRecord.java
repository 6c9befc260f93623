package com.coach.linkage.core.model;

/**
 * A record that can take part in duplicate detection and merging.
 */
public interface LinkableRecord {

    String getId();

    /**
     * Human-readable label used in scan output and merge summaries.
     */
    String displayName();
}
