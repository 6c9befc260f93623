package com.coach.linkage.merge;

import com.coach.linkage.core.model.LinkableRecord;

import java.util.List;
import java.util.Map;

/**
 * Field updates staged onto a keeper before it absorbs a loser.
 *
 * @param updatedKeeper the keeper as it looks once {@code updates} are applied
 * @param updates       column to new value, applied in a single update; may be empty
 * @param mergedFields  human-readable names of the fields taken from the loser
 */
public record FieldReconciliation<T extends LinkableRecord>(
        T updatedKeeper,
        Map<String, Object> updates,
        List<String> mergedFields
) {
    public FieldReconciliation {
        updates = Map.copyOf(updates);
        mergedFields = List.copyOf(mergedFields);
    }

    public boolean hasUpdates() {
        return !updates.isEmpty();
    }
}
