package com.coach.linkage.importer;

import com.coach.linkage.api.DedupOptions;
import com.coach.linkage.core.model.School;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves free-text school names from spreadsheets against the school registry.
 *
 * <p>The text is trimmed, lowercased and expanded through {@link SchoolAliases}, then each
 * {@link MatchTier} is tried in order over the whole registry. The strictest tier accepting
 * any school decides; within it the strongest school wins, the earliest on ties. Results are memoized per normalized text for the
 * lifetime of the matcher since the registry it was built with does not change.</p>
 */
public class OrganizationMatcher {
    private static final Logger log = LoggerFactory.getLogger(OrganizationMatcher.class);

    private final List<RegistryEntry> registry;
    private final List<MatchTier> tiers;
    private final Cache<String, Optional<SchoolMatch>> cache;

    public OrganizationMatcher(List<School> schools) {
        this(schools, MatchTier.defaults(), DedupOptions.defaults());
    }

    public OrganizationMatcher(List<School> schools, List<MatchTier> tiers, DedupOptions options) {
        this.registry = schools.stream()
                .filter(s -> s.getName() != null && !s.getName().isBlank())
                .map(s -> new RegistryEntry(s, s.getName().toLowerCase(Locale.ROOT)))
                .toList();
        this.tiers = List.copyOf(tiers);
        this.cache = Caffeine.newBuilder()
                .maximumSize(options.getMatchCacheSize())
                .recordStats()
                .build();
        log.debug("OrganizationMatcher initialized: schools={}, tiers={}", registry.size(), this.tiers.size());
    }

    /**
     * Finds the registry school for {@code freeText}.
     *
     * @return the match with its tier, or empty when no tier accepts any school
     */
    public Optional<SchoolMatch> resolve(String freeText) {
        if (freeText == null || freeText.isBlank()) {
            return Optional.empty();
        }
        String key = freeText.trim().toLowerCase(Locale.ROOT);
        return cache.get(key, k -> match(SearchTerm.of(k)));
    }

    private Optional<SchoolMatch> match(SearchTerm term) {
        for (MatchTier tier : tiers) {
            RegistryEntry best = null;
            int bestStrength = Integer.MIN_VALUE;
            for (RegistryEntry entry : registry) {
                if (tier.matches(term, entry.lowerName())) {
                    int strength = tier.strength(term, entry.lowerName());
                    if (strength > bestStrength) {
                        best = entry;
                        bestStrength = strength;
                    }
                }
            }
            if (best != null) {
                log.debug("import.match text='{}' school={} tier={}", term.text(), best.school().getId(), tier.tier());
                return Optional.of(new SchoolMatch(best.school(), tier.tier()));
            }
        }
        log.debug("import.match text='{}' tier=NONE", term.text());
        return Optional.empty();
    }

    public List<MatchTier> getTiers() {
        return tiers;
    }

    public int registrySize() {
        return registry.size();
    }

    public long cachedEntries() {
        return cache.estimatedSize();
    }

    /**
     * Hit and miss counts of the resolve memo since this matcher was built.
     */
    public CacheStats cacheStats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private record RegistryEntry(School school, String lowerName) {}
}
