package com.coach.linkage.importer;

import com.coach.linkage.core.model.ConfidenceTier;

import java.util.List;
import java.util.function.BiPredicate;
import java.util.function.ToIntBiFunction;

/**
 * One heuristic of the school matcher: a predicate over the search term and a lowercase
 * registry name, labeled with the confidence it carries. When several registry names pass
 * the predicate, the one with the highest {@code strength} wins; ties go to registry order.
 *
 * @param tier      confidence reported when the predicate holds
 * @param predicate test of a search term against a lowercase registry name
 * @param strength  ranking among the names accepted by this tier
 */
public record MatchTier(ConfidenceTier tier,
                        BiPredicate<SearchTerm, String> predicate,
                        ToIntBiFunction<SearchTerm, String> strength) {

    static final int LOW_TIER_MIN_WORD_LENGTH = 4;

    public MatchTier(ConfidenceTier tier, BiPredicate<SearchTerm, String> predicate) {
        this(tier, predicate, (term, name) -> 0);
    }

    public boolean matches(SearchTerm term, String registryName) {
        return predicate.test(term, registryName);
    }

    public int strength(SearchTerm term, String registryName) {
        return strength.applyAsInt(term, registryName);
    }

    /**
     * The tiers in the order they are tried, strictest first.
     */
    public static List<MatchTier> defaults() {
        return List.of(
                new MatchTier(ConfidenceTier.EXACT, (term, name) -> name.equals(term.text())),
                new MatchTier(ConfidenceTier.HIGH,
                        (term, name) -> name.contains(term.text()) || term.text().contains(name)),
                new MatchTier(ConfidenceTier.MEDIUM, MatchTier::wordOverlap, MatchTier::wordsFound),
                new MatchTier(ConfidenceTier.LOW, MatchTier::partialWord, MatchTier::longWordsFound)
        );
    }

    private static boolean wordOverlap(SearchTerm term, String name) {
        return wordsFound(term, name) >= Math.max(1, term.words().size() - 1);
    }

    private static int wordsFound(SearchTerm term, String name) {
        return (int) term.words().stream().filter(name::contains).count();
    }

    private static boolean partialWord(SearchTerm term, String name) {
        return longWordsFound(term, name) > 0;
    }

    private static int longWordsFound(SearchTerm term, String name) {
        return (int) term.words().stream()
                .filter(w -> w.length() >= LOW_TIER_MIN_WORD_LENGTH && name.contains(w))
                .count();
    }
}
