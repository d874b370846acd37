package com.fintech.candlesync.source;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a user-facing instrument name onto one of the provider's native symbols.
 *
 * <p>Candidates are collected in confidence tiers: exact (case-insensitive) match, prefix match,
 * substring match, then the static alias table. The best candidate wins by tier, then by the
 * shortest native name, then alphabetically. Stateless: caching belongs to the caller.
 */
public class SymbolResolver {

    /**
     * Broker spellings for common index CFDs, keyed by lower-case user-facing name.
     */
    static final Map<String, List<String>> ALIASES = Map.of(
        "ustech", List.of("nas100", "ustec", "us100", "nq100", "ndx100", "nasdaq"),
        "us30", List.of("us30", "dj30", "dji30", "wallst30", "dow30"),
        "us500", List.of("us500", "spx500", "sp500"),
        "ger40", List.of("ger40", "de40", "dax40")
    );

    enum MatchTier {
        // declared from weakest to strongest
        ALIAS_PREFIX,
        ALIAS_EXACT,
        SUBSTRING,
        PREFIX,
        EXACT
    }

    record Candidate(String nativeSymbol, MatchTier tier) {
    }

    private static final Comparator<Candidate> BEST_FIRST = Comparator
        .comparing(Candidate::tier, Comparator.reverseOrder())
        .thenComparingInt((Candidate c) -> c.nativeSymbol().length())
        .thenComparing(Candidate::nativeSymbol);

    /**
     * Resolves {@code instrument} against the provider's symbol directory.
     *
     * @param instrument User-facing name, e.g. "USTech"
     * @param nativeSymbols Every symbol the provider offers
     * @return The best matching native symbol, empty if nothing matches
     */
    public Optional<String> resolve(String instrument, List<String> nativeSymbols) {
        String wanted = instrument.trim().toLowerCase(Locale.ROOT);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        List<String> aliases = ALIASES.getOrDefault(wanted, List.of());

        return nativeSymbols.stream()
            .map(symbol -> classify(symbol, wanted, aliases))
            .flatMap(Optional::stream)
            .min(BEST_FIRST)
            .map(Candidate::nativeSymbol);
    }

    private Optional<Candidate> classify(String nativeSymbol, String wanted, List<String> aliases) {
        String candidate = nativeSymbol.toLowerCase(Locale.ROOT);
        MatchTier tier = null;
        if (candidate.equals(wanted)) {
            tier = MatchTier.EXACT;
        } else if (candidate.startsWith(wanted)) {
            tier = MatchTier.PREFIX;
        } else if (candidate.contains(wanted)) {
            tier = MatchTier.SUBSTRING;
        } else if (aliases.contains(candidate)) {
            tier = MatchTier.ALIAS_EXACT;
        } else if (aliases.stream().anyMatch(candidate::startsWith)) {
            tier = MatchTier.ALIAS_PREFIX;
        }
        return Optional.ofNullable(tier).map(t -> new Candidate(nativeSymbol, t));
    }
}
