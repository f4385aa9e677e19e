package in.spreadarb.service.opportunity;

import in.spreadarb.domain.strategy.EntryRules;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.HeldInventory;
import in.spreadarb.service.opportunity.rule.EntryRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Holds the active trading strategy and answers entry and exit questions against it.
 *
 * A reload swaps the strategy atomically; callers that read {@link #current()} once per
 * cycle never see a mix of two strategies.
 */
public final class StrategyEvaluator {
    private static final Logger log = LoggerFactory.getLogger(StrategyEvaluator.class);

    private volatile TradingStrategy strategy;
    private volatile CachedRules cachedRules;

    public StrategyEvaluator(TradingStrategy initial) {
        if (initial == null || !initial.isValid()) {
            throw new IllegalArgumentException("A valid strategy is required");
        }
        this.strategy = initial;
    }

    public TradingStrategy current() {
        return strategy;
    }

    public void reload(TradingStrategy next) {
        if (next == null || !next.isValid()) {
            throw new IllegalArgumentException("Strategy " + (next == null ? "null" : next.id()) + " is invalid");
        }
        TradingStrategy previous = strategy;
        strategy = next;
        log.info("[STRATEGY] Reloaded {} v{} -> {} v{}", previous.id(), previous.version(), next.id(), next.version());
    }

    /**
     * Rule table for an entry section, rebuilt only when the section changes.
     */
    public EntryRuleSet entryRules(EntryRules entry) {
        CachedRules cached = cachedRules;
        if (cached == null || !cached.entry().equals(entry)) {
            cached = new CachedRules(entry, EntryRuleSet.from(entry));
            cachedRules = cached;
        }
        return cached.rules();
    }

    public boolean meetsMinimumSpread(EntryRules entry, BigDecimal netSpreadPercent) {
        return netSpreadPercent.compareTo(BigDecimal.valueOf(entry.minSpreadPercent())) >= 0;
    }

    public Optional<ExitReason> evaluateExit(HeldInventory position, BigDecimal highestPrice,
                                             BigDecimal currentPrice, Instant now) {
        return ExitEvaluator.evaluate(strategy.exit(), position.averageCost(), highestPrice, currentPrice,
            Duration.between(position.acquiredAt(), now));
    }

    private record CachedRules(EntryRules entry, EntryRuleSet rules) {}
}
