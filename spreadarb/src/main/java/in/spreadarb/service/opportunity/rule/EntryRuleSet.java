package in.spreadarb.service.opportunity.rule;

import in.spreadarb.domain.strategy.EntryRules;
import in.spreadarb.service.opportunity.EntryContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered rule table built from a strategy's entry section.
 * Disabled checks are simply left out of the table.
 */
public final class EntryRuleSet {
    private final List<EntryRule> rules;

    private EntryRuleSet(List<EntryRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static EntryRuleSet from(EntryRules entry) {
        List<EntryRule> rules = new ArrayList<>();
        rules.add(new SpreadRangeRule(entry.minSpreadPercent(), entry.maxSpreadPercent()));
        if (entry.minExpectedProfit() > 0) {
            rules.add(new MinProfitRule(entry.minExpectedProfit()));
        }
        rules.add(new VolumeRule(entry.minVolume24h()));
        if (entry.checkMomentum()) {
            rules.add(new MomentumRule(entry.momentumPeriodMinutes()));
        }
        if (entry.avoidHighVolatility()) {
            rules.add(new VolatilityRule(entry.maxVolatilityPercent(), entry.momentumPeriodMinutes()));
        }
        if (entry.checkOrderBookDepth()) {
            rules.add(new OrderBookDepthRule(entry.minOrderBookDepth(), entry.orderBookDepthLevels()));
        }
        if (entry.requiredConfirmations() > 1 || entry.spreadConfirmationSeconds() > 0) {
            rules.add(new SpreadConfirmationRule(entry.requiredConfirmations(), entry.spreadConfirmationSeconds()));
        }
        return new EntryRuleSet(rules);
    }

    /**
     * Every failing rule's reason, in table order.
     */
    public List<String> rejections(EntryContext context) {
        List<String> reasons = new ArrayList<>();
        for (EntryRule rule : rules) {
            Optional<String> reason = rule.check(context);
            reason.ifPresent(reasons::add);
        }
        return reasons;
    }

    public int size() {
        return rules.size();
    }
}
