package in.spreadarb.domain.balance;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Result of a distribution analysis over the pool.
 */
public record RebalanceRecommendation(
    List<RebalanceAction> actions,
    RebalanceUrgency urgency,
    String summary,
    Instant generatedAt
) {
    public RebalanceRecommendation {
        actions = actions == null ? List.of() : List.copyOf(actions);
        if (urgency == null) urgency = RebalanceUrgency.NONE;
    }

    public static RebalanceRecommendation balanced() {
        return new RebalanceRecommendation(List.of(), RebalanceUrgency.NONE, "Balances are evenly distributed", Instant.now());
    }

    public static RebalanceRecommendation of(List<RebalanceAction> actions) {
        RebalanceUrgency worst = actions.stream()
            .map(RebalanceAction::urgency)
            .max(Comparator.naturalOrder())
            .orElse(RebalanceUrgency.NONE);
        String summary = actions.isEmpty()
            ? "Balances are evenly distributed"
            : actions.size() + " asset(s) need rebalancing, urgency " + worst;
        return new RebalanceRecommendation(actions, worst, summary, Instant.now());
    }

    public boolean needsRebalance() {
        return !actions.isEmpty();
    }
}
