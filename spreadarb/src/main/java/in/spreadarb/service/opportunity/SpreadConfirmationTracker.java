package in.spreadarb.service.opportunity;

import in.spreadarb.domain.trade.ArbitrageDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts consecutive cycles in which a pair's spread met the minimum in the same direction.
 * A miss or a direction flip resets the streak.
 */
public final class SpreadConfirmationTracker {

    public record Confirmation(int count, Duration heldFor) {}

    private record Streak(ArbitrageDirection direction, int count, Instant since) {}

    private final ConcurrentHashMap<String, Streak> streaks = new ConcurrentHashMap<>();

    public Confirmation observe(String symbol, ArbitrageDirection direction, boolean meetsMinimum, Instant now) {
        if (!meetsMinimum) {
            streaks.remove(symbol);
            return new Confirmation(0, Duration.ZERO);
        }
        Streak streak = streaks.compute(symbol, (k, current) -> {
            if (current == null || current.direction() != direction) {
                return new Streak(direction, 1, now);
            }
            return new Streak(direction, current.count() + 1, current.since());
        });
        return new Confirmation(streak.count(), Duration.between(streak.since(), now));
    }

    public void reset(String symbol) {
        streaks.remove(symbol);
    }

    public void clear() {
        streaks.clear();
    }
}
