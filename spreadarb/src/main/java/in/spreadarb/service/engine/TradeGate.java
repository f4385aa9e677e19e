package in.spreadarb.service.engine;

import in.spreadarb.domain.strategy.RiskRules;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Risk admission before an execution is dispatched: trades per hour, minimum spacing
 * between trades, and open positions (in-flight plus stranded).
 */
public final class TradeGate {

    private final Deque<Instant> admitted = new ArrayDeque<>();

    /**
     * Admit or refuse one trade. An admitted trade counts towards the limits immediately.
     *
     * @return the refusal reason, empty when admitted
     */
    public synchronized Optional<String> admit(Instant now, int openPositions, RiskRules risk) {
        Instant hourAgo = now.minus(Duration.ofHours(1));
        while (!admitted.isEmpty() && admitted.peekFirst().isBefore(hourAgo)) {
            admitted.removeFirst();
        }
        if (risk.maxOpenPositions() > 0 && openPositions >= risk.maxOpenPositions()) {
            return Optional.of("max_open_positions");
        }
        if (risk.maxTradesPerHour() > 0 && admitted.size() >= risk.maxTradesPerHour()) {
            return Optional.of("max_trades_per_hour");
        }
        Instant last = admitted.peekLast();
        if (last != null && risk.minTimeBetweenTradesSeconds() > 0
            && Duration.between(last, now).getSeconds() < risk.minTimeBetweenTradesSeconds()) {
            return Optional.of("min_time_between_trades");
        }
        admitted.addLast(now);
        return Optional.empty();
    }

    public synchronized int admittedLastHour() {
        return admitted.size();
    }

    public synchronized void reset() {
        admitted.clear();
    }
}
