package in.spreadarb.service.engine;

import in.spreadarb.domain.trade.DailyStats;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.domain.trade.TradeResultStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-UTC-day trade counters. Rolls over on the first access after midnight UTC.
 * Cancelled attempts are not counted.
 */
public final class DailyStatsTracker {
    private static final Logger log = LoggerFactory.getLogger(DailyStatsTracker.class);

    private final Clock clock;
    private final AtomicReference<DailyStats> today;

    public DailyStatsTracker(Clock clock) {
        this.clock = clock;
        this.today = new AtomicReference<>(DailyStats.empty(currentDate()));
    }

    public void record(TradeResult result) {
        if (result.status() == TradeResultStatus.CANCELLED) {
            return;
        }
        rollIfNeeded();
        today.updateAndGet(stats -> stats.plus(result));
    }

    public DailyStats today() {
        rollIfNeeded();
        return today.get();
    }

    public void rollIfNeeded() {
        LocalDate date = currentDate();
        DailyStats current = today.get();
        if (!current.date().equals(date) && today.compareAndSet(current, DailyStats.empty(date))) {
            log.info("[STATS] Day {} closed: {} trades, net {}, win rate {}%", current.date(),
                current.totalTrades(), current.totalNetPnl(), current.winRate());
        }
    }

    public void reset() {
        today.set(DailyStats.empty(currentDate()));
        log.info("[STATS] Daily stats reset");
    }

    private LocalDate currentDate() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC));
    }
}
