package in.spreadarb.service.execution;

import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.trade.ExitReason;
import in.spreadarb.domain.trade.ExitSignal;
import in.spreadarb.domain.trade.HeldInventory;
import in.spreadarb.service.core.EngineEventBus;
import in.spreadarb.service.market.LatestTickerTable;
import in.spreadarb.service.opportunity.ExitEvaluator;
import in.spreadarb.service.opportunity.StrategyEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches inventory stranded by failed sell legs and recommends exits.
 *
 * Signals are advisory: nothing here places orders. Each position produces at most one
 * signal until it is released by an operator.
 */
public final class StrandedPositionMonitor {
    private static final Logger log = LoggerFactory.getLogger(StrandedPositionMonitor.class);

    private final LatestTickerTable table;
    private final EngineEventBus events;
    private final StrategyEvaluator strategies;
    private final ConcurrentHashMap<String, Position> positions = new ConcurrentHashMap<>();

    public StrandedPositionMonitor(LatestTickerTable table, EngineEventBus events, StrategyEvaluator strategies) {
        this.table = table;
        this.events = events;
        this.strategies = strategies;
    }

    public void track(HeldInventory inventory) {
        positions.put(inventory.tradeId(), new Position(inventory));
        log.warn("[STRANDED] Tracking {} {} on {} from trade {} (cost {})", inventory.quantity(),
            inventory.asset(), inventory.exchange(), inventory.tradeId(), inventory.averageCost());
    }

    /**
     * Forget a position once it has been closed or transferred by hand.
     */
    public boolean release(String tradeId) {
        boolean removed = positions.remove(tradeId) != null;
        if (removed) {
            log.info("[STRANDED] Released position from trade {}", tradeId);
        }
        return removed;
    }

    public int count() {
        return positions.size();
    }

    public List<HeldInventory> positions() {
        List<HeldInventory> result = new ArrayList<>();
        positions.values().forEach(p -> result.add(p.inventory));
        return result;
    }

    /**
     * Evaluate every position held in {@code pairSymbol} against the latest bid on its exchange
     * and the active strategy's exit rules.
     */
    public List<ExitSignal> evaluate(String pairSymbol, Instant now) {
        List<ExitSignal> signals = new ArrayList<>();
        for (Position position : positions.values()) {
            HeldInventory inventory = position.inventory;
            if (!inventory.symbol().equals(pairSymbol) || position.signalled) {
                continue;
            }
            Optional<Ticker> ticker = table.latest(inventory.exchange(), pairSymbol);
            if (ticker.isEmpty() || ticker.get().bid().signum() <= 0) {
                continue;
            }
            BigDecimal bid = ticker.get().bid();
            position.observe(bid);
            Optional<ExitReason> reason = strategies.evaluateExit(inventory, position.highest, bid, now);
            if (reason.isPresent()) {
                position.signalled = true;
                ExitSignal signal = new ExitSignal(inventory, reason.get(), bid,
                    ExitEvaluator.pnlPercent(inventory.averageCost(), bid), now);
                signals.add(signal);
                log.warn("[STRANDED] Exit recommended for trade {}: {} at {} ({}%)", inventory.tradeId(),
                    reason.get(), bid, signal.pnlPercent().setScale(4, RoundingMode.HALF_UP));
                events.publish(EventType.EXIT_SIGNAL, l -> l.onExitSignal(signal));
            }
        }
        return signals;
    }

    private static final class Position {
        final HeldInventory inventory;
        volatile BigDecimal highest;
        volatile boolean signalled;

        Position(HeldInventory inventory) {
            this.inventory = inventory;
            this.highest = inventory.averageCost();
        }

        synchronized void observe(BigDecimal price) {
            if (highest == null || price.compareTo(highest) > 0) {
                highest = price;
            }
        }
    }
}
