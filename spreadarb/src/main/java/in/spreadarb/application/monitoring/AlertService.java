package in.spreadarb.application.monitoring;

import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.trade.ExitSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes engine errors and emergencies to the log by severity.
 *
 * Notification delivery (chat, e-mail, paging) is the host application's concern;
 * it can subscribe its own listener next to this one.
 */
public final class AlertService implements EngineEventListener {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final Map<String, AtomicLong> counts = new ConcurrentHashMap<>();

    @Override
    public void onError(EngineError error) {
        count("error." + error.severity());
        String where = error.symbol() != null ? error.symbol() : "-";
        switch (error.severity()) {
            case CRITICAL:
                log.error("[ALERT-CRITICAL] {} [{}] {}", error.source(), where, error.message());
                break;
            case HIGH:
                log.warn("[ALERT-HIGH] {} [{}] {}", error.source(), where, error.message());
                break;
            case MEDIUM:
                log.warn("[ALERT-MEDIUM] {} [{}] {}", error.source(), where, error.message());
                break;
            case LOW:
            case INFO:
                log.info("[ALERT-INFO] {} [{}] {}", error.source(), where, error.message());
                break;
        }
        if (error.heldInventory() != null) {
            log.error("[ALERT-DETAILS] Holding {} {} on {} (trade {})",
                error.heldInventory().quantity(), error.heldInventory().asset(),
                error.heldInventory().exchange(), error.heldInventory().tradeId());
        }
        if (error.recommendedAction() != null) {
            log.info("[ALERT-DETAILS] Recommended action: {}", error.recommendedAction());
        }
    }

    @Override
    public void onEmergencyTriggered(EmergencyCheck check) {
        count("emergency." + check.reason());
        if (check.action() == EmergencyAction.STOP_TRADING) {
            log.error("[ALERT-CRITICAL] EMERGENCY {} -> {}: {}", check.reason(), check.action(), check.message());
        } else {
            log.warn("[ALERT-HIGH] EMERGENCY {} -> {}: {}", check.reason(), check.action(), check.message());
        }
    }

    @Override
    public void onExitSignal(ExitSignal signal) {
        count("exit." + signal.reason());
        log.warn("[ALERT-HIGH] Exit recommended for {} {} on {}: {} at {} ({}%)",
            signal.inventory().quantity(), signal.inventory().asset(), signal.inventory().exchange(),
            signal.reason(), signal.currentPrice(), signal.pnlPercent());
    }

    /**
     * Number of alerts raised for a key such as "error.CRITICAL" or "emergency.CONSECUTIVE_LOSSES".
     */
    public long alertCount(String key) {
        AtomicLong count = counts.get(key);
        return count == null ? 0 : count.get();
    }

    private void count(String key) {
        counts.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }
}
