package in.spreadarb.service.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.balance.RebalanceRecommendation;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.common.EventType;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.trade.ExitSignal;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.function.Consumer;

/**
 * Writes engine events as single-line JSON to the "spreadarb.events" logger.
 *
 * Price updates are skipped; they are too frequent for an audit trail.
 */
public final class JsonEventLogListener implements EngineEventListener {
    private static final Logger log = LoggerFactory.getLogger(JsonEventLogListener.class);
    private static final Logger eventLog = LoggerFactory.getLogger("spreadarb.events");

    private final ObjectMapper mapper;
    private final Consumer<String> sink;

    public JsonEventLogListener() {
        this(eventLog::info);
    }

    JsonEventLogListener(Consumer<String> sink) {
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.sink = sink;
    }

    @Override
    public void onStatusChanged(EngineStatus previous, EngineStatus current) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("previous", previous.name());
        payload.put("current", current.name());
        write(EventType.STATUS_CHANGED, payload);
    }

    @Override
    public void onOpportunityFound(SpreadOpportunity opportunity) {
        write(EventType.OPPORTUNITY_FOUND, mapper.valueToTree(opportunity));
    }

    @Override
    public void onTradeCompleted(TradeResult result) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("tradeId", result.tradeId());
        payload.put("symbol", result.symbol());
        payload.put("status", result.status().name());
        payload.put("state", result.executionState().name());
        payload.put("netPnl", result.netPnl());
        payload.put("pnlPercent", result.pnlPercent());
        payload.put("fees", result.totalFees());
        payload.put("durationMs", result.duration().toMillis());
        payload.set("metadata", mapper.valueToTree(result.metadata()));
        if (result.errorMessage() != null) {
            payload.put("error", result.errorMessage());
        }
        write(EventType.TRADE_COMPLETED, payload);
    }

    @Override
    public void onError(EngineError error) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("source", error.source());
        payload.put("severity", error.severity().name());
        payload.put("message", error.message());
        payload.put("symbol", error.symbol());
        payload.put("tradeId", error.tradeId());
        payload.put("recommendedAction", error.recommendedAction());
        if (error.heldInventory() != null) {
            payload.set("heldInventory", mapper.valueToTree(error.heldInventory()));
        }
        write(EventType.ERROR_OCCURRED, payload);
    }

    @Override
    public void onBalanceUpdated(CombinedBalanceSnapshot snapshot) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("totalEquity", snapshot.totalEquity());
        payload.put("peakEquity", snapshot.peakEquity());
        payload.put("drawdownPercent", snapshot.drawdownPercent());
        payload.put("realizedPnl", snapshot.realizedPnl());
        write(EventType.BALANCE_UPDATED, payload);
    }

    @Override
    public void onEmergencyTriggered(EmergencyCheck check) {
        write(EventType.EMERGENCY_TRIGGERED, mapper.valueToTree(check));
    }

    @Override
    public void onRebalanceRecommended(RebalanceRecommendation recommendation) {
        write(EventType.REBALANCE_RECOMMENDED, mapper.valueToTree(recommendation));
    }

    @Override
    public void onExitSignal(ExitSignal signal) {
        write(EventType.EXIT_SIGNAL, mapper.valueToTree(signal));
    }

    private void write(EventType type, JsonNode payload) {
        try {
            ObjectNode envelope = mapper.createObjectNode();
            envelope.put("type", type.name());
            envelope.put("ts", Instant.now().toString());
            envelope.set("payload", payload);
            sink.accept(mapper.writeValueAsString(envelope));
        } catch (Exception e) {
            log.error("Failed to serialize {} event: {}", type, e.getMessage());
        }
    }
}
