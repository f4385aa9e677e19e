package in.spreadarb.infrastructure.metrics;

import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.trade.TradeResult;

import java.math.BigDecimal;

/**
 * Engine metrics sink.
 */
public interface ArbitrageMetrics {

    void recordOpportunity(String symbol, boolean tradeable);

    void recordTrade(TradeResult result);

    void recordMarketDataError(String exchange);

    /**
     * An opportunity dropped because its pair was already executing.
     */
    void recordExecutionSkipped(String symbol, String reason);

    void recordError(ErrorSeverity severity);

    void recordEmergency(EmergencyTriggerReason reason);

    void setEngineStatus(EngineStatus status);

    void setPoolState(BigDecimal equity, BigDecimal drawdownPercent);

    void setInFlightExecutions(int count);

    /**
     * Metrics sink that discards everything.
     */
    ArbitrageMetrics NOOP = new ArbitrageMetrics() {
        @Override public void recordOpportunity(String symbol, boolean tradeable) {}
        @Override public void recordTrade(TradeResult result) {}
        @Override public void recordMarketDataError(String exchange) {}
        @Override public void recordExecutionSkipped(String symbol, String reason) {}
        @Override public void recordError(ErrorSeverity severity) {}
        @Override public void recordEmergency(EmergencyTriggerReason reason) {}
        @Override public void setEngineStatus(EngineStatus status) {}
        @Override public void setPoolState(BigDecimal equity, BigDecimal drawdownPercent) {}
        @Override public void setInFlightExecutions(int count) {}
    };
}
