package in.spreadarb.infrastructure.metrics;

import in.spreadarb.application.port.input.EngineEventListener;
import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;

/**
 * Feeds engine events into an {@link ArbitrageMetrics} sink.
 */
public final class MetricsEventListener implements EngineEventListener {

    private final ArbitrageMetrics metrics;

    public MetricsEventListener(ArbitrageMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onStatusChanged(EngineStatus previous, EngineStatus current) {
        metrics.setEngineStatus(current);
    }

    @Override
    public void onOpportunityFound(SpreadOpportunity opportunity) {
        metrics.recordOpportunity(opportunity.symbol(), opportunity.shouldTrade());
    }

    @Override
    public void onTradeCompleted(TradeResult result) {
        metrics.recordTrade(result);
    }

    @Override
    public void onError(EngineError error) {
        metrics.recordError(error.severity());
    }

    @Override
    public void onBalanceUpdated(CombinedBalanceSnapshot snapshot) {
        metrics.setPoolState(snapshot.totalEquity(), snapshot.drawdownPercent());
    }

    @Override
    public void onEmergencyTriggered(EmergencyCheck check) {
        metrics.recordEmergency(check.reason());
    }
}
