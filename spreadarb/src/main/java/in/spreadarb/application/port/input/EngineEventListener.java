package in.spreadarb.application.port.input;

import in.spreadarb.domain.balance.CombinedBalanceSnapshot;
import in.spreadarb.domain.balance.RebalanceRecommendation;
import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.trade.ExitSignal;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;

/**
 * Observer of engine events. Implement only the callbacks you need.
 *
 * Callbacks run on the engine's event dispatcher thread, one at a time and in publish order.
 * An exception thrown by a listener is logged and does not reach the engine.
 */
public interface EngineEventListener {

    default void onStatusChanged(EngineStatus previous, EngineStatus current) {}

    default void onPriceUpdated(String pairSymbol, Ticker ticker) {}

    default void onOpportunityFound(SpreadOpportunity opportunity) {}

    default void onTradeCompleted(TradeResult result) {}

    default void onError(EngineError error) {}

    default void onBalanceUpdated(CombinedBalanceSnapshot snapshot) {}

    default void onEmergencyTriggered(EmergencyCheck check) {}

    default void onRebalanceRecommended(RebalanceRecommendation recommendation) {}

    default void onExitSignal(ExitSignal signal) {}
}
