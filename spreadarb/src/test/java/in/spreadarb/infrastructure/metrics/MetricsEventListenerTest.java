package in.spreadarb.infrastructure.metrics;

import in.spreadarb.domain.common.EngineError;
import in.spreadarb.domain.common.ErrorSeverity;
import in.spreadarb.domain.emergency.EmergencyAction;
import in.spreadarb.domain.emergency.EmergencyCheck;
import in.spreadarb.domain.emergency.EmergencyTriggerReason;
import in.spreadarb.domain.engine.EngineStatus;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.support.Fixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;

import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class MetricsEventListenerTest {

    @Mock
    private ArbitrageMetrics metrics;

    @Test
    void testEventsReachMetrics() {
        MetricsEventListener listener = new MetricsEventListener(metrics);
        TradeResult trade = Fixtures.trade("1", Instant.now());
        EmergencyCheck check = EmergencyCheck.of(EmergencyTriggerReason.MAX_DRAWDOWN_EXCEEDED,
            EmergencyAction.STOP_TRADING, new BigDecimal("6"), new BigDecimal("5"), "drawdown");

        listener.onStatusChanged(EngineStatus.STARTING, EngineStatus.RUNNING);
        listener.onTradeCompleted(trade);
        listener.onError(EngineError.of("test", ErrorSeverity.HIGH, "BTC/USDT", "failed"));
        listener.onEmergencyTriggered(check);
        listener.onOpportunityFound(Fixtures.opportunity("1"));

        verify(metrics).setEngineStatus(EngineStatus.RUNNING);
        verify(metrics).recordTrade(trade);
        verify(metrics).recordError(ErrorSeverity.HIGH);
        verify(metrics).recordEmergency(EmergencyTriggerReason.MAX_DRAWDOWN_EXCEEDED);
        verify(metrics).recordOpportunity("BTC/USDT", true);
    }
}
