package in.spreadarb.application.port.output;

import in.spreadarb.domain.trade.TradeResult;

import java.util.List;

/**
 * Sink for finalized trade results.
 */
public interface TradeHistoryRecorder {

    void record(TradeResult result);

    /**
     * Most recent results, newest first.
     */
    List<TradeResult> recent(int count);
}
