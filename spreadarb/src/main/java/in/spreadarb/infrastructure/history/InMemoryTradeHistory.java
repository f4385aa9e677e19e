package in.spreadarb.infrastructure.history;

import in.spreadarb.application.port.output.TradeHistoryRecorder;
import in.spreadarb.domain.trade.TradeResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory trade history. Oldest entries are evicted first.
 */
public final class InMemoryTradeHistory implements TradeHistoryRecorder {

    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<TradeResult> trades = new ArrayDeque<>();

    public InMemoryTradeHistory() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryTradeHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void record(TradeResult result) {
        trades.addFirst(result);
        while (trades.size() > capacity) {
            trades.removeLast();
        }
    }

    @Override
    public synchronized List<TradeResult> recent(int count) {
        List<TradeResult> result = new ArrayList<>(Math.min(count, trades.size()));
        Iterator<TradeResult> it = trades.iterator();
        while (it.hasNext() && result.size() < count) {
            result.add(it.next());
        }
        return result;
    }

    public synchronized int size() {
        return trades.size();
    }
}
