package in.spreadarb.support;

import in.spreadarb.domain.market.Ticker;
import in.spreadarb.domain.order.Order;
import in.spreadarb.domain.order.OrderRequest;
import in.spreadarb.domain.order.OrderSide;
import in.spreadarb.domain.order.OrderStatus;
import in.spreadarb.domain.pair.TradingPair;
import in.spreadarb.domain.strategy.TradingStrategy;
import in.spreadarb.domain.trade.ArbitrageDirection;
import in.spreadarb.domain.trade.ExecutionState;
import in.spreadarb.domain.trade.SpreadOpportunity;
import in.spreadarb.domain.trade.TradeResult;
import in.spreadarb.domain.trade.TradeResultStatus;
import in.spreadarb.infrastructure.exchange.SimulatedExchangeClient;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Shared test data: the SIM_A / SIM_B BTC/USDT route.
 */
public final class Fixtures {

    public static final String EXCHANGE_A = "SIM_A";
    public static final String EXCHANGE_B = "SIM_B";

    public static TradingPair btcPair() {
        return TradingPair.fromSymbol("BTC/USDT", EXCHANGE_A, EXCHANGE_B, new BigDecimal("500"));
    }

    public static Ticker ticker(String exchange, String bid, String ask, Instant at) {
        return new Ticker(exchange, "BTCUSDT", new BigDecimal(bid), BigDecimal.TEN, new BigDecimal(ask),
            BigDecimal.TEN, new BigDecimal(bid), new BigDecimal("1000000"), at);
    }

    /**
     * Default strategy with single-observation entry, no profit floor and no momentum, volatility or depth checks.
     */
    public static TradingStrategy simpleStrategy(double minSpreadPercent) {
        TradingStrategy defaults = TradingStrategy.defaults();
        return defaults
            .withEntry(defaults.entry().withMinSpreadPercent(minSpreadPercent).withMinExpectedProfit(0)
                .withoutMarketChecks())
            .withRisk(defaults.risk().withoutThrottling());
    }

    /**
     * Simulated exchange quoting BTCUSDT with a 0.1% taker fee and ample balances.
     */
    public static SimulatedExchangeClient exchange(String name, String bid, String ask) {
        return new SimulatedExchangeClient(name, new BigDecimal("0.1"))
            .withQuote("BTC", "USDT", new BigDecimal(bid), new BigDecimal(ask),
                BigDecimal.TEN, new BigDecimal("1000000"))
            .withBalance("USDT", new BigDecimal("100000"))
            .withBalance("BTC", new BigDecimal("100"));
    }

    /**
     * Tradeable BTC/USDT opportunity buying on SIM_A at 100.05 and selling on SIM_B at 100.40.
     */
    public static SpreadOpportunity opportunity(String quantity) {
        return new SpreadOpportunity("BTC/USDT", ArbitrageDirection.BUY_A_SELL_B, EXCHANGE_A, EXCHANGE_B,
            new BigDecimal("100.05"), new BigDecimal("100.40"), new BigDecimal("0.3498"), new BigDecimal("0.2"),
            new BigDecimal("0.05"), new BigDecimal("0.0998"), new BigDecimal("0.1"), new BigDecimal(quantity),
            true, List.of(), Instant.now());
    }

    /**
     * Completed 1 BTC trade with the given net P&L.
     */
    public static TradeResult trade(String netPnl, Instant endedAt) {
        Order buy = Order.accepted("buy-" + endedAt.toEpochMilli(),
                OrderRequest.market(EXCHANGE_A, "BTCUSDT", OrderSide.BUY, BigDecimal.ONE))
            .withFill(OrderStatus.FILLED, BigDecimal.ONE, new BigDecimal("100"), new BigDecimal("0.1"));
        return TradeResult.builder()
            .symbol("BTC/USDT")
            .status(TradeResultStatus.SUCCESS)
            .executionState(ExecutionState.COMPLETED)
            .buyOrder(buy)
            .netPnl(new BigDecimal(netPnl))
            .startedAt(endedAt.minusMillis(200))
            .endedAt(endedAt)
            .build();
    }

    private Fixtures() {}
}
