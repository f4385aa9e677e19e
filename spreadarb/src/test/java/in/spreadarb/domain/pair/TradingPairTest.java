package in.spreadarb.domain.pair;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class TradingPairTest {

    @Test
    @DisplayName("fromSymbol normalizes the symbol and derives exchange symbols")
    void fromSymbolDerivesLegs() {
        TradingPair pair = TradingPair.fromSymbol("btc/usdt", "SIM_A", "SIM_B", new BigDecimal("500"));

        assertEquals("BTC/USDT", pair.symbol());
        assertEquals("BTC", pair.baseCurrency());
        assertEquals("USDT", pair.quoteCurrency());
        assertEquals("BTCUSDT", pair.legA().exchangeSymbol());
        assertEquals("SIM_B", pair.legB().exchange());
        assertTrue(pair.enabled());
    }

    @Test
    @DisplayName("Both legs on the same exchange are rejected")
    void rejectsSameExchangeTwice() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> TradingPair.fromSymbol("BTC/USDT", "SIM_A", "sim_a", new BigDecimal("500")));
        assertTrue(e.getMessage().contains("distinct exchanges"));
    }

    @Test
    @DisplayName("Malformed symbols and non-positive amounts are rejected")
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class,
            () -> TradingPair.fromSymbol("BTCUSDT", "SIM_A", "SIM_B", new BigDecimal("500")));
        assertThrows(IllegalArgumentException.class,
            () -> TradingPair.fromSymbol("BTC/", "SIM_A", "SIM_B", new BigDecimal("500")));
        assertThrows(IllegalArgumentException.class,
            () -> TradingPair.fromSymbol("BTC/USDT", "SIM_A", "SIM_B", BigDecimal.ZERO));
    }

    @Test
    @DisplayName("withEnabled keeps identity fields")
    void withEnabledKeepsIdentity() {
        TradingPair pair = TradingPair.fromSymbol("ETH/USDT", "SIM_A", "SIM_B", new BigDecimal("300"));

        TradingPair disabled = pair.withEnabled(false);

        assertFalse(disabled.enabled());
        assertEquals(pair.symbol(), disabled.symbol());
        assertEquals(pair.legA(), disabled.legA());
        assertEquals(pair.legB(), disabled.legB());
    }

    @Test
    @DisplayName("leg() resolves by exchange name and rejects strangers")
    void legLookup() {
        TradingPair pair = TradingPair.fromSymbol("ETH/USDT", "SIM_A", "SIM_B", new BigDecimal("300"));

        assertEquals("SIM_B", pair.leg("sim_b").exchange());
        assertThrows(IllegalArgumentException.class, () -> pair.leg("SIM_C"));
    }
}
