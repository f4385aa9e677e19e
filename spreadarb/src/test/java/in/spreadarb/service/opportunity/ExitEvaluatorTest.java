package in.spreadarb.service.opportunity;

import in.spreadarb.domain.strategy.ExitRules;
import in.spreadarb.domain.trade.ExitReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExitEvaluatorTest {

    private static final BigDecimal ENTRY = new BigDecimal("100");
    private static final Duration SHORT = Duration.ofMinutes(1);

    private static Optional<ExitReason> exit(ExitRules rules, String highest, String current, Duration held) {
        return ExitEvaluator.evaluate(rules, ENTRY, new BigDecimal(highest), new BigDecimal(current), held);
    }

    @Test
    @DisplayName("Take profit fires at the threshold")
    void takeProfit() {
        assertEquals(Optional.of(ExitReason.TAKE_PROFIT), exit(ExitRules.defaults(), "100.5", "100.5", SHORT));
        assertEquals(Optional.empty(), exit(ExitRules.defaults(), "100.49", "100.49", SHORT));
    }

    @Test
    @DisplayName("Stop loss fires at the negative threshold")
    void stopLoss() {
        assertEquals(Optional.of(ExitReason.STOP_LOSS), exit(ExitRules.defaults(), "100", "99.7", SHORT));
        assertEquals(Optional.empty(), exit(ExitRules.defaults(), "100", "99.8", SHORT));
    }

    @Test
    @DisplayName("Trailing stop arms at activation and trails the high")
    void trailingStop() {
        ExitRules rules = ExitRules.defaults().withTrailingStop(0.3, 0.1);

        // high 100.40 arms the stop at 100.2996
        assertEquals(Optional.of(ExitReason.TRAILING_STOP), exit(rules, "100.40", "100.25", SHORT));
        assertEquals(Optional.empty(), exit(rules, "100.40", "100.35", SHORT));
        // high 100.20 is below activation
        assertEquals(Optional.empty(), exit(rules, "100.20", "100.05", SHORT));
    }

    @Test
    @DisplayName("Maximum hold time fires last")
    void maxHoldTime() {
        assertEquals(Optional.of(ExitReason.MAX_HOLD_TIME),
            exit(ExitRules.defaults(), "100", "100.1", Duration.ofMinutes(30)));
        assertEquals(Optional.of(ExitReason.TAKE_PROFIT),
            exit(ExitRules.defaults(), "100.6", "100.6", Duration.ofMinutes(45)), "Price exits win over time");
    }

    @Test
    void pnlPercent() {
        assertEquals(0, ExitEvaluator.pnlPercent(ENTRY, new BigDecimal("101")).compareTo(BigDecimal.ONE));
        assertEquals(0, ExitEvaluator.pnlPercent(ENTRY, new BigDecimal("99.5")).compareTo(new BigDecimal("-0.5")));
    }
}
