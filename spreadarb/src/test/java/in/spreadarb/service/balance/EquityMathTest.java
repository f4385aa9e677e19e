package in.spreadarb.service.balance;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class EquityMathTest {

    @Test
    void testDrawdownFromPeak() {
        BigDecimal drawdown = EquityMath.drawdownPercent(new BigDecimal("10000"), new BigDecimal("9500"));

        assertEquals(0, drawdown.compareTo(new BigDecimal("5")), "5% below peak");
    }

    @Test
    void testDrawdownNeverNegative() {
        assertEquals(0, EquityMath.drawdownPercent(new BigDecimal("100"), new BigDecimal("120")).signum());
    }

    @Test
    void testDrawdownCappedAtHundred() {
        BigDecimal drawdown = EquityMath.drawdownPercent(new BigDecimal("100"), new BigDecimal("-50"));

        assertEquals(0, drawdown.compareTo(new BigDecimal("100")));
    }

    @Test
    void testNoPeakMeansNoDrawdown() {
        assertEquals(0, EquityMath.drawdownPercent(BigDecimal.ZERO, new BigDecimal("50")).signum());
        assertEquals(0, EquityMath.drawdownPercent(null, new BigDecimal("50")).signum());
    }

    @Test
    void testPeakOnlyRises() {
        assertEquals(new BigDecimal("110"), EquityMath.newPeak(new BigDecimal("100"), new BigDecimal("110")));
        assertEquals(new BigDecimal("110"), EquityMath.newPeak(new BigDecimal("110"), new BigDecimal("90")));
        assertEquals(new BigDecimal("90"), EquityMath.newPeak(null, new BigDecimal("90")));
    }

    @Test
    void testReturnPercent() {
        assertEquals(0, EquityMath.returnPercent(new BigDecimal("2000"), new BigDecimal("50"))
            .compareTo(new BigDecimal("2.5")));
        assertEquals(0, EquityMath.returnPercent(BigDecimal.ZERO, new BigDecimal("50")).signum());
    }
}
