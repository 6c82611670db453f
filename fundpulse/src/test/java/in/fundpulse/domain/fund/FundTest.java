package in.fundpulse.domain.fund;

import in.fundpulse.domain.market.Quote;
import in.fundpulse.domain.valuation.FundValuation;
import in.fundpulse.domain.valuation.Valuation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FundTest {

    private static final Instant NOW = Instant.parse("2024-03-04T02:00:00Z");
    private static final LocalDate PUBLISHED = LocalDate.of(2024, 3, 1);

    private static Fund fund() {
        return new Fund("000001", "Growth Mix", 1.0, PUBLISHED, 1.0, 0, Instant.EPOCH, true,
            List.of(new Holding("600519", "Moutai", 10, 0, 0)));
    }

    @Test
    void testHoldingsAreCopied() {
        List<Holding> holdings = new ArrayList<>(List.of(new Holding("600519", "Moutai", 10, 0, 0)));
        Fund fund = new Fund("000001", "Growth Mix", 1.0, PUBLISHED, 1.0, 0, NOW, true, holdings);

        holdings.clear();

        assertEquals(1, fund.holdings().size());
        assertTrue(new Fund("000002", "x", 1.0, null, 1.0, 0, null, true, null).holdings().isEmpty());
    }

    @Test
    void testBlankCodeRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new Fund(" ", "x", 1.0, null, 1.0, 0, null, true, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new Holding("", "x", 1, 0, 0));
    }

    @Test
    void testEstimateKeepsPublishedNetValue() {
        FundValuation estimate = new FundValuation("000001", 9.9, LocalDate.of(2024, 3, 4), 1.02, 2.0, NOW, false, true);

        Fund updated = fund().withPrimaryValuation(estimate, fund().holdings());

        assertEquals(1.0, updated.netValue());
        assertEquals(PUBLISHED, updated.netValueDate());
        assertEquals(1.02, updated.estimatedValue());
        assertFalse(updated.realValue());
        assertEquals(NOW, updated.updateTime());
    }

    @Test
    void testHoldingsEstimateIsNeverReal() {
        Fund updated = fund().withEstimatedValuation(new Valuation(1.01, 1.0, NOW, true), fund().holdings());

        assertFalse(updated.realValue());
        assertEquals(1.0, updated.netValue());
        assertEquals(1.01, updated.estimatedValue());
    }

    @Test
    void testMissingQuoteKeepsHolding() {
        Holding holding = new Holding("600519", "Moutai", 10, 0.5, 1600.0);

        assertSame(holding, holding.withQuote(null));

        Holding quoted = holding.withQuote(new Quote("600519", "Moutai", 1688.0, 1.25, 20.84));
        assertEquals(1.25, quoted.change());
        assertEquals(1688.0, quoted.price());
        assertEquals(10, quoted.ratio());
    }
}
