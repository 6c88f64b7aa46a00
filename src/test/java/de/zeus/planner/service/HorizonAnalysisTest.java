package de.zeus.planner.service;

import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.PlanningConstraints;
import org.junit.jupiter.api.Test;

import static de.zeus.planner.support.ScenarioFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class HorizonAnalysisTest {

    private final PlanningConstraints constraints = PlanningConstraints.defaults();

    @Test
    void shouldTrackSuffixExtremesAndCheapSlots() {
        double[] importPrice = {20.0, 5.0, 30.0, 5.4, 40.0};
        double[] exportPrice = {1.0, 9.0, 3.0, 7.0, 2.0};
        ForecastSeries forecast = new ForecastSeries(START, importPrice, exportPrice, flat(5, 0.0), flat(5, 0.0));

        HorizonAnalysis horizon = HorizonAnalysis.of(forecast, battery(50.0), constraints);

        assertEquals(5, horizon.size());
        assertEquals(5.0, horizon.suffixMinImport(0));
        assertEquals(5.4, horizon.suffixMinImport(2));
        assertEquals(9.0, horizon.suffixMaxExport(0));
        assertEquals(7.0, horizon.suffixMaxExport(2));
        assertEquals(Double.NEGATIVE_INFINITY, horizon.suffixMaxExport(5));
        assertFalse(horizon.isCheap(0));
        assertTrue(horizon.isCheap(1));
        assertTrue(horizon.isCheap(3));
        assertTrue(horizon.isCheap(4));
        assertFalse(horizon.isCheap(5));
    }

    @Test
    void shouldAccumulateReserveUntilNextCheapSlot() {
        double[] importPrice = {20.0, 40.0, 40.0, 5.0};
        double[] load = {0.0, 2.0, 1.0, 2.0};
        ForecastSeries forecast = new ForecastSeries(START, importPrice, flat(4, 1.0), flat(4, 0.0), load);

        HorizonAnalysis horizon = HorizonAnalysis.of(forecast, battery(50.0), constraints);

        double perKw = 0.5 / 0.95;
        assertEquals(2.0 * perKw, horizon.reserveNeed(3), 1e-12);
        assertEquals(1.0 * perKw, horizon.reserveNeed(2), 1e-12);
        assertEquals(3.0 * perKw, horizon.reserveNeed(1), 1e-12);
        assertEquals(3.0 * perKw, horizon.reserveNeed(0), 1e-12);
        assertEquals(0.0, horizon.reserveNeedAfter(2), 0.0);
        assertEquals(1.0 * perKw, horizon.reserveNeedAfter(1), 1e-12);
    }

    @Test
    void shouldFindSunriseAndSolarRunFigures() {
        double[] solar = {0.0, 0.0, 8.0, 8.0, 0.0};
        ForecastSeries forecast = new ForecastSeries(START, flat(5, 20.0), flat(5, 5.0), solar, flat(5, 0.5));

        HorizonAnalysis horizon = HorizonAnalysis.of(forecast, battery(50.0), constraints);

        assertEquals(2, horizon.nextSunrise(0));
        assertEquals(2, horizon.nextSunrise(2));
        assertEquals(-1, horizon.nextSunrise(3));
        assertFalse(horizon.isDaylight(1));
        assertTrue(horizon.isDaylight(2));
        // 7.5 kW surplus, 3.68 kW export cap, 3 kW charge rate
        assertEquals(0.41, horizon.rateClipKwh(2), 1e-9);
        assertEquals(2 * 3.82 * 0.5, horizon.remainingExcess(2), 1e-9);
        assertEquals(3.0 * 0.5 * 0.95, horizon.remainingIntakeAfter(2), 1e-9);
        assertEquals(0.0, horizon.remainingIntakeAfter(3), 0.0);
    }
}
