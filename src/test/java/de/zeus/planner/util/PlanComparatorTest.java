package de.zeus.planner.util;

import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.OperatingMode;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlanComparison;
import de.zeus.planner.model.PlanningConstraints;
import de.zeus.planner.service.BatteryModel;
import de.zeus.planner.service.RuleBasedPlanner;
import de.zeus.planner.service.SlotSimulator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static de.zeus.planner.support.ScenarioFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class PlanComparatorTest {

    private final PlanComparator comparator = new PlanComparator();
    private RuleBasedPlanner planner;

    @BeforeEach
    void setUp() {
        BatteryModel model = new BatteryModel();
        planner = new RuleBasedPlanner(new SlotSimulator(model), model);
    }

    @Test
    void shouldReportIdentical_whenPlansMatch() {
        Plan a = plan(darkFlatDay(), 50.0);
        Plan b = plan(darkFlatDay(), 50.0);

        PlanComparison comparison = comparator.compare(a, b);

        assertTrue(comparison.isIdentical());
        assertEquals(0.0, comparison.costDelta());
        assertEquals(DAY, comparison.modeCountsA().get(OperatingMode.SELF_USE));
    }

    @Test
    void shouldReportDeltasFromFirstToSecond_whenPlansDiffer() {
        Plan full = plan(darkFlatDay(), 50.0);
        Plan empty = plan(darkFlatDay(), 10.0);

        PlanComparison comparison = comparator.compare(full, empty);

        assertFalse(comparison.isIdentical());
        assertTrue(comparison.costDelta() > 0.0, "starting empty costs more");
        assertEquals(empty.getMetrics().getObjectiveValue() - full.getMetrics().getObjectiveValue(),
                comparison.objectiveDelta(), 1e-9);
        PlanComparison.SlotDifference first = comparison.differingSlots().get(0);
        assertEquals(0, first.index());
        assertEquals(START, first.time());
        assertTrue(first.socGap() < 0.0);
    }

    @Test
    void shouldReject_whenPlansHaveDifferentLength() {
        Plan day = plan(darkFlatDay(), 50.0);
        Plan empty = plan(empty(), 50.0);

        assertThrows(IllegalArgumentException.class, () -> comparator.compare(day, empty));
    }

    @Test
    void shouldReject_whenPlansStartAtDifferentTimes() {
        ForecastSeries later = new ForecastSeries(START.plusSeconds(1800), flat(DAY, 20.0), flat(DAY, 5.0),
                flat(DAY, 0.0), dailyLoad(DAY));

        assertThrows(IllegalArgumentException.class,
                () -> comparator.compare(plan(darkFlatDay(), 50.0), plan(later, 50.0)));
    }

    private Plan plan(ForecastSeries forecast, double soc) {
        return planner.createPlan(forecast, battery(soc), PlanningConstraints.defaults());
    }
}
