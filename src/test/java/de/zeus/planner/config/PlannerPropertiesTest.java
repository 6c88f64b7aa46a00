package de.zeus.planner.config;

import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningConstraints;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PlannerPropertiesTest {

    @Test
    void shouldMatchBuiltInDefaults() {
        PlannerProperties properties = new PlannerProperties();

        assertEquals(PlanningConstraints.defaults(), properties.toConstraints());
        assertEquals(PlannerType.MATH_OPTIMAL, properties.getStrategy());
        assertEquals(Duration.ofMinutes(30), properties.getSlotDuration());
    }

    @Test
    void shouldCarryNestedSettingsIntoConstraints() {
        PlannerProperties properties = new PlannerProperties();
        properties.getFeedIn().setSolarThresholdKw(1.5);
        properties.getPreSunrise().setMarginKwh(2.5);
        properties.getSolver().setTimeoutMs(250);
        properties.getSolver().setMaxNodes(17);

        PlanningConstraints constraints = properties.toConstraints();

        assertEquals(1.5, constraints.solarThresholdKw());
        assertEquals(2.5, constraints.preSunriseMarginKwh());
        assertEquals(Duration.ofMillis(250), constraints.solverTimeout());
        assertEquals(17, constraints.solverMaxNodes());
    }
}
