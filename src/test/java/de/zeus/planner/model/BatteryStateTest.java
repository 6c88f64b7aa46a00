package de.zeus.planner.model;

import de.zeus.planner.exception.ForecastInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatteryStateTest {

    @Test
    void shouldRejectImpossibleSnapshots() {
        assertThrows(ForecastInputException.class, () -> new BatteryState(101.0, 10.0, 3.0, 3.0, 0.95, 0.95));
        assertThrows(ForecastInputException.class, () -> new BatteryState(-1.0, 10.0, 3.0, 3.0, 0.95, 0.95));
        assertThrows(ForecastInputException.class, () -> new BatteryState(50.0, 0.0, 3.0, 3.0, 0.95, 0.95));
        assertThrows(ForecastInputException.class, () -> new BatteryState(50.0, 10.0, -3.0, 3.0, 0.95, 0.95));
        assertThrows(ForecastInputException.class, () -> new BatteryState(50.0, 10.0, 3.0, 3.0, 0.0, 0.95));
        assertThrows(ForecastInputException.class, () -> new BatteryState(50.0, 10.0, 3.0, 3.0, 0.95, 1.2));
    }

    @Test
    void shouldDeriveStoredEnergyAndRoundTrip() {
        BatteryState state = new BatteryState(40.0, 10.0, 3.0, 2.0, 0.9, 0.95);

        assertEquals(4.0, state.getStoredKwh(), 1e-12);
        assertEquals(0.855, state.getRoundTripEfficiency(), 1e-12);
    }

    @Test
    void shouldKeepRatings_whenSocChanges() {
        BatteryState state = new BatteryState(40.0, 10.0, 3.0, 2.0, 0.9, 0.95);

        BatteryState next = state.withSoc(55.0);

        assertEquals(55.0, next.getSocPercent());
        assertEquals(state.getMaxDischargeKw(), next.getMaxDischargeKw());
        assertNotEquals(state, next);
        assertEquals(next, state.withSoc(55.0));
    }
}
