package de.zeus.planner.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearProgramTest {

    @Test
    void shouldRejectRow_whenLengthDoesNotMatch() {
        LinearProgram lp = new LinearProgram(3);

        assertThrows(IllegalArgumentException.class, () -> lp.addUpperBound(new double[]{1.0, 2.0}, 1.0));
    }

    @Test
    void shouldRejectBound_whenNotFinite() {
        LinearProgram lp = new LinearProgram(1);

        assertThrows(IllegalArgumentException.class, () -> lp.addUpperBound(0, Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> lp.addEquality(lp.row(), Double.NaN));
    }

    @Test
    void shouldRejectEmptyProgram() {
        assertThrows(IllegalArgumentException.class, () -> new LinearProgram(0));
    }

    @Test
    void shouldAddUnitBoundOnce_whenBinaryMarkedTwice() {
        LinearProgram lp = new LinearProgram(2);

        lp.markBinary(1);
        lp.markBinary(1);

        assertEquals(1, lp.getConstraintCount());
        assertEquals(1, lp.getBinaries().size());
        assertTrue(lp.getBinaries().contains(1));
    }

    @Test
    void shouldEvaluateObjectiveWithConstant() {
        LinearProgram lp = new LinearProgram(2);
        lp.setObjectiveCoefficient(0, 2.0);
        lp.setObjectiveCoefficient(1, -1.0);
        lp.addObjectiveConstant(3.0);
        lp.addObjectiveConstant(1.0);

        assertEquals(2.0 * 4.0 - 1.0 + 4.0, lp.objectiveFunction().value(new double[]{4.0, 1.0}), 1e-12);
    }

    @Test
    void shouldReturnFreshRows() {
        LinearProgram lp = new LinearProgram(2);
        double[] first = lp.row();
        first[0] = 5.0;

        assertEquals(0.0, lp.row()[0]);
        assertEquals(2, lp.getVariableCount());
    }
}
