package de.zeus.planner.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Difference between two plans over the same horizon. Deltas are {@code b - a}.
 */
public record PlanComparison(PlannerType plannerA,
                             PlannerType plannerB,
                             double costDelta,
                             double objectiveDelta,
                             double clippedDelta,
                             Map<OperatingMode, Integer> modeCountsA,
                             Map<OperatingMode, Integer> modeCountsB,
                             List<SlotDifference> differingSlots) {

    public boolean isIdentical() {
        return differingSlots.isEmpty() && costDelta == 0.0;
    }

    public record SlotDifference(int index, Instant time, OperatingMode modeA, OperatingMode modeB, double socGap) {
    }
}
