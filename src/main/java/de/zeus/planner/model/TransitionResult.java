package de.zeus.planner.model;

/**
 * Outcome of applying one requested battery flow for one slot.
 *
 * @param state          battery after the slot
 * @param energyMovedKwh AC-side energy actually moved, positive when charging
 * @param clippedKwh     requested AC-side energy the battery could not move
 */
public record TransitionResult(BatteryState state, double energyMovedKwh, double clippedKwh) {

    public boolean clipped() {
        return clippedKwh > 0.0;
    }
}
