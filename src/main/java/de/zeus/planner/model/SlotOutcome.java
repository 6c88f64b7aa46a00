package de.zeus.planner.model;

/**
 * Energy flows of one slot once a mode has been applied. All energies are in kWh on the AC bus,
 * the cost in pence.
 *
 * @param mode           operating mode the flows were produced under
 * @param state          battery after the slot
 * @param importKwh      energy bought from the grid
 * @param exportKwh      energy sold to the grid
 * @param batteryFlowKwh signed battery flow, positive when charging
 * @param clippedKwh     solar energy that could neither be used, stored nor exported
 * @param cost           import cost minus export revenue
 */
public record SlotOutcome(OperatingMode mode,
                          BatteryState state,
                          double importKwh,
                          double exportKwh,
                          double batteryFlowKwh,
                          double clippedKwh,
                          double cost) {
}
