package de.zeus.planner.service;

import de.zeus.planner.exception.StateInvariantViolationException;
import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.TransitionResult;
import org.springframework.stereotype.Component;

/**
 * Copyright 2025 Guido Zeuner - https://tiny-tool.de
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Battery state transition shared by all planners. Applies one slot of requested charge (positive kW) or
 * discharge (negative kW) to a state, honouring rate limits, the SOC band and conversion losses.
 * <p>
 * Power and energy are measured on the AC side. Charging stores {@code p * h * chargeEfficiency}; discharging
 * delivers {@code p * h} and removes {@code p * h / dischargeEfficiency} from the cells.
 * <p>
 * Stateless; the same inputs always give the same result.
 */
@Component
public class BatteryModel {

    /** Rounding noise accepted at the SOC band edges before a result counts as a violation (percent). */
    static final double SOC_TOLERANCE = 1e-6;

    private static final double EPSILON = 1e-12;

    /**
     * Applies a requested power to the battery for one slot.
     *
     * @param state            state at the start of the slot
     * @param requestedPowerKw AC-side power, positive to charge and negative to discharge
     * @param hours            slot length in hours
     * @param floorPercent     lowest SOC the discharge may reach
     * @param ceilingPercent   highest SOC the charge may reach
     * @return the new state, the signed AC energy actually moved and the requested energy that could not be moved
     */
    public TransitionResult apply(BatteryState state, double requestedPowerKw, double hours,
                                  double floorPercent, double ceilingPercent) {
        if (!(hours > 0.0) || !Double.isFinite(requestedPowerKw)) {
            throw new IllegalArgumentException("Invalid transition request: " + requestedPowerKw + " kW for " + hours + " h");
        }
        double soc = state.getSocPercent();
        double requestedKwh = Math.abs(requestedPowerKw) * hours;
        if (requestedKwh < EPSILON) {
            return new TransitionResult(state, 0.0, 0.0);
        }

        double newSoc;
        double movedKwh;
        if (requestedPowerKw > 0.0) {
            double power = Math.min(requestedPowerKw, maxChargePowerKw(state, hours, ceilingPercent));
            movedKwh = power * hours;
            newSoc = soc + movedKwh * state.getChargeEfficiency() / state.getCapacityKwh() * 100.0;
            verify(state, newSoc, floorPercent, ceilingPercent);
            newSoc = Math.min(newSoc, Math.max(ceilingPercent, soc));
        } else {
            double power = Math.min(-requestedPowerKw, maxDischargePowerKw(state, hours, floorPercent));
            movedKwh = -power * hours;
            newSoc = soc - power * hours / state.getDischargeEfficiency() / state.getCapacityKwh() * 100.0;
            verify(state, newSoc, floorPercent, ceilingPercent);
            newSoc = Math.max(newSoc, Math.min(floorPercent, soc));
        }

        double clippedKwh = Math.max(0.0, requestedKwh - Math.abs(movedKwh));
        if (clippedKwh < EPSILON) {
            clippedKwh = 0.0;
        }
        return new TransitionResult(state.withSoc(newSoc), movedKwh, clippedKwh);
    }

    /** Stored energy (kWh) that still fits below the ceiling. */
    public double headroomKwh(BatteryState state, double ceilingPercent) {
        return Math.max(0.0, (ceilingPercent - state.getSocPercent()) / 100.0 * state.getCapacityKwh());
    }

    /** Stored energy (kWh) above the floor. */
    public double reserveKwh(BatteryState state, double floorPercent) {
        return Math.max(0.0, (state.getSocPercent() - floorPercent) / 100.0 * state.getCapacityKwh());
    }

    /** Highest AC power the battery accepts for the whole slot. */
    public double maxChargePowerKw(BatteryState state, double hours, double ceilingPercent) {
        double byHeadroom = headroomKwh(state, ceilingPercent) / state.getChargeEfficiency() / hours;
        return Math.max(0.0, Math.min(state.getMaxChargeKw(), byHeadroom));
    }

    /** Highest AC power the battery delivers for the whole slot. */
    public double maxDischargePowerKw(BatteryState state, double hours, double floorPercent) {
        double byReserve = reserveKwh(state, floorPercent) * state.getDischargeEfficiency() / hours;
        return Math.max(0.0, Math.min(state.getMaxDischargeKw(), byReserve));
    }

    private static void verify(BatteryState before, double newSoc, double floorPercent, double ceilingPercent) {
        double low = Math.min(floorPercent, before.getSocPercent()) - SOC_TOLERANCE;
        double high = Math.max(ceilingPercent, before.getSocPercent()) + SOC_TOLERANCE;
        if (!Double.isFinite(newSoc) || newSoc < low || newSoc > high) {
            throw new StateInvariantViolationException(String.format(
                    "SOC %.6f%% left the band [%.2f%%, %.2f%%] starting from %.6f%%",
                    newSoc, floorPercent, ceilingPercent, before.getSocPercent()));
        }
    }
}
