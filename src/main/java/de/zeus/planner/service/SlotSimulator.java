package de.zeus.planner.service;

import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.OperatingMode;
import de.zeus.planner.model.PlanningConstraints;
import de.zeus.planner.model.SlotOutcome;
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
 * Inverter behaviour for a single slot: given the forecast for that slot and an operating mode, works out how
 * solar, load, battery and grid settle. Every flow satisfies
 * {@code solar + import + discharge = load + export + charge + clipped} on the AC bus.
 */
@Component
public class SlotSimulator {

    private final BatteryModel batteryModel;

    public SlotSimulator(BatteryModel batteryModel) {
        this.batteryModel = batteryModel;
    }

    /**
     * Simulates one slot.
     *
     * @param forecast         forecast the slot belongs to
     * @param slot             slot index
     * @param state            battery state at the start of the slot
     * @param mode             inverter mode for the slot
     * @param requestedPowerKw battery power for FORCE_CHARGE and FORCE_DISCHARGE (magnitude, kW); ignored otherwise
     * @param constraints      SOC band and export limits
     */
    public SlotOutcome simulate(ForecastSeries forecast, int slot, BatteryState state, OperatingMode mode,
                                double requestedPowerKw, PlanningConstraints constraints) {
        double hours = forecast.getSlotHours();
        double solarKwh = forecast.solarKw(slot) * hours;
        double loadKwh = forecast.loadKw(slot) * hours;
        double netKwh = solarKwh - loadKwh;
        double exportCapKwh = constraints.exportLimitKw(mode) * hours;
        double floor = constraints.minSocPercent();
        double ceiling = constraints.maxSocPercent();

        TransitionResult transition;
        double available;
        double exportKwh = 0.0;
        double clippedKwh = 0.0;

        switch (mode) {
            case GRID_FIRST:
                if (netKwh > 0.0) {
                    exportKwh = Math.min(netKwh, exportCapKwh);
                    transition = batteryModel.apply(state, (netKwh - exportKwh) / hours, hours, floor, ceiling);
                    clippedKwh = netKwh - exportKwh - transition.energyMovedKwh();
                    return settle(forecast, slot, mode, transition, 0.0, exportKwh, clippedKwh);
                }
                transition = batteryModel.apply(state, netKwh / hours, hours, floor, ceiling);
                return settle(forecast, slot, mode, transition, -netKwh + transition.energyMovedKwh(), 0.0, 0.0);
            case FORCE_CHARGE:
                transition = batteryModel.apply(state, Math.abs(requestedPowerKw), hours, floor, ceiling);
                available = netKwh - transition.energyMovedKwh();
                break;
            case FORCE_DISCHARGE:
                double outputCapKw = Math.max(0.0, (exportCapKwh - netKwh) / hours);
                double power = Math.min(Math.abs(requestedPowerKw), outputCapKw);
                transition = batteryModel.apply(state, -power, hours, floor, ceiling);
                available = netKwh - transition.energyMovedKwh();
                break;
            case SELF_USE:
            default:
                transition = batteryModel.apply(state, netKwh / hours, hours, floor, ceiling);
                available = netKwh - transition.energyMovedKwh();
                break;
        }

        if (available > 0.0) {
            exportKwh = Math.min(available, exportCapKwh);
            clippedKwh = available - exportKwh;
            return settle(forecast, slot, mode, transition, 0.0, exportKwh, clippedKwh);
        }
        return settle(forecast, slot, mode, transition, -available, 0.0, 0.0);
    }

    private static SlotOutcome settle(ForecastSeries forecast, int slot, OperatingMode mode,
                                      TransitionResult transition, double importKwh, double exportKwh,
                                      double clippedKwh) {
        double imported = clean(importKwh);
        double exported = clean(exportKwh);
        double cost = imported * forecast.importPrice(slot) - exported * forecast.exportPrice(slot);
        return new SlotOutcome(mode, transition.state(), imported, exported, transition.energyMovedKwh(),
                clean(clippedKwh), cost);
    }

    private static double clean(double kwh) {
        return kwh < 1e-12 ? 0.0 : kwh;
    }
}
