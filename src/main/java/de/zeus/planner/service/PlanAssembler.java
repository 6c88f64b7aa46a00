package de.zeus.planner.service;

import de.zeus.planner.exception.StateInvariantViolationException;
import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlanMetrics;
import de.zeus.planner.model.PlanSlot;
import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningConstraints;
import de.zeus.planner.model.SlotOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

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
 * Collects slot outcomes in order and freezes them into a {@link Plan}. Each added slot starts from the SOC
 * the previous one ended at, which keeps plans SOC-continuous.
 */
final class PlanAssembler {

    private final PlannerType plannerType;
    private final ForecastSeries forecast;
    private final BatteryState initial;
    private final PlanningConstraints constraints;
    private final List<PlanSlot> slots;
    private BatteryState current;
    private double cumulativeCost;

    PlanAssembler(PlannerType plannerType, ForecastSeries forecast, BatteryState initial,
                  PlanningConstraints constraints) {
        this.plannerType = plannerType;
        this.forecast = forecast;
        this.initial = initial;
        this.constraints = constraints;
        this.slots = new ArrayList<>(forecast.size());
        this.current = initial;
    }

    /** State the next slot starts from. */
    BatteryState current() {
        return current;
    }

    void add(SlotOutcome outcome, String reason) {
        int index = slots.size();
        double socBefore = current.getSocPercent();
        double socAfter = outcome.state().getSocPercent();
        double low = Math.min(constraints.minSocPercent(), socBefore) - BatteryModel.SOC_TOLERANCE;
        double high = Math.max(constraints.maxSocPercent(), socBefore) + BatteryModel.SOC_TOLERANCE;
        if (socAfter < low || socAfter > high) {
            throw new StateInvariantViolationException(String.format(
                    "Slot %d ends at %.6f%% SOC, outside [%.2f%%, %.2f%%]", index, socAfter,
                    constraints.minSocPercent(), constraints.maxSocPercent()));
        }
        cumulativeCost += outcome.cost();
        slots.add(new PlanSlot(index, forecast.slotTime(index), forecast, socBefore, outcome, cumulativeCost, reason));
        current = outcome.state();
    }

    Plan build() {
        if (slots.size() != forecast.size()) {
            throw new IllegalStateException("Plan has " + slots.size() + " slots for a forecast of " + forecast.size());
        }
        PlanMetrics metrics = PlanMetrics.of(slots, initial.getSocPercent(), initial.getCapacityKwh(),
                forecast.terminalExportPrice(), constraints.clippingPenaltyPence());
        return new Plan(plannerType, Instant.now(), forecast.getStartTime(), initial.getSocPercent(), slots, metrics);
    }
}
