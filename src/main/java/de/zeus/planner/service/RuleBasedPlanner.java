package de.zeus.planner.service;

import de.zeus.planner.config.LogFilter;
import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.OperatingMode;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningConstraints;
import de.zeus.planner.model.SlotOutcome;
import org.springframework.stereotype.Service;

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
 * Heuristic planner. A reverse sweep ({@link HorizonAnalysis}) gathers look-ahead figures, then a single forward
 * pass picks one mode per slot. Rules are tried in a fixed order and the first one that fires decides the slot:
 * <ol>
 *     <li>floor recovery when the battery is below the minimum SOC</li>
 *     <li>feed-in priority while solar would otherwise clip or fill the battery before the run ends</li>
 *     <li>discharge ahead of sunrise to make room for a large solar surplus</li>
 *     <li>price arbitrage</li>
 *     <li>deficit prevention before the next cheap slot</li>
 *     <li>self use</li>
 * </ol>
 * The battery itself is simulated slot by slot through {@link SlotSimulator}, so the chosen intent and the
 * resulting flows always agree.
 */
@Service
public class RuleBasedPlanner implements BatteryPlanner {

    private static final double SOC_EPSILON = 1e-6;
    private static final double POWER_EPSILON = 1e-6;

    private final SlotSimulator slotSimulator;
    private final BatteryModel batteryModel;

    public RuleBasedPlanner(SlotSimulator slotSimulator, BatteryModel batteryModel) {
        this.slotSimulator = slotSimulator;
        this.batteryModel = batteryModel;
    }

    @Override
    public PlannerType getType() {
        return PlannerType.RULE_BASED;
    }

    @Override
    public Plan createPlan(ForecastSeries forecast, BatteryState battery, PlanningConstraints constraints) {
        PlanAssembler plan = new PlanAssembler(PlannerType.RULE_BASED, forecast, battery, constraints);
        if (forecast.isEmpty()) {
            return plan.build();
        }

        HorizonAnalysis horizon = HorizonAnalysis.of(forecast, battery, constraints);
        double hours = forecast.getSlotHours();
        double roundTrip = battery.getRoundTripEfficiency();
        double excessSolar = forecast.totalSolarKwh() - forecast.totalLoadKwh()
                - batteryModel.headroomKwh(battery, constraints.maxSocPercent());
        boolean surplusDay = excessSolar > constraints.preSunriseMarginKwh();
        double lowestImportSoFar = Double.POSITIVE_INFINITY;

        for (int i = 0; i < forecast.size(); i++) {
            BatteryState state = plan.current();
            double soc = state.getSocPercent();
            double surplusKw = forecast.solarKw(i) - forecast.loadKw(i);
            double headroom = batteryModel.headroomKwh(state, constraints.maxSocPercent());
            double available = batteryModel.reserveKwh(state, constraints.minSocPercent());
            lowestImportSoFar = Math.min(lowestImportSoFar, forecast.importPrice(i));

            Decision decision;
            if (soc < constraints.minSocPercent() - SOC_EPSILON) {
                decision = new Decision(OperatingMode.FORCE_CHARGE, state.getMaxChargeKw(),
                        String.format("Deficit prevention: SOC %.1f%% below minimum %.1f%%", soc, constraints.minSocPercent()));
            } else {
                decision = feedInPriority(horizon, i, state, surplusKw, headroom, constraints);
                if (decision == null && surplusDay) {
                    decision = preSunriseDischarge(horizon, i, state, hours, surplusKw, constraints);
                }
                if (decision == null) {
                    decision = arbitrage(forecast, horizon, i, state, hours, roundTrip, lowestImportSoFar,
                            available, constraints);
                }
                if (decision == null) {
                    decision = deficitPrevention(horizon, i, state, hours, available, constraints);
                }
                if (decision == null) {
                    decision = new Decision(OperatingMode.SELF_USE, 0.0, "Self use");
                }
            }

            SlotOutcome outcome = slotSimulator.simulate(forecast, i, state, decision.mode(), decision.powerKw(), constraints);
            LogFilter.logDebug(RuleBasedPlanner.class, "Slot {} ({}): {} at {} kW, SOC {} -> {}, reason: {}",
                    i, forecast.slotTime(i), decision.mode(), decision.powerKw(), soc,
                    outcome.state().getSocPercent(), decision.reason());
            plan.add(outcome, decision.reason());
        }
        return plan.build();
    }

    /**
     * Feed-in priority fires on clipping risk or on the battery filling before the solar run ends. Either signal
     * on its own is enough. Re-evaluated every slot, so the window closes once the battery can take the rest
     * of the run in self use.
     */
    private Decision feedInPriority(HorizonAnalysis horizon, int slot, BatteryState state, double surplusKw,
                                    double headroom, PlanningConstraints constraints) {
        if (!horizon.isDaylight(slot) || surplusKw <= 0.0) {
            return null;
        }
        double threshold = constraints.feedInClippingThresholdKwh();
        double rateClip = horizon.rateClipKwh(slot);
        double runOverflow = horizon.remainingExcess(slot) * state.getChargeEfficiency() - headroom;
        boolean clippingRisk = rateClip > threshold || runOverflow > threshold;

        // feed-in priority leaves the battery untouched below the export limit, so the headroom carries over
        boolean fullBeforeSubsides = horizon.remainingIntakeAfter(slot) > headroom + threshold;

        if (clippingRisk || fullBeforeSubsides) {
            String reason = clippingRisk
                    ? String.format("Feed-in priority: %.2f kWh of solar would clip in self use", Math.max(rateClip, runOverflow))
                    : String.format("Feed-in priority: battery full before solar subsides (%.2f kWh headroom)", headroom);
            return new Decision(OperatingMode.GRID_FIRST, 0.0, reason);
        }
        return null;
    }

    private Decision preSunriseDischarge(HorizonAnalysis horizon, int slot, BatteryState state, double hours,
                                         double surplusKw, PlanningConstraints constraints) {
        int sunrise = horizon.nextSunrise(slot);
        if (sunrise <= slot || horizon.isDaylight(slot)) {
            return null;
        }
        double projectedSurplus = horizon.remainingExcess(sunrise) * state.getChargeEfficiency();
        if (projectedSurplus <= 0.0) {
            return null;
        }
        double target = Math.max(constraints.minSocPercent(),
                constraints.maxSocPercent() - projectedSurplus / state.getCapacityKwh() * 100.0);
        double shedKwh = (state.getSocPercent() - target) / 100.0 * state.getCapacityKwh();
        // forced discharge only covers the load plus the self-use export cap
        double outputKw = Math.min(state.getMaxDischargeKw(), Math.max(0.0, constraints.selfUseExportLimitKw() - surplusKw));
        double perSlotKwh = outputKw * hours / state.getDischargeEfficiency();
        if (shedKwh <= SOC_EPSILON || perSlotKwh <= 0.0) {
            return null;
        }
        int slotsNeeded = (int) Math.ceil(shedKwh / perSlotKwh);
        if (slotsNeeded < sunrise - slot) {
            return null;
        }
        double powerKw = Math.min(state.getMaxDischargeKw(), shedKwh * state.getDischargeEfficiency() / hours);
        return new Decision(OperatingMode.FORCE_DISCHARGE, powerKw,
                String.format("Pre-sunrise discharge towards %.1f%% for %.2f kWh of expected surplus", target, projectedSurplus));
    }

    private Decision arbitrage(ForecastSeries forecast, HorizonAnalysis horizon, int slot, BatteryState state,
                               double hours, double roundTrip, double lowestImportSoFar, double available,
                               PlanningConstraints constraints) {
        double importPrice = forecast.importPrice(slot);
        double exportPrice = forecast.exportPrice(slot);
        double margin = constraints.arbitrageMarginPence();

        double laterExport = horizon.suffixMaxExport(slot + 1);
        if (horizon.isCheap(slot)
                && laterExport * roundTrip - importPrice > margin
                && state.getSocPercent() < constraints.maxSocPercent() - SOC_EPSILON) {
            return new Decision(OperatingMode.FORCE_CHARGE, state.getMaxChargeKw(),
                    String.format("Arbitrage charge at %.2fp for export at %.2fp", importPrice, laterExport));
        }

        if (exportPrice * roundTrip - lowestImportSoFar > margin
                && exportPrice >= importPrice
                && exportPrice >= laterExport) {
            double surplusStored = available - horizon.reserveNeedAfter(slot);
            double powerKw = Math.min(state.getMaxDischargeKw(), surplusStored * state.getDischargeEfficiency() / hours);
            if (powerKw > POWER_EPSILON) {
                return new Decision(OperatingMode.FORCE_DISCHARGE, powerKw,
                        String.format("Arbitrage discharge at %.2fp export", exportPrice));
            }
        }
        return null;
    }

    private Decision deficitPrevention(HorizonAnalysis horizon, int slot, BatteryState state, double hours,
                                       double available, PlanningConstraints constraints) {
        if (horizon.reserveNeed(slot) <= available + constraints.deficitToleranceKwh()) {
            return null;
        }
        double shortfall = horizon.reserveNeedAfter(slot) - available;
        double powerKw = Math.min(state.getMaxChargeKw(), shortfall / (state.getChargeEfficiency() * hours));
        if (powerKw <= POWER_EPSILON) {
            return null;
        }
        return new Decision(OperatingMode.FORCE_CHARGE, powerKw,
                String.format("Deficit prevention: %.2f kWh short before the next cheap slot", shortfall));
    }

    private record Decision(OperatingMode mode, double powerKw, String reason) {
    }
}
