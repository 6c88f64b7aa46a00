package de.zeus.planner.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

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
 * Aggregates of a plan for the executor, dashboards and tests. Costs are in pence.
 */
public class PlanMetrics {

    private final double totalCost;
    private final double totalClippedKwh;
    private final double totalImportKwh;
    private final double totalExportKwh;
    private final double finalSocPercent;
    private final double batteryValueChange;
    private final double clippingPenaltyCost;
    private final Map<OperatingMode, Integer> modeCounts;

    private PlanMetrics(double totalCost, double totalClippedKwh, double totalImportKwh, double totalExportKwh,
                        double finalSocPercent, double batteryValueChange, double clippingPenaltyCost,
                        Map<OperatingMode, Integer> modeCounts) {
        this.totalCost = totalCost;
        this.totalClippedKwh = totalClippedKwh;
        this.totalImportKwh = totalImportKwh;
        this.totalExportKwh = totalExportKwh;
        this.finalSocPercent = finalSocPercent;
        this.batteryValueChange = batteryValueChange;
        this.clippingPenaltyCost = clippingPenaltyCost;
        this.modeCounts = Collections.unmodifiableMap(modeCounts);
    }

    /**
     * Summarises the slots of a plan.
     *
     * @param slots                ordered plan slots
     * @param initialSocPercent    SOC before the first slot
     * @param capacityKwh          battery capacity, to convert the SOC change into energy
     * @param terminalExportPrice  price at which energy left in (or taken from) the battery is valued
     * @param clippingPenaltyPence per-kWh cost of wasted solar
     */
    public static PlanMetrics of(List<PlanSlot> slots, double initialSocPercent, double capacityKwh,
                                 double terminalExportPrice, double clippingPenaltyPence) {
        double cost = 0.0;
        double clipped = 0.0;
        double imported = 0.0;
        double exported = 0.0;
        Map<OperatingMode, Integer> counts = new EnumMap<>(OperatingMode.class);
        for (OperatingMode mode : OperatingMode.values()) {
            counts.put(mode, 0);
        }
        for (PlanSlot slot : slots) {
            cost += slot.getCost();
            clipped += slot.getClippedKwh();
            imported += slot.getGridImportKwh();
            exported += slot.getGridExportKwh();
            counts.merge(slot.getMode(), 1, Integer::sum);
        }
        double finalSoc = slots.isEmpty() ? initialSocPercent : slots.get(slots.size() - 1).getSocAfter();
        double valueChange = (initialSocPercent - finalSoc) / 100.0 * capacityKwh * terminalExportPrice;
        return new PlanMetrics(cost, clipped, imported, exported, finalSoc, valueChange,
                clipped * clippingPenaltyPence, counts);
    }

    public double getTotalCost() {
        return totalCost;
    }

    public double getTotalClippedKwh() {
        return totalClippedKwh;
    }

    public double getTotalImportKwh() {
        return totalImportKwh;
    }

    public double getTotalExportKwh() {
        return totalExportKwh;
    }

    public double getFinalSocPercent() {
        return finalSocPercent;
    }

    /** Value of stored energy consumed over the horizon, priced at the terminal export price. Negative when the battery ends fuller. */
    public double getBatteryValueChange() {
        return batteryValueChange;
    }

    public double getClippingPenaltyCost() {
        return clippingPenaltyCost;
    }

    /** Cost the optimal planner minimises; comparable across planners. */
    public double getObjectiveValue() {
        return totalCost + clippingPenaltyCost + batteryValueChange;
    }

    public Map<OperatingMode, Integer> getModeCounts() {
        return modeCounts;
    }

    public int count(OperatingMode mode) {
        return modeCounts.getOrDefault(mode, 0);
    }

    @Override
    public String toString() {
        return String.format("cost %.2fp, clipped %.2fkWh, %d charge, %d discharge, %d feed-in, %d self-use, final SOC %.1f%%",
                totalCost, totalClippedKwh, count(OperatingMode.FORCE_CHARGE), count(OperatingMode.FORCE_DISCHARGE),
                count(OperatingMode.GRID_FIRST), count(OperatingMode.SELF_USE), finalSocPercent);
    }
}
