package de.zeus.planner.model;

import java.time.Instant;

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
 * One half-hour entry of a plan: the requested mode, the flows it is expected to produce and why it was chosen.
 */
public class PlanSlot {

    private final int index;
    private final Instant time;
    private final OperatingMode mode;
    private final double gridImportKwh;
    private final double gridExportKwh;
    private final double batteryFlowKwh;
    private final double socBefore;
    private final double socAfter;
    private final double cost;
    private final double cumulativeCost;
    private final double clippedKwh;
    private final String reason;
    private final double solarKw;
    private final double loadKw;
    private final double importPrice;
    private final double exportPrice;

    public PlanSlot(int index, Instant time, ForecastSeries forecast, double socBefore,
                    SlotOutcome outcome, double cumulativeCost, String reason) {
        this.index = index;
        this.time = time;
        this.mode = outcome.mode();
        this.gridImportKwh = outcome.importKwh();
        this.gridExportKwh = outcome.exportKwh();
        this.batteryFlowKwh = outcome.batteryFlowKwh();
        this.socBefore = socBefore;
        this.socAfter = outcome.state().getSocPercent();
        this.cost = outcome.cost();
        this.cumulativeCost = cumulativeCost;
        this.clippedKwh = outcome.clippedKwh();
        this.reason = reason;
        this.solarKw = forecast.solarKw(index);
        this.loadKw = forecast.loadKw(index);
        this.importPrice = forecast.importPrice(index);
        this.exportPrice = forecast.exportPrice(index);
    }

    public int getIndex() {
        return index;
    }

    public Instant getTime() {
        return time;
    }

    public OperatingMode getMode() {
        return mode;
    }

    public double getGridImportKwh() {
        return gridImportKwh;
    }

    public double getGridExportKwh() {
        return gridExportKwh;
    }

    public double getBatteryFlowKwh() {
        return batteryFlowKwh;
    }

    public double getSocBefore() {
        return socBefore;
    }

    public double getSocAfter() {
        return socAfter;
    }

    /** Import cost minus export revenue for this slot, in pence. */
    public double getCost() {
        return cost;
    }

    public double getCumulativeCost() {
        return cumulativeCost;
    }

    public double getClippedKwh() {
        return clippedKwh;
    }

    public String getReason() {
        return reason;
    }

    public double getSolarKw() {
        return solarKw;
    }

    public double getLoadKw() {
        return loadKw;
    }

    public double getImportPrice() {
        return importPrice;
    }

    public double getExportPrice() {
        return exportPrice;
    }

    @Override
    public String toString() {
        return String.format("#%d %s %s soc %.1f%% -> %.1f%%, import %.2fkWh, export %.2fkWh, cost %.2fp (%s)",
                index, time, mode.getLabel(), socBefore, socAfter, gridImportKwh, gridExportKwh, cost, reason);
    }
}
