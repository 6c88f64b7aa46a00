package de.zeus.planner.model;

import de.zeus.planner.exception.ForecastInputException;

import java.util.Objects;

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
 * Immutable battery snapshot. New states are only produced by the battery model, one slot at a time.
 */
public final class BatteryState {

    private final double socPercent;
    private final double capacityKwh;
    private final double maxChargeKw;
    private final double maxDischargeKw;
    private final double chargeEfficiency;
    private final double dischargeEfficiency;

    public BatteryState(double socPercent, double capacityKwh, double maxChargeKw, double maxDischargeKw,
                        double chargeEfficiency, double dischargeEfficiency) {
        require(Double.isFinite(socPercent) && socPercent >= 0.0 && socPercent <= 100.0,
                "SOC must be within [0, 100] but was " + socPercent);
        require(Double.isFinite(capacityKwh) && capacityKwh > 0.0,
                "Battery capacity must be positive but was " + capacityKwh);
        require(Double.isFinite(maxChargeKw) && maxChargeKw >= 0.0,
                "Max charge rate must not be negative but was " + maxChargeKw);
        require(Double.isFinite(maxDischargeKw) && maxDischargeKw >= 0.0,
                "Max discharge rate must not be negative but was " + maxDischargeKw);
        require(chargeEfficiency > 0.0 && chargeEfficiency <= 1.0,
                "Charge efficiency must be within (0, 1] but was " + chargeEfficiency);
        require(dischargeEfficiency > 0.0 && dischargeEfficiency <= 1.0,
                "Discharge efficiency must be within (0, 1] but was " + dischargeEfficiency);
        this.socPercent = socPercent;
        this.capacityKwh = capacityKwh;
        this.maxChargeKw = maxChargeKw;
        this.maxDischargeKw = maxDischargeKw;
        this.chargeEfficiency = chargeEfficiency;
        this.dischargeEfficiency = dischargeEfficiency;
    }

    public BatteryState withSoc(double newSocPercent) {
        return new BatteryState(newSocPercent, capacityKwh, maxChargeKw, maxDischargeKw,
                chargeEfficiency, dischargeEfficiency);
    }

    public double getSocPercent() {
        return socPercent;
    }

    public double getCapacityKwh() {
        return capacityKwh;
    }

    public double getMaxChargeKw() {
        return maxChargeKw;
    }

    public double getMaxDischargeKw() {
        return maxDischargeKw;
    }

    public double getChargeEfficiency() {
        return chargeEfficiency;
    }

    public double getDischargeEfficiency() {
        return dischargeEfficiency;
    }

    public double getRoundTripEfficiency() {
        return chargeEfficiency * dischargeEfficiency;
    }

    /** Energy currently stored, in kWh. */
    public double getStoredKwh() {
        return socPercent / 100.0 * capacityKwh;
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new ForecastInputException(message);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatteryState that = (BatteryState) o;
        return Double.compare(that.socPercent, socPercent) == 0
                && Double.compare(that.capacityKwh, capacityKwh) == 0
                && Double.compare(that.maxChargeKw, maxChargeKw) == 0
                && Double.compare(that.maxDischargeKw, maxDischargeKw) == 0
                && Double.compare(that.chargeEfficiency, chargeEfficiency) == 0
                && Double.compare(that.dischargeEfficiency, dischargeEfficiency) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(socPercent, capacityKwh, maxChargeKw, maxDischargeKw, chargeEfficiency, dischargeEfficiency);
    }

    @Override
    public String toString() {
        return String.format("BatteryState{soc=%.2f%%, capacity=%.2fkWh, charge=%.2fkW, discharge=%.2fkW}",
                socPercent, capacityKwh, maxChargeKw, maxDischargeKw);
    }
}
