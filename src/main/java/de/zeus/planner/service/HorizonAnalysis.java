package de.zeus.planner.service;

import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.PlanningConstraints;

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
 * Look-ahead figures for the rule-based planner, filled by one reverse sweep over the horizon.
 * All energies are kWh; "stored" figures already include conversion losses.
 */
final class HorizonAnalysis {

    private final int size;
    private final double[] suffixMinImport;
    private final double[] suffixMaxExport;
    private final boolean[] cheap;
    private final double[] reserveNeed;
    private final boolean[] daylight;
    private final double[] remainingIntake;
    private final double[] remainingExcess;
    private final double[] rateClipKwh;
    private final int[] nextSunrise;

    private HorizonAnalysis(int size) {
        this.size = size;
        this.suffixMinImport = new double[size + 1];
        this.suffixMaxExport = new double[size + 1];
        this.cheap = new boolean[size];
        this.reserveNeed = new double[size + 1];
        this.daylight = new boolean[size + 1];
        this.remainingIntake = new double[size + 1];
        this.remainingExcess = new double[size + 1];
        this.rateClipKwh = new double[size];
        this.nextSunrise = new int[size + 1];
    }

    static HorizonAnalysis of(ForecastSeries forecast, BatteryState battery, PlanningConstraints constraints) {
        int n = forecast.size();
        HorizonAnalysis a = new HorizonAnalysis(n);
        double hours = forecast.getSlotHours();
        double ce = battery.getChargeEfficiency();
        double de = battery.getDischargeEfficiency();
        double suLimit = constraints.selfUseExportLimitKw();

        a.suffixMinImport[n] = Double.POSITIVE_INFINITY;
        a.suffixMaxExport[n] = Double.NEGATIVE_INFINITY;
        a.nextSunrise[n] = -1;

        for (int i = 0; i < n; i++) {
            a.daylight[i] = forecast.solarKw(i) > constraints.solarThresholdKw();
        }

        for (int i = n - 1; i >= 0; i--) {
            double importPrice = forecast.importPrice(i);
            a.suffixMinImport[i] = Math.min(importPrice, a.suffixMinImport[i + 1]);
            a.suffixMaxExport[i] = Math.max(forecast.exportPrice(i), a.suffixMaxExport[i + 1]);
            double floorPrice = a.suffixMinImport[i];
            a.cheap[i] = importPrice <= floorPrice + Math.abs(floorPrice) * constraints.cheapPriceTolerance();

            double netKw = forecast.solarKw(i) - forecast.loadKw(i);
            double surplusKw = Math.max(0.0, netKw);
            double drain = netKw < 0.0
                    ? Math.min(-netKw, battery.getMaxDischargeKw()) * hours / de
                    : -Math.min(surplusKw, battery.getMaxChargeKw()) * hours * ce;
            double carried = i + 1 < n && !a.cheap[i + 1] ? a.reserveNeed[i + 1] : 0.0;
            a.reserveNeed[i] = Math.max(0.0, drain + carried);

            boolean runContinues = i + 1 < n && a.daylight[i + 1];
            double intake = Math.min(surplusKw, battery.getMaxChargeKw()) * hours * ce;
            a.rateClipKwh[i] = Math.max(0.0, surplusKw - suLimit - battery.getMaxChargeKw()) * hours;
            if (a.daylight[i]) {
                a.remainingIntake[i] = intake + (runContinues ? a.remainingIntake[i + 1] : 0.0);
                a.remainingExcess[i] = Math.max(0.0, surplusKw - suLimit) * hours
                        + (runContinues ? a.remainingExcess[i + 1] : 0.0);
            }

            boolean sunrise = a.daylight[i] && (i == 0 || !a.daylight[i - 1]);
            a.nextSunrise[i] = sunrise ? i : a.nextSunrise[i + 1];
        }
        return a;
    }

    int size() {
        return size;
    }

    double suffixMinImport(int slot) {
        return suffixMinImport[slot];
    }

    /** Best export price from this slot to the end; negative infinity past the horizon. */
    double suffixMaxExport(int slot) {
        return suffixMaxExport[slot];
    }

    boolean isCheap(int slot) {
        return slot < size && cheap[slot];
    }

    /** Stored energy above the floor needed at the start of the slot to cover self-use drains until the next cheap slot. */
    double reserveNeed(int slot) {
        return reserveNeed[slot];
    }

    /** Reserve still needed once this slot is over; zero when the next slot is a cheap one. */
    double reserveNeedAfter(int slot) {
        return slot + 1 < size && !cheap[slot + 1] ? reserveNeed[slot + 1] : 0.0;
    }

    boolean isDaylight(int slot) {
        return daylight[slot];
    }

    /** Stored energy self use would push into the battery after this slot until its solar run ends. */
    double remainingIntakeAfter(int slot) {
        return slot + 1 < size && daylight[slot + 1] ? remainingIntake[slot + 1] : 0.0;
    }

    /** Surplus above the self-use export cap from this slot to the end of its solar run (AC side). */
    double remainingExcess(int slot) {
        return remainingExcess[slot];
    }

    /** Surplus this slot clips in self-use even with the battery charging at full rate. */
    double rateClipKwh(int slot) {
        return rateClipKwh[slot];
    }

    /** First daylight slot at or after this one that follows darkness, or -1. */
    int nextSunrise(int slot) {
        return nextSunrise[slot];
    }
}
