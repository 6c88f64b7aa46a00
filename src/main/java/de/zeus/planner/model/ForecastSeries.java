package de.zeus.planner.model;

import de.zeus.planner.exception.ForecastInputException;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

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
 * Equal-length half-hourly forecast of prices (pence/kWh), solar generation and load (average kW per slot).
 * Slot {@code i} starts at {@code startTime + i * slotDuration}.
 */
public final class ForecastSeries {

    public static final Duration DEFAULT_SLOT_DURATION = Duration.ofMinutes(30);

    private final Instant startTime;
    private final Duration slotDuration;
    private final double[] importPrice;
    private final double[] exportPrice;
    private final double[] solarKw;
    private final double[] loadKw;

    public ForecastSeries(Instant startTime, double[] importPrice, double[] exportPrice,
                          double[] solarKw, double[] loadKw) {
        this(startTime, DEFAULT_SLOT_DURATION, importPrice, exportPrice, solarKw, loadKw);
    }

    public ForecastSeries(Instant startTime, Duration slotDuration, double[] importPrice, double[] exportPrice,
                          double[] solarKw, double[] loadKw) {
        if (startTime == null) {
            throw new ForecastInputException("Forecast start time is required");
        }
        if (slotDuration == null || slotDuration.isZero() || slotDuration.isNegative()) {
            throw new ForecastInputException("Slot duration must be positive");
        }
        if (importPrice == null || exportPrice == null || solarKw == null || loadKw == null) {
            throw new ForecastInputException("All four forecast series are required");
        }
        int n = importPrice.length;
        checkLength("export price", exportPrice, n);
        checkLength("solar", solarKw, n);
        checkLength("load", loadKw, n);
        for (int i = 0; i < n; i++) {
            checkFinite("import price", importPrice[i], i);
            checkFinite("export price", exportPrice[i], i);
            checkNonNegative("solar", solarKw[i], i);
            checkNonNegative("load", loadKw[i], i);
        }
        this.startTime = startTime;
        this.slotDuration = slotDuration;
        this.importPrice = importPrice.clone();
        this.exportPrice = exportPrice.clone();
        this.solarKw = solarKw.clone();
        this.loadKw = loadKw.clone();
    }

    private static void checkLength(String name, double[] series, int expected) {
        if (series.length != expected) {
            throw new ForecastInputException(String.format("%s series has %d slots but import price series has %d",
                    name, series.length, expected));
        }
    }

    private static void checkFinite(String name, double value, int slot) {
        if (!Double.isFinite(value)) {
            throw new ForecastInputException(String.format("%s at slot %d is not a finite number", name, slot));
        }
    }

    private static void checkNonNegative(String name, double value, int slot) {
        checkFinite(name, value, slot);
        if (value < 0.0) {
            throw new ForecastInputException(String.format("%s at slot %d is negative (%.3f kW)", name, slot, value));
        }
    }

    public int size() {
        return importPrice.length;
    }

    public boolean isEmpty() {
        return importPrice.length == 0;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getSlotDuration() {
        return slotDuration;
    }

    public double getSlotHours() {
        return slotDuration.toMillis() / 3_600_000.0;
    }

    public Instant slotTime(int index) {
        return startTime.plus(slotDuration.multipliedBy(index));
    }

    public double importPrice(int index) {
        return importPrice[index];
    }

    public double exportPrice(int index) {
        return exportPrice[index];
    }

    public double solarKw(int index) {
        return solarKw[index];
    }

    public double loadKw(int index) {
        return loadKw[index];
    }

    /** Export price of the last slot, used to value energy left in the battery at the end of the horizon. */
    public double terminalExportPrice() {
        return isEmpty() ? 0.0 : exportPrice[exportPrice.length - 1];
    }

    public double totalSolarKwh() {
        return Arrays.stream(solarKw).sum() * getSlotHours();
    }

    public double totalLoadKwh() {
        return Arrays.stream(loadKw).sum() * getSlotHours();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ForecastSeries that = (ForecastSeries) o;
        return startTime.equals(that.startTime)
                && slotDuration.equals(that.slotDuration)
                && Arrays.equals(importPrice, that.importPrice)
                && Arrays.equals(exportPrice, that.exportPrice)
                && Arrays.equals(solarKw, that.solarKw)
                && Arrays.equals(loadKw, that.loadKw);
    }

    @Override
    public int hashCode() {
        int result = startTime.hashCode();
        result = 31 * result + slotDuration.hashCode();
        result = 31 * result + Arrays.hashCode(importPrice);
        result = 31 * result + Arrays.hashCode(exportPrice);
        result = 31 * result + Arrays.hashCode(solarKw);
        result = 31 * result + Arrays.hashCode(loadKw);
        return result;
    }
}
