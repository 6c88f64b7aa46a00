package de.zeus.planner.support;

import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;

import java.time.Instant;
import java.util.Arrays;

/**
 * Forecasts and battery snapshots shared by the planner tests. One day is 48 half-hour slots from midnight UTC.
 */
public final class ScenarioFixtures {

    public static final Instant START = Instant.parse("2025-06-01T00:00:00Z");
    public static final int DAY = 48;

    private ScenarioFixtures() {
    }

    /** 10 kWh pack, 3 kW each way, 95 % conversion efficiency. */
    public static BatteryState battery(double socPercent) {
        return new BatteryState(socPercent, 10.0, 3.0, 3.0, 0.95, 0.95);
    }

    public static double[] flat(int slots, double value) {
        double[] series = new double[slots];
        Arrays.fill(series, value);
        return series;
    }

    /** Half-sine solar between 06:00 and 18:00 peaking at {@code peakKw} around noon. */
    public static double[] bellCurveSolar(int slots, double peakKw) {
        double[] solar = new double[slots];
        for (int i = 0; i < slots; i++) {
            int slotOfDay = i % DAY;
            if (slotOfDay >= 12 && slotOfDay < 36) {
                solar[i] = peakKw * Math.sin(Math.PI * (slotOfDay - 12 + 0.5) / 24.0);
            }
        }
        return solar;
    }

    /** 0.4 kW base load with a morning bump and an evening peak. */
    public static double[] dailyLoad(int slots) {
        double[] load = new double[slots];
        for (int i = 0; i < slots; i++) {
            int slotOfDay = i % DAY;
            if (slotOfDay >= 14 && slotOfDay < 18) {
                load[i] = 1.2;
            } else if (slotOfDay >= 34 && slotOfDay < 42) {
                load[i] = 2.0;
            } else {
                load[i] = 0.4;
            }
        }
        return load;
    }

    /** Import prices cycling through 5p to 50p every three hours. */
    public static double[] volatileImport(int slots) {
        double[] pattern = {5.0, 8.0, 15.0, 30.0, 50.0, 35.0};
        double[] prices = new double[slots];
        for (int i = 0; i < slots; i++) {
            prices[i] = pattern[i % pattern.length];
        }
        return prices;
    }

    /** Export paying 60 % of the import price in the same slot. */
    public static double[] volatileExport(int slots) {
        double[] imports = volatileImport(slots);
        double[] prices = new double[slots];
        for (int i = 0; i < slots; i++) {
            prices[i] = imports[i] * 0.6;
        }
        return prices;
    }

    /** Oscillating prices over a sunny day with a typical household load. */
    public static ForecastSeries volatilePricing() {
        return new ForecastSeries(START, volatileImport(DAY), volatileExport(DAY), bellCurveSolar(DAY, 6.0), dailyLoad(DAY));
    }

    /** No solar, 20p import, 5p export: nothing to gain from the battery. */
    public static ForecastSeries darkFlatDay() {
        return new ForecastSeries(START, flat(DAY, 20.0), flat(DAY, 5.0), flat(DAY, 0.0), dailyLoad(DAY));
    }

    public static ForecastSeries empty() {
        return new ForecastSeries(START, new double[0], new double[0], new double[0], new double[0]);
    }

    public static double sumLoadCost(ForecastSeries forecast) {
        double cost = 0.0;
        for (int i = 0; i < forecast.size(); i++) {
            cost += forecast.loadKw(i) * forecast.getSlotHours() * forecast.importPrice(i);
        }
        return cost;
    }
}
