package de.zeus.planner.model;

import de.zeus.planner.exception.ForecastInputException;

import java.time.Duration;
import java.time.Instant;

/**
 * JSON body of a planning request: the forecast series, the battery snapshot and optionally the planner to use.
 */
public class PlanRequest {

    private Instant startTime;
    private double[] importPrice;
    private double[] exportPrice;
    private double[] solarKw;
    private double[] loadKw;
    private Battery battery;
    private PlannerType planner;

    public ForecastSeries toForecast(Duration slotDuration) {
        return new ForecastSeries(startTime, slotDuration, importPrice, exportPrice, solarKw, loadKw);
    }

    public BatteryState toBatteryState() {
        if (battery == null) {
            throw new ForecastInputException("Battery snapshot is required");
        }
        return new BatteryState(battery.getSocPercent(), battery.getCapacityKwh(), battery.getMaxChargeKw(),
                battery.getMaxDischargeKw(), battery.getChargeEfficiency(), battery.getDischargeEfficiency());
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public double[] getImportPrice() {
        return importPrice;
    }

    public void setImportPrice(double[] importPrice) {
        this.importPrice = importPrice;
    }

    public double[] getExportPrice() {
        return exportPrice;
    }

    public void setExportPrice(double[] exportPrice) {
        this.exportPrice = exportPrice;
    }

    public double[] getSolarKw() {
        return solarKw;
    }

    public void setSolarKw(double[] solarKw) {
        this.solarKw = solarKw;
    }

    public double[] getLoadKw() {
        return loadKw;
    }

    public void setLoadKw(double[] loadKw) {
        this.loadKw = loadKw;
    }

    public Battery getBattery() {
        return battery;
    }

    public void setBattery(Battery battery) {
        this.battery = battery;
    }

    public PlannerType getPlanner() {
        return planner;
    }

    public void setPlanner(PlannerType planner) {
        this.planner = planner;
    }

    public static class Battery {
        private double socPercent;
        private double capacityKwh;
        private double maxChargeKw;
        private double maxDischargeKw;
        private double chargeEfficiency = 0.95;
        private double dischargeEfficiency = 0.95;

        public double getSocPercent() {
            return socPercent;
        }

        public void setSocPercent(double socPercent) {
            this.socPercent = socPercent;
        }

        public double getCapacityKwh() {
            return capacityKwh;
        }

        public void setCapacityKwh(double capacityKwh) {
            this.capacityKwh = capacityKwh;
        }

        public double getMaxChargeKw() {
            return maxChargeKw;
        }

        public void setMaxChargeKw(double maxChargeKw) {
            this.maxChargeKw = maxChargeKw;
        }

        public double getMaxDischargeKw() {
            return maxDischargeKw;
        }

        public void setMaxDischargeKw(double maxDischargeKw) {
            this.maxDischargeKw = maxDischargeKw;
        }

        public double getChargeEfficiency() {
            return chargeEfficiency;
        }

        public void setChargeEfficiency(double chargeEfficiency) {
            this.chargeEfficiency = chargeEfficiency;
        }

        public double getDischargeEfficiency() {
            return dischargeEfficiency;
        }

        public void setDischargeEfficiency(double dischargeEfficiency) {
            this.dischargeEfficiency = dischargeEfficiency;
        }
    }
}
