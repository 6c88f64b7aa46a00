package de.zeus.planner.config;

import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningConstraints;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Planner tunables, bound from {@code planner.*}.
 * Converted into {@link PlanningConstraints} once per cycle; the planners never see this class.
 */
@Component
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    /**
     * Planner used when the caller does not ask for one. MATH_OPTIMAL falls back to RULE_BASED on failure.
     */
    private PlannerType strategy = PlannerType.MATH_OPTIMAL;

    /**
     * Length of one plan slot in minutes.
     */
    private int slotMinutes = 30;

    private double minSocPercent = 10.0;

    private double maxSocPercent = 100.0;

    /**
     * Export cap (kW) in self-use, force-charge and force-discharge.
     * Example: 3.68 for a G98 single-phase connection.
     */
    private double selfUseExportLimitKw = 3.68;

    /**
     * Export cap (kW) while feed-in priority is active.
     */
    private double gridFirstExportLimitKw = 5.0;

    /**
     * Minimum profit in pence per kWh, after round-trip losses, before arbitrage is attempted.
     */
    private double arbitrageMarginPence = 2.0;

    /**
     * Cost assigned to each kWh of wasted solar (pence).
     */
    private double clippingPenaltyPence = 50.0;

    /**
     * A slot counts as cheap while its import price is within this fraction of the cheapest remaining slot.
     */
    private double cheapPriceTolerance = 0.1;

    private double deficitToleranceKwh = 0.05;

    private final FeedIn feedIn = new FeedIn();
    private final PreSunrise preSunrise = new PreSunrise();
    private final Solver solver = new Solver();

    public PlanningConstraints toConstraints() {
        return new PlanningConstraints(minSocPercent, maxSocPercent, selfUseExportLimitKw, gridFirstExportLimitKw,
                arbitrageMarginPence, clippingPenaltyPence, feedIn.getSolarThresholdKw(),
                feedIn.getClippingThresholdKwh(), preSunrise.getMarginKwh(), cheapPriceTolerance,
                deficitToleranceKwh, Duration.ofMillis(solver.getTimeoutMs()), solver.getMaxIterations(),
                solver.getMaxNodes(), solver.getGridFirstSwitchPenaltyPence());
    }

    public Duration getSlotDuration() {
        return Duration.ofMinutes(slotMinutes);
    }

    public PlannerType getStrategy() {
        return strategy;
    }

    public void setStrategy(PlannerType strategy) {
        this.strategy = strategy;
    }

    public int getSlotMinutes() {
        return slotMinutes;
    }

    public void setSlotMinutes(int slotMinutes) {
        this.slotMinutes = slotMinutes;
    }

    public double getMinSocPercent() {
        return minSocPercent;
    }

    public void setMinSocPercent(double minSocPercent) {
        this.minSocPercent = minSocPercent;
    }

    public double getMaxSocPercent() {
        return maxSocPercent;
    }

    public void setMaxSocPercent(double maxSocPercent) {
        this.maxSocPercent = maxSocPercent;
    }

    public double getSelfUseExportLimitKw() {
        return selfUseExportLimitKw;
    }

    public void setSelfUseExportLimitKw(double selfUseExportLimitKw) {
        this.selfUseExportLimitKw = selfUseExportLimitKw;
    }

    public double getGridFirstExportLimitKw() {
        return gridFirstExportLimitKw;
    }

    public void setGridFirstExportLimitKw(double gridFirstExportLimitKw) {
        this.gridFirstExportLimitKw = gridFirstExportLimitKw;
    }

    public double getArbitrageMarginPence() {
        return arbitrageMarginPence;
    }

    public void setArbitrageMarginPence(double arbitrageMarginPence) {
        this.arbitrageMarginPence = arbitrageMarginPence;
    }

    public double getClippingPenaltyPence() {
        return clippingPenaltyPence;
    }

    public void setClippingPenaltyPence(double clippingPenaltyPence) {
        this.clippingPenaltyPence = clippingPenaltyPence;
    }

    public double getCheapPriceTolerance() {
        return cheapPriceTolerance;
    }

    public void setCheapPriceTolerance(double cheapPriceTolerance) {
        this.cheapPriceTolerance = cheapPriceTolerance;
    }

    public double getDeficitToleranceKwh() {
        return deficitToleranceKwh;
    }

    public void setDeficitToleranceKwh(double deficitToleranceKwh) {
        this.deficitToleranceKwh = deficitToleranceKwh;
    }

    public FeedIn getFeedIn() {
        return feedIn;
    }

    public PreSunrise getPreSunrise() {
        return preSunrise;
    }

    public Solver getSolver() {
        return solver;
    }

    public static class FeedIn {
        /**
         * Solar output (kW) above which a slot counts as daylight.
         */
        private double solarThresholdKw = 0.5;

        /**
         * Projected clipping (kWh) in self-use that is enough on its own to trigger feed-in priority.
         */
        private double clippingThresholdKwh = 0.05;

        public double getSolarThresholdKw() {
            return solarThresholdKw;
        }

        public void setSolarThresholdKw(double solarThresholdKw) {
            this.solarThresholdKw = solarThresholdKw;
        }

        public double getClippingThresholdKwh() {
            return clippingThresholdKwh;
        }

        public void setClippingThresholdKwh(double clippingThresholdKwh) {
            this.clippingThresholdKwh = clippingThresholdKwh;
        }
    }

    public static class PreSunrise {
        /**
         * Missing battery space (kWh) tolerated before a discharge ahead of sunrise is planned.
         */
        private double marginKwh = 1.0;

        public double getMarginKwh() {
            return marginKwh;
        }

        public void setMarginKwh(double marginKwh) {
            this.marginKwh = marginKwh;
        }
    }

    public static class Solver {
        private long timeoutMs = 10_000;
        private int maxIterations = 200_000;
        private int maxNodes = 200;

        /**
         * Tie-break cost per feed-in priority slot so the optimiser only raises the export cap when it helps.
         */
        private double gridFirstSwitchPenaltyPence = 0.01;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getMaxIterations() {
            return maxIterations;
        }

        public void setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
        }

        public int getMaxNodes() {
            return maxNodes;
        }

        public void setMaxNodes(int maxNodes) {
            this.maxNodes = maxNodes;
        }

        public double getGridFirstSwitchPenaltyPence() {
            return gridFirstSwitchPenaltyPence;
        }

        public void setGridFirstSwitchPenaltyPence(double gridFirstSwitchPenaltyPence) {
            this.gridFirstSwitchPenaltyPence = gridFirstSwitchPenaltyPence;
        }
    }
}
