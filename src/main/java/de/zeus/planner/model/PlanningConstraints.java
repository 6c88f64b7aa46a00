package de.zeus.planner.model;

import java.time.Duration;

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
 * Constants a planning cycle runs under. Passed explicitly into every planner invocation so the
 * planners never read global configuration.
 *
 * @param minSocPercent               lowest SOC the plan may reach
 * @param maxSocPercent               highest SOC the plan may reach
 * @param selfUseExportLimitKw        export cap outside feed-in priority
 * @param gridFirstExportLimitKw      raised export cap in feed-in priority
 * @param arbitrageMarginPence        minimum per-kWh profit after round-trip losses
 * @param clippingPenaltyPence        per-kWh cost assigned to wasted solar
 * @param solarThresholdKw            solar output that counts as "the sun is up"
 * @param feedInClippingThresholdKwh  clipping that justifies switching to feed-in priority
 * @param preSunriseMarginKwh         space shortfall tolerated before discharging ahead of sunrise
 * @param cheapPriceTolerance         fraction above the remaining horizon minimum that still counts as cheap
 * @param deficitToleranceKwh         reserve shortfall ignored by deficit prevention
 * @param solverTimeout               wall-clock budget for the LP solver
 * @param solverMaxIterations         simplex iteration budget per relaxation
 * @param solverMaxNodes              branch-and-bound node budget
 * @param gridFirstSwitchPenaltyPence tie-break cost per feed-in priority slot in the LP objective
 */
public record PlanningConstraints(double minSocPercent,
                                  double maxSocPercent,
                                  double selfUseExportLimitKw,
                                  double gridFirstExportLimitKw,
                                  double arbitrageMarginPence,
                                  double clippingPenaltyPence,
                                  double solarThresholdKw,
                                  double feedInClippingThresholdKwh,
                                  double preSunriseMarginKwh,
                                  double cheapPriceTolerance,
                                  double deficitToleranceKwh,
                                  Duration solverTimeout,
                                  int solverMaxIterations,
                                  int solverMaxNodes,
                                  double gridFirstSwitchPenaltyPence) {

    public PlanningConstraints {
        if (minSocPercent < 0 || maxSocPercent > 100 || minSocPercent >= maxSocPercent) {
            throw new IllegalArgumentException("Invalid SOC band: " + minSocPercent + " to " + maxSocPercent);
        }
        if (selfUseExportLimitKw < 0 || gridFirstExportLimitKw < selfUseExportLimitKw) {
            throw new IllegalArgumentException("Grid-first export limit (" + gridFirstExportLimitKw
                    + " kW) must be at least the self-use limit (" + selfUseExportLimitKw + " kW)");
        }
        if (clippingPenaltyPence < 0 || gridFirstSwitchPenaltyPence < 0) {
            throw new IllegalArgumentException("Penalties must not be negative");
        }
        if (solverTimeout == null || solverTimeout.isNegative() || solverTimeout.isZero()) {
            throw new IllegalArgumentException("Solver timeout must be positive");
        }
        if (solverMaxIterations <= 0 || solverMaxNodes <= 0) {
            throw new IllegalArgumentException("Solver budgets must be positive");
        }
    }

    /** Defaults matching {@code application.properties}. */
    public static PlanningConstraints defaults() {
        return new PlanningConstraints(10.0, 100.0, 3.68, 5.0, 2.0, 50.0,
                0.5, 0.05, 1.0, 0.1, 0.05,
                Duration.ofSeconds(10), 200_000, 200, 0.01);
    }

    public PlanningConstraints withSolverTimeout(Duration timeout) {
        return new PlanningConstraints(minSocPercent, maxSocPercent, selfUseExportLimitKw, gridFirstExportLimitKw,
                arbitrageMarginPence, clippingPenaltyPence, solarThresholdKw, feedInClippingThresholdKwh,
                preSunriseMarginKwh, cheapPriceTolerance, deficitToleranceKwh, timeout, solverMaxIterations,
                solverMaxNodes, gridFirstSwitchPenaltyPence);
    }

    public PlanningConstraints withSocBand(double minSoc, double maxSoc) {
        return new PlanningConstraints(minSoc, maxSoc, selfUseExportLimitKw, gridFirstExportLimitKw,
                arbitrageMarginPence, clippingPenaltyPence, solarThresholdKw, feedInClippingThresholdKwh,
                preSunriseMarginKwh, cheapPriceTolerance, deficitToleranceKwh, solverTimeout, solverMaxIterations,
                solverMaxNodes, gridFirstSwitchPenaltyPence);
    }

    public PlanningConstraints withArbitrageMargin(double marginPence) {
        return new PlanningConstraints(minSocPercent, maxSocPercent, selfUseExportLimitKw, gridFirstExportLimitKw,
                marginPence, clippingPenaltyPence, solarThresholdKw, feedInClippingThresholdKwh,
                preSunriseMarginKwh, cheapPriceTolerance, deficitToleranceKwh, solverTimeout, solverMaxIterations,
                solverMaxNodes, gridFirstSwitchPenaltyPence);
    }

    public double exportLimitKw(OperatingMode mode) {
        return mode == OperatingMode.GRID_FIRST ? gridFirstExportLimitKw : selfUseExportLimitKw;
    }
}
