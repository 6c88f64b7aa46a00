package de.zeus.planner.service;

import de.zeus.planner.config.LogFilter;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.event.PlanCreatedEvent;
import de.zeus.planner.exception.ForecastInputException;
import de.zeus.planner.exception.InfeasibleOptimizationException;
import de.zeus.planner.exception.SolverTimeoutException;
import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.OperatingMode;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlanMetrics;
import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningConstraints;
import de.zeus.planner.model.PlanningResult;
import org.springframework.context.ApplicationEventPublisher;
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
 * Runs one planning cycle. The optimal planner is tried first when configured; if it reports an infeasible model
 * or runs out of time the rule-based planner takes over and the result says so.
 */
@Service
public class PlanningService {

    private final RuleBasedPlanner ruleBasedPlanner;
    private final MathOptimalPlanner mathOptimalPlanner;
    private final PlannerProperties plannerProperties;
    private final ApplicationEventPublisher eventPublisher;

    public PlanningService(RuleBasedPlanner ruleBasedPlanner, MathOptimalPlanner mathOptimalPlanner,
                           PlannerProperties plannerProperties, ApplicationEventPublisher eventPublisher) {
        this.ruleBasedPlanner = ruleBasedPlanner;
        this.mathOptimalPlanner = mathOptimalPlanner;
        this.plannerProperties = plannerProperties;
        this.eventPublisher = eventPublisher;
    }

    public PlanningResult plan(ForecastSeries forecast, BatteryState battery) {
        return plan(forecast, battery, plannerProperties.getStrategy());
    }

    /**
     * Plans the horizon with the requested planner.
     *
     * @param forecast  forecast for the horizon
     * @param battery   current battery snapshot
     * @param requested planner to use; MATH_OPTIMAL falls back to RULE_BASED on failure
     * @return the plan with the planner that produced it
     * @throws ForecastInputException when the inputs are missing or do not match the configured slot length
     */
    public PlanningResult plan(ForecastSeries forecast, BatteryState battery, PlannerType requested) {
        if (forecast == null || battery == null) {
            throw new ForecastInputException("Forecast and battery state are required");
        }
        if (!forecast.getSlotDuration().equals(plannerProperties.getSlotDuration())) {
            throw new ForecastInputException("Forecast slots last " + forecast.getSlotDuration().toMinutes()
                    + " min, expected " + plannerProperties.getSlotMinutes());
        }
        PlannerType plannerType = requested != null ? requested : plannerProperties.getStrategy();
        PlanningConstraints constraints = plannerProperties.toConstraints();

        PlanningResult result;
        if (plannerType == PlannerType.MATH_OPTIMAL) {
            result = planOptimal(forecast, battery, constraints);
        } else {
            result = new PlanningResult(ruleBasedPlanner.createPlan(forecast, battery, constraints), plannerType, null);
        }

        logSummary(result);
        eventPublisher.publishEvent(new PlanCreatedEvent(this, result));
        return result;
    }

    private PlanningResult planOptimal(ForecastSeries forecast, BatteryState battery, PlanningConstraints constraints) {
        String fallbackReason;
        try {
            return new PlanningResult(mathOptimalPlanner.createPlan(forecast, battery, constraints),
                    PlannerType.MATH_OPTIMAL, null);
        } catch (InfeasibleOptimizationException e) {
            fallbackReason = "LP infeasible: " + e.getMessage();
        } catch (SolverTimeoutException e) {
            fallbackReason = "LP timeout: " + e.getMessage();
        }
        LogFilter.logWarn(PlanningService.class, "Optimal planner failed ({}). Falling back to rule-based planner.",
                fallbackReason);
        Plan fallback = ruleBasedPlanner.createPlan(forecast, battery, constraints);
        return new PlanningResult(fallback, PlannerType.MATH_OPTIMAL, fallbackReason);
    }

    private void logSummary(PlanningResult result) {
        Plan plan = result.plan();
        PlanMetrics metrics = plan.getMetrics();
        LogFilter.logInfo(PlanningService.class,
                "{} plan for {} slots from {}: {} charge, {} discharge, {} feed-in, clipped {} kWh, cost {}p{}",
                result.producedBy(), plan.size(), plan.getStartTime(),
                metrics.count(OperatingMode.FORCE_CHARGE), metrics.count(OperatingMode.FORCE_DISCHARGE),
                metrics.count(OperatingMode.GRID_FIRST), String.format("%.2f", metrics.getTotalClippedKwh()),
                String.format("%.2f", metrics.getTotalCost()), result.isFallback() ? " (fallback)" : "");
    }
}
