package de.zeus.planner.controller;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.exception.ForecastInputException;
import de.zeus.planner.model.ApiResponse;
import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.PlanComparison;
import de.zeus.planner.model.PlanRequest;
import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningResult;
import de.zeus.planner.service.PlanningService;
import de.zeus.planner.util.PlanComparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.ResponseBody;

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

@Controller
public class PlanController {

    private static final Logger log = LoggerFactory.getLogger(PlanController.class);

    @Autowired
    private PlanningService planningService;

    @Autowired
    private PlanComparator planComparator;

    @Autowired
    private PlannerProperties plannerProperties;

    @PostMapping("/api/plans")
    @ResponseBody
    public ApiResponse<PlanningResult> createPlan(@RequestBody PlanRequest request) {
        try {
            PlanningResult result = planningService.plan(forecastOf(request), request.toBatteryState(), request.getPlanner());
            String message = result.isFallback()
                    ? "Plan created by " + result.producedBy() + " after fallback: " + result.fallbackReason()
                    : "Plan created by " + result.producedBy();
            log.info("{} ({} slots)", message, result.plan().size());
            return ApiResponse.ok(message, result);
        } catch (ForecastInputException e) {
            log.warn("Rejected planning request: {}", e.getMessage());
            return ApiResponse.failure(HttpStatus.BAD_REQUEST, "Invalid planning request: " + e.getMessage());
        } catch (Exception e) {
            log.error("Error creating plan", e);
            return ApiResponse.failure(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to create plan: " + e.getMessage());
        }
    }

    @PostMapping("/api/plans/compare")
    @ResponseBody
    public ApiResponse<PlanComparison> comparePlanners(@RequestBody PlanRequest request) {
        try {
            ForecastSeries forecast = forecastOf(request);
            BatteryState battery = request.toBatteryState();
            PlanningResult ruleBased = planningService.plan(forecast, battery, PlannerType.RULE_BASED);
            PlanningResult optimal = planningService.plan(forecast, battery, PlannerType.MATH_OPTIMAL);
            PlanComparison comparison = planComparator.compare(ruleBased.plan(), optimal.plan());
            log.info("Compared planners: cost delta {}p, {} differing slots",
                    String.format("%.2f", comparison.costDelta()), comparison.differingSlots().size());
            return ApiResponse.ok("Plans compared", comparison);
        } catch (ForecastInputException e) {
            log.warn("Rejected comparison request: {}", e.getMessage());
            return ApiResponse.failure(HttpStatus.BAD_REQUEST, "Invalid planning request: " + e.getMessage());
        } catch (Exception e) {
            log.error("Error comparing plans", e);
            return ApiResponse.failure(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to compare plans: " + e.getMessage());
        }
    }

    private ForecastSeries forecastOf(PlanRequest request) {
        if (request == null) {
            throw new ForecastInputException("Request body is required");
        }
        return request.toForecast(plannerProperties.getSlotDuration());
    }
}
