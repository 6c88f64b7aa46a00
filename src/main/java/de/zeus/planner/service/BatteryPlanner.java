package de.zeus.planner.service;

import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlannerType;
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
 * A planner turns a forecast and the current battery snapshot into a complete plan.
 * Implementations hold no state between calls.
 */
public interface BatteryPlanner {

    PlannerType getType();

    /**
     * @throws de.zeus.planner.exception.ForecastInputException when inputs are unusable
     * @throws de.zeus.planner.exception.PlanningException      when the planner cannot produce a plan
     */
    Plan createPlan(ForecastSeries forecast, BatteryState battery, PlanningConstraints constraints);
}
