package de.zeus.planner.model;

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
 * Inverter operating modes a plan slot can request from the executor.
 */
public enum OperatingMode {

    /** Solar serves the house, surplus charges the battery, overflow is exported. */
    SELF_USE("Self Use"),

    /** Feed-in priority: surplus solar is exported first at the raised limit, the battery takes the rest. */
    GRID_FIRST("Feed-in Priority"),

    /** Battery charges at an explicit rate, from the grid if needed. */
    FORCE_CHARGE("Force Charge"),

    /** Battery discharges at an explicit rate, exporting what the house does not use. */
    FORCE_DISCHARGE("Force Discharge");

    private final String label;

    OperatingMode(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
