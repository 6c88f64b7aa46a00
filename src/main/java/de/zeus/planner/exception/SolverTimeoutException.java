package de.zeus.planner.exception;

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
 * The solver exceeded its wall-clock or iteration budget. Treated like infeasibility.
 */
public class SolverTimeoutException extends PlanningException {

    public SolverTimeoutException(String message) {
        super(message);
    }

    public SolverTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
