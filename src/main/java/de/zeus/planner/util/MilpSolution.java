package de.zeus.planner.util;

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
 * Best integer-feasible point found by {@link MixedIntegerSolver}.
 *
 * @param point       variable values
 * @param value       objective value including its constant
 * @param bound       objective of the root relaxation, a lower bound for every integer-feasible point
 * @param nodes       branch-and-bound nodes evaluated
 * @param relaxations LP relaxations solved, including rounding attempts
 */
public record MilpSolution(double[] point, double value, double bound, int nodes, int relaxations) {

    public double get(int variable) {
        return point[variable];
    }
}
