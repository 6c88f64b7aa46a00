package de.zeus.planner.util;

import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.Relationship;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

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
 * Minimisation problem over non-negative variables, some of which may be declared binary.
 * Rows are dense coefficient arrays as Commons Math expects them.
 */
public final class LinearProgram {

    private final int variableCount;
    private final double[] objective;
    private double objectiveConstant;
    private final List<LinearConstraint> constraints = new ArrayList<>();
    private final SortedSet<Integer> binaries = new TreeSet<>();

    public LinearProgram(int variableCount) {
        if (variableCount <= 0) {
            throw new IllegalArgumentException("A linear program needs at least one variable");
        }
        this.variableCount = variableCount;
        this.objective = new double[variableCount];
    }

    public int getVariableCount() {
        return variableCount;
    }

    /** Fresh all-zero coefficient row. */
    public double[] row() {
        return new double[variableCount];
    }

    public void setObjectiveCoefficient(int variable, double coefficient) {
        objective[variable] = coefficient;
    }

    public void addObjectiveConstant(double constant) {
        objectiveConstant += constant;
    }

    public void addEquality(double[] coefficients, double value) {
        add(coefficients, Relationship.EQ, value);
    }

    public void addUpperBound(double[] coefficients, double value) {
        add(coefficients, Relationship.LEQ, value);
    }

    public void addLowerBound(double[] coefficients, double value) {
        add(coefficients, Relationship.GEQ, value);
    }

    /** Single-variable upper bound. */
    public void addUpperBound(int variable, double value) {
        double[] r = row();
        r[variable] = 1.0;
        addUpperBound(r, value);
    }

    /** Single-variable lower bound. */
    public void addLowerBound(int variable, double value) {
        double[] r = row();
        r[variable] = 1.0;
        addLowerBound(r, value);
    }

    /** Restricts the variable to {0, 1}. The relaxation keeps it within [0, 1]. */
    public void markBinary(int variable) {
        if (binaries.add(variable)) {
            addUpperBound(variable, 1.0);
        }
    }

    private void add(double[] coefficients, Relationship relationship, double value) {
        if (coefficients.length != variableCount) {
            throw new IllegalArgumentException("Row has " + coefficients.length + " coefficients, expected " + variableCount);
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Constraint bound must be finite but was " + value);
        }
        constraints.add(new LinearConstraint(coefficients, relationship, value));
    }

    public LinearObjectiveFunction objectiveFunction() {
        return new LinearObjectiveFunction(objective.clone(), objectiveConstant);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public SortedSet<Integer> getBinaries() {
        return Collections.unmodifiableSortedSet(binaries);
    }

    public int getConstraintCount() {
        return constraints.size();
    }
}
