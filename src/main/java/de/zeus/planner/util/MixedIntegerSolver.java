package de.zeus.planner.util;

import de.zeus.planner.config.LogFilter;
import de.zeus.planner.exception.InfeasibleOptimizationException;
import de.zeus.planner.exception.SolverTimeoutException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

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
 * Depth-first branch and bound over LP relaxations solved with the Commons Math simplex.
 * <p>
 * Every node that leaves binaries fractional is also tried with all of them rounded, fractional ones up, which
 * gives an early incumbent. Nodes whose relaxation cannot beat the incumbent by more than the absolute gap are
 * pruned. The search honours thread interruption between and inside simplex iterations and gives up with a
 * {@link SolverTimeoutException} when the node or iteration budget runs out.
 */
public class MixedIntegerSolver {

    private static final double INTEGRALITY_TOLERANCE = 1e-6;

    private final int maxIterations;
    private final int maxNodes;
    private final double absoluteGap;

    public MixedIntegerSolver(int maxIterations, int maxNodes, double absoluteGap) {
        if (maxIterations <= 0 || maxNodes <= 0 || absoluteGap < 0) {
            throw new IllegalArgumentException("Invalid solver limits");
        }
        this.maxIterations = maxIterations;
        this.maxNodes = maxNodes;
        this.absoluteGap = absoluteGap;
    }

    /**
     * @throws InfeasibleOptimizationException when no integer-feasible point exists or the problem is unbounded
     * @throws SolverTimeoutException          when a budget is exhausted before an answer is proven
     * @throws CancellationException           when the calling thread is interrupted
     */
    public MilpSolution minimize(LinearProgram program) {
        Deque<Map<Integer, Double>> open = new ArrayDeque<>();
        open.push(new HashMap<>());

        double[] incumbent = null;
        double incumbentValue = Double.POSITIVE_INFINITY;
        double rootBound = Double.NaN;
        int nodes = 0;
        int relaxations = 0;

        while (!open.isEmpty()) {
            if (nodes >= maxNodes) {
                throw new SolverTimeoutException("Branch and bound exceeded " + maxNodes + " nodes");
            }
            Map<Integer, Double> fixings = open.pop();
            nodes++;

            PointValuePair relaxed = solveRelaxation(program, fixings);
            relaxations++;
            if (relaxed == null) {
                continue;
            }
            if (nodes == 1) {
                rootBound = relaxed.getValue();
            }
            if (relaxed.getValue() >= incumbentValue - absoluteGap) {
                continue;
            }

            double[] point = relaxed.getPoint();
            int branchVariable = mostFractional(program, point);
            if (branchVariable < 0) {
                incumbent = point;
                incumbentValue = relaxed.getValue();
                continue;
            }

            PointValuePair rounded = solveRelaxation(program, roundUp(program, point));
            relaxations++;
            if (rounded != null && rounded.getValue() < incumbentValue) {
                incumbent = rounded.getPoint();
                incumbentValue = rounded.getValue();
                if (relaxed.getValue() >= incumbentValue - absoluteGap) {
                    continue;
                }
            }

            Map<Integer, Double> down = new HashMap<>(fixings);
            down.put(branchVariable, 0.0);
            Map<Integer, Double> up = new HashMap<>(fixings);
            up.put(branchVariable, 1.0);
            open.push(down);
            open.push(up);
        }

        if (incumbent == null) {
            throw new InfeasibleOptimizationException("No integer-feasible solution exists");
        }
        LogFilter.logDebug(MixedIntegerSolver.class, "Branch and bound finished after {} nodes and {} relaxations, objective {}",
                nodes, relaxations, incumbentValue);
        return new MilpSolution(incumbent, incumbentValue, rootBound, nodes, relaxations);
    }

    /** Returns null when the relaxation is infeasible. */
    private PointValuePair solveRelaxation(LinearProgram program, Map<Integer, Double> fixings) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Solver thread interrupted");
        }
        List<LinearConstraint> constraints = new ArrayList<>(program.getConstraints());
        for (Map.Entry<Integer, Double> fixing : fixings.entrySet()) {
            double[] row = program.row();
            row[fixing.getKey()] = 1.0;
            constraints.add(new LinearConstraint(row, Relationship.EQ, fixing.getValue()));
        }
        try {
            return new InterruptibleSimplexSolver().optimize(
                    new MaxIter(maxIterations),
                    program.objectiveFunction(),
                    new LinearConstraintSet(constraints),
                    GoalType.MINIMIZE,
                    new NonNegativeConstraint(true));
        } catch (NoFeasibleSolutionException e) {
            return null;
        } catch (UnboundedSolutionException e) {
            throw new InfeasibleOptimizationException("Linear program is unbounded", e);
        } catch (TooManyIterationsException e) {
            throw new SolverTimeoutException("Simplex exceeded " + maxIterations + " iterations", e);
        }
    }

    private static int mostFractional(LinearProgram program, double[] point) {
        int best = -1;
        double bestDistance = INTEGRALITY_TOLERANCE;
        for (int variable : program.getBinaries()) {
            double value = point[variable];
            double distance = Math.abs(value - Math.rint(value));
            if (distance > bestDistance) {
                best = variable;
                bestDistance = distance;
            }
        }
        return best;
    }

    private static Map<Integer, Double> roundUp(LinearProgram program, double[] point) {
        Map<Integer, Double> fixings = new HashMap<>();
        for (int variable : program.getBinaries()) {
            fixings.put(variable, point[variable] > INTEGRALITY_TOLERANCE ? 1.0 : 0.0);
        }
        return fixings;
    }

    /** Simplex that stops at the next pivot once its thread has been interrupted. */
    static final class InterruptibleSimplexSolver extends SimplexSolver {

        @Override
        protected void incrementIterationCount() throws TooManyIterationsException {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Solver thread interrupted");
            }
            super.incrementIterationCount();
        }
    }
}
