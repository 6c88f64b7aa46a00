package de.zeus.planner.service;

import de.zeus.planner.config.LogFilter;
import de.zeus.planner.exception.PlanningException;
import de.zeus.planner.exception.SolverTimeoutException;
import de.zeus.planner.exception.StateInvariantViolationException;
import de.zeus.planner.model.BatteryState;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.OperatingMode;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningConstraints;
import de.zeus.planner.model.SlotOutcome;
import de.zeus.planner.util.LinearProgram;
import de.zeus.planner.util.MilpSolution;
import de.zeus.planner.util.MixedIntegerSolver;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

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
 * Plans the whole horizon as one mixed-integer linear program.
 * <p>
 * Per slot the model holds grid import, grid export, battery charge, battery discharge and clipped solar
 * (kW, non-negative), a binary that switches the export cap to the feed-in priority limit and the SOC at the end
 * of the slot. Slots where export pays more than import also get a binary grid direction, so the grid never
 * feeds itself. The objective is the slot cost plus the clipping penalty plus the value of stored energy used up
 * over the horizon, priced at the last export price.
 * <p>
 * The solver runs on a worker thread and is cancelled when the configured timeout passes. Infeasibility and
 * timeouts are reported as exceptions, never as a partial plan.
 */
@Service
public class MathOptimalPlanner implements BatteryPlanner {

    private static final int VARS_PER_SLOT = 6;
    private static final int IMPORT = 0;
    private static final int EXPORT = 1;
    private static final int CHARGE = 2;
    private static final int DISCHARGE = 3;
    private static final int CLIPPED = 4;
    private static final int GRID_FIRST = 5;

    /** Relative surcharge per remaining slot on clipping, so the battery fills before solar is wasted. */
    private static final double CLIPPING_TIE_BREAK = 1e-5;

    private static final double FLOW_EPSILON = 1e-6;
    private static final double DECODE_SOC_TOLERANCE = 1e-4;

    private final ExecutorService solverExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "lp-solver");
        thread.setDaemon(true);
        return thread;
    });

    @Override
    public PlannerType getType() {
        return PlannerType.MATH_OPTIMAL;
    }

    @Override
    public Plan createPlan(ForecastSeries forecast, BatteryState battery, PlanningConstraints constraints) {
        if (forecast.isEmpty()) {
            return new PlanAssembler(PlannerType.MATH_OPTIMAL, forecast, battery, constraints).build();
        }
        LinearProgram program = buildProgram(forecast, battery, constraints);
        MilpSolution solution = solveWithTimeout(program, forecast.size(), constraints);
        LogFilter.logDebug(MathOptimalPlanner.class, "LP solved: objective {}p, {} nodes, {} relaxations",
                solution.value(), solution.nodes(), solution.relaxations());
        return decode(solution, forecast, battery, constraints);
    }

    private MilpSolution solveWithTimeout(LinearProgram program, int slots, PlanningConstraints constraints) {
        double gap = constraints.gridFirstSwitchPenaltyPence() * slots + 1e-6;
        MixedIntegerSolver solver = new MixedIntegerSolver(constraints.solverMaxIterations(),
                constraints.solverMaxNodes(), gap);
        long timeoutMs = constraints.solverTimeout().toMillis();
        Future<MilpSolution> future = solverExecutor.submit(() -> solver.minimize(program));
        try {
            return future.get(constraints.solverTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SolverTimeoutException("LP solver exceeded " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SolverTimeoutException("Interrupted while waiting for the LP solver", e);
        } catch (CancellationException e) {
            throw new SolverTimeoutException("LP solve was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PlanningException planningException) {
                throw planningException;
            }
            if (cause instanceof CancellationException) {
                throw new SolverTimeoutException("LP solve was cancelled", cause);
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new PlanningException("LP solver failed", cause);
        }
    }

    LinearProgram buildProgram(ForecastSeries forecast, BatteryState battery, PlanningConstraints constraints) {
        int n = forecast.size();
        int directionSlots = 0;
        int[] direction = new int[n];
        for (int t = 0; t < n; t++) {
            direction[t] = forecast.exportPrice(t) > forecast.importPrice(t) ? VARS_PER_SLOT * n + n + directionSlots++ : -1;
        }
        LinearProgram lp = new LinearProgram(VARS_PER_SLOT * n + n + directionSlots);

        double h = forecast.getSlotHours();
        double ce = battery.getChargeEfficiency();
        double de = battery.getDischargeEfficiency();
        double cap = battery.getCapacityKwh();
        double soc0 = battery.getSocPercent();
        double su = constraints.selfUseExportLimitKw();
        double gf = constraints.gridFirstExportLimitKw();
        double minSoc = constraints.minSocPercent();
        double chargeStep = battery.getMaxChargeKw() * h * ce / cap * 100.0;
        double socPerKwh = h / cap * 100.0;

        for (int t = 0; t < n; t++) {
            int imp = var(t, IMPORT);
            int exp = var(t, EXPORT);
            int chg = var(t, CHARGE);
            int dis = var(t, DISCHARGE);
            int clip = var(t, CLIPPED);
            int gridFirst = var(t, GRID_FIRST);
            int soc = socVar(n, t);
            double solar = forecast.solarKw(t);
            double load = forecast.loadKw(t);

            // solar + import + discharge = load + export + charge + clipped
            double[] balance = lp.row();
            balance[imp] = 1.0;
            balance[dis] = 1.0;
            balance[exp] = -1.0;
            balance[chg] = -1.0;
            balance[clip] = -1.0;
            lp.addEquality(balance, load - solar);

            lp.addUpperBound(clip, solar);

            double[] exportCap = lp.row();
            exportCap[exp] = 1.0;
            exportCap[gridFirst] = -Math.min(gf - su, solar);
            lp.addUpperBound(exportCap, su);
            lp.markBinary(gridFirst);

            // grid energy only flows into the house or out of it, never both ways
            double[] exportSource = lp.row();
            exportSource[exp] = 1.0;
            exportSource[dis] = -1.0;
            lp.addUpperBound(exportSource, solar);
            double[] importSink = lp.row();
            importSink[imp] = 1.0;
            importSink[chg] = -1.0;
            lp.addUpperBound(importSink, load);
            if (direction[t] >= 0) {
                int importing = direction[t];
                double[] importGate = lp.row();
                importGate[imp] = 1.0;
                importGate[importing] = -(load + battery.getMaxChargeKw());
                lp.addUpperBound(importGate, 0.0);
                double exportBound = solar + battery.getMaxDischargeKw();
                double[] exportGate = lp.row();
                exportGate[exp] = 1.0;
                exportGate[importing] = exportBound;
                lp.addUpperBound(exportGate, exportBound);
                lp.markBinary(importing);
            }

            double floor = Math.min(minSoc, soc0 + (t + 1) * chargeStep);
            lp.addUpperBound(chg, battery.getMaxChargeKw());
            lp.addUpperBound(dis, floor < minSoc ? 0.0 : battery.getMaxDischargeKw());

            // soc[t+1] = soc[t] + (charge * ce - discharge / de) * h / cap * 100
            double[] recursion = lp.row();
            recursion[soc] = 1.0;
            recursion[chg] = -ce * socPerKwh;
            recursion[dis] = socPerKwh / de;
            if (t > 0) {
                recursion[socVar(n, t - 1)] = -1.0;
            }
            lp.addEquality(recursion, t == 0 ? soc0 : 0.0);
            lp.addUpperBound(soc, constraints.maxSocPercent());
            lp.addLowerBound(soc, floor);

            lp.setObjectiveCoefficient(imp, h * forecast.importPrice(t));
            lp.setObjectiveCoefficient(exp, -h * forecast.exportPrice(t));
            lp.setObjectiveCoefficient(clip, h * constraints.clippingPenaltyPence() * (1.0 + CLIPPING_TIE_BREAK * (n - t)));
            lp.setObjectiveCoefficient(gridFirst, constraints.gridFirstSwitchPenaltyPence());
        }

        double storedValue = cap / 100.0 * forecast.terminalExportPrice();
        lp.setObjectiveCoefficient(socVar(n, n - 1), -storedValue);
        lp.addObjectiveConstant(soc0 * storedValue);
        return lp;
    }

    private Plan decode(MilpSolution solution, ForecastSeries forecast, BatteryState battery,
                        PlanningConstraints constraints) {
        PlanAssembler plan = new PlanAssembler(PlannerType.MATH_OPTIMAL, forecast, battery, constraints);
        double h = forecast.getSlotHours();
        for (int t = 0; t < forecast.size(); t++) {
            BatteryState state = plan.current();
            double solar = forecast.solarKw(t);
            double load = forecast.loadKw(t);
            double charge = clean(solution.get(var(t, CHARGE)));
            double discharge = clean(solution.get(var(t, DISCHARGE)));
            double clipped = clean(solution.get(var(t, CLIPPED)));
            double grid = solution.get(var(t, IMPORT)) - solution.get(var(t, EXPORT));
            double importKw = clean(grid);
            double exportKw = clean(-grid);
            boolean gridFirst = solution.get(var(t, GRID_FIRST)) > 0.5;

            double socBefore = state.getSocPercent();
            double socAfter = settleSoc(t, socBefore, (charge * state.getChargeEfficiency()
                    - discharge / state.getDischargeEfficiency()) * h / state.getCapacityKwh() * 100.0, constraints);

            OperatingMode mode;
            String reason;
            double surplus = Math.max(0.0, solar - load);
            double deficit = Math.max(0.0, load - solar);
            if (discharge > deficit + FLOW_EPSILON) {
                mode = OperatingMode.FORCE_DISCHARGE;
                reason = String.format("Optimal: discharge %.2f kW, exporting at %.2fp", discharge, forecast.exportPrice(t));
            } else if (gridFirst) {
                mode = OperatingMode.GRID_FIRST;
                reason = String.format("Optimal: feed-in priority, exporting %.2f kW", exportKw);
            } else if (charge > surplus + FLOW_EPSILON) {
                mode = OperatingMode.FORCE_CHARGE;
                reason = String.format("Optimal: charge %.2f kW with grid import at %.2fp", charge, forecast.importPrice(t));
            } else if (deficit > FLOW_EPSILON && discharge <= FLOW_EPSILON && importKw > FLOW_EPSILON) {
                // battery idle while the grid covers the load
                mode = OperatingMode.SELF_USE;
                reason = String.format("Optimal: self use, battery held, importing %.2f kW for the load at %.2fp",
                        importKw, forecast.importPrice(t));
            } else {
                mode = OperatingMode.SELF_USE;
                reason = "Optimal: self use";
            }

            double importKwh = importKw * h;
            double exportKwh = exportKw * h;
            double cost = importKwh * forecast.importPrice(t) - exportKwh * forecast.exportPrice(t);
            SlotOutcome outcome = new SlotOutcome(mode, state.withSoc(socAfter), importKwh, exportKwh,
                    (charge - discharge) * h, clipped * h, cost);
            plan.add(outcome, reason);
        }
        return plan.build();
    }

    /** Removes solver noise at the SOC band edges; anything larger is a modelling defect. */
    private static double settleSoc(int slot, double socBefore, double delta, PlanningConstraints constraints) {
        double soc = socBefore + delta;
        double low = Math.min(constraints.minSocPercent(), socBefore);
        double high = Math.max(constraints.maxSocPercent(), socBefore);
        if (soc < low - DECODE_SOC_TOLERANCE || soc > high + DECODE_SOC_TOLERANCE) {
            throw new StateInvariantViolationException(String.format(
                    "Decoded SOC %.6f%% at slot %d is outside [%.2f%%, %.2f%%]", soc, slot, low, high));
        }
        return Math.max(low, Math.min(high, soc));
    }

    private static double clean(double value) {
        return value < FLOW_EPSILON ? 0.0 : value;
    }

    private static int var(int slot, int offset) {
        return slot * VARS_PER_SLOT + offset;
    }

    /** SOC at the end of the slot. */
    private static int socVar(int slots, int slot) {
        return VARS_PER_SLOT * slots + slot;
    }

    @PreDestroy
    public void shutdown() {
        solverExecutor.shutdownNow();
    }
}
