package de.zeus.planner.util;

import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlanComparison;
import de.zeus.planner.model.PlanSlot;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

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
 * Side-by-side comparison of two plans for benchmarks and diagnostics. Not used while planning.
 */
@Component
public class PlanComparator {

    /** SOC differences below this are treated as equal (percent). */
    private static final double SOC_TOLERANCE = 0.01;

    public PlanComparison compare(Plan a, Plan b) {
        if (a.size() != b.size()) {
            throw new IllegalArgumentException("Cannot compare plans of " + a.size() + " and " + b.size() + " slots");
        }
        if (!a.getStartTime().equals(b.getStartTime())) {
            throw new IllegalArgumentException("Plans start at different times: " + a.getStartTime() + " and " + b.getStartTime());
        }

        List<PlanComparison.SlotDifference> differences = new ArrayList<>();
        for (int i = 0; i < a.size(); i++) {
            PlanSlot slotA = a.slot(i);
            PlanSlot slotB = b.slot(i);
            double socGap = slotB.getSocAfter() - slotA.getSocAfter();
            if (slotA.getMode() != slotB.getMode() || Math.abs(socGap) > SOC_TOLERANCE) {
                differences.add(new PlanComparison.SlotDifference(i, slotA.getTime(), slotA.getMode(),
                        slotB.getMode(), socGap));
            }
        }

        return new PlanComparison(a.getPlannerType(), b.getPlannerType(),
                b.getMetrics().getTotalCost() - a.getMetrics().getTotalCost(),
                b.getMetrics().getObjectiveValue() - a.getMetrics().getObjectiveValue(),
                b.getMetrics().getTotalClippedKwh() - a.getMetrics().getTotalClippedKwh(),
                a.getMetrics().getModeCounts(), b.getMetrics().getModeCounts(), List.copyOf(differences));
    }
}
