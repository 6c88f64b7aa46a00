package de.zeus.planner.model;

import java.time.Instant;
import java.util.Collections;
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
 * Ordered slot plan produced by one planning cycle. Created fresh per cycle and never modified afterwards;
 * consecutive slots are SOC-continuous.
 */
public class Plan {

    private final PlannerType plannerType;
    private final Instant createdAt;
    private final Instant startTime;
    private final double initialSocPercent;
    private final List<PlanSlot> slots;
    private final PlanMetrics metrics;

    public Plan(PlannerType plannerType, Instant createdAt, Instant startTime, double initialSocPercent,
                List<PlanSlot> slots, PlanMetrics metrics) {
        this.plannerType = plannerType;
        this.createdAt = createdAt;
        this.startTime = startTime;
        this.initialSocPercent = initialSocPercent;
        this.slots = Collections.unmodifiableList(slots);
        this.metrics = metrics;
    }

    public PlannerType getPlannerType() {
        return plannerType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public double getInitialSocPercent() {
        return initialSocPercent;
    }

    public List<PlanSlot> getSlots() {
        return slots;
    }

    public PlanMetrics getMetrics() {
        return metrics;
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public PlanSlot slot(int index) {
        return slots.get(index);
    }
}
