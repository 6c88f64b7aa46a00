package de.zeus.planner.model;

/**
 * A plan together with the planner that was asked for and, when the fallback planner had to step in,
 * the reason.
 */
public record PlanningResult(Plan plan, PlannerType requestedPlanner, String fallbackReason) {

    public boolean isFallback() {
        return fallbackReason != null;
    }

    public PlannerType producedBy() {
        return plan.getPlannerType();
    }
}
