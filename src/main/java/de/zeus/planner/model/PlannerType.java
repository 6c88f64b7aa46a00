package de.zeus.planner.model;

/**
 * Identifies which planner produced a plan.
 */
public enum PlannerType {
    RULE_BASED,
    MATH_OPTIMAL
}
