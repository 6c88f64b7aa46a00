package de.zeus.planner.event;

import de.zeus.planner.model.PlanningResult;

public class PlanCreatedEvent {
    private final Object source;
    private final PlanningResult result;

    public PlanCreatedEvent(Object source, PlanningResult result) {
        this.source = source;
        this.result = result;
    }

    public Object getSource() {
        return source;
    }

    public PlanningResult getResult() {
        return result;
    }
}
