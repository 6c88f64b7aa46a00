package de.zeus.planner.service;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.event.PlanCreatedEvent;
import de.zeus.planner.exception.ForecastInputException;
import de.zeus.planner.exception.InfeasibleOptimizationException;
import de.zeus.planner.exception.SolverTimeoutException;
import de.zeus.planner.exception.StateInvariantViolationException;
import de.zeus.planner.model.ForecastSeries;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlanMetrics;
import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningConstraints;
import de.zeus.planner.model.PlanningResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static de.zeus.planner.support.ScenarioFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Planner selection, fallback on solver failure and input checks of a planning cycle.
 */
class PlanningServiceTest {

    private RuleBasedPlanner ruleBasedPlanner;
    private MathOptimalPlanner mathOptimalPlanner;
    private ApplicationEventPublisher eventPublisher;
    private PlannerProperties properties;
    private PlanningService service;

    private final Plan rulePlan = emptyPlan(PlannerType.RULE_BASED);
    private final Plan optimalPlan = emptyPlan(PlannerType.MATH_OPTIMAL);

    @BeforeEach
    void setUp() {
        ruleBasedPlanner = mock(RuleBasedPlanner.class);
        mathOptimalPlanner = mock(MathOptimalPlanner.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
        properties = new PlannerProperties();
        service = new PlanningService(ruleBasedPlanner, mathOptimalPlanner, properties, eventPublisher);

        when(ruleBasedPlanner.createPlan(any(), any(), any())).thenReturn(rulePlan);
        when(mathOptimalPlanner.createPlan(any(), any(), any())).thenReturn(optimalPlan);
    }

    @Test
    void shouldUseOptimalPlanner_whenConfiguredAndSolverSucceeds() {
        PlanningResult result = service.plan(darkFlatDay(), battery(50.0));

        assertSame(optimalPlan, result.plan());
        assertEquals(PlannerType.MATH_OPTIMAL, result.requestedPlanner());
        assertFalse(result.isFallback());
        verifyNoInteractions(ruleBasedPlanner);
    }

    @Test
    void shouldFallBackToRuleBased_whenModelIsInfeasible() {
        when(mathOptimalPlanner.createPlan(any(), any(), any()))
                .thenThrow(new InfeasibleOptimizationException("no feasible point"));

        PlanningResult result = service.plan(darkFlatDay(), battery(50.0));

        assertSame(rulePlan, result.plan());
        assertEquals(PlannerType.MATH_OPTIMAL, result.requestedPlanner());
        assertEquals(PlannerType.RULE_BASED, result.producedBy());
        assertTrue(result.isFallback());
        assertEquals("LP infeasible: no feasible point", result.fallbackReason());
    }

    @Test
    void shouldFallBackToRuleBased_whenSolverTimesOut() {
        when(mathOptimalPlanner.createPlan(any(), any(), any()))
                .thenThrow(new SolverTimeoutException("LP solver exceeded 10 ms"));

        PlanningResult result = service.plan(darkFlatDay(), battery(50.0));

        assertSame(rulePlan, result.plan());
        assertTrue(result.fallbackReason().startsWith("LP timeout"));
    }

    @Test
    void shouldPropagate_whenPlanBreaksStateInvariant() {
        when(mathOptimalPlanner.createPlan(any(), any(), any()))
                .thenThrow(new StateInvariantViolationException("SOC out of band"));

        assertThrows(StateInvariantViolationException.class, () -> service.plan(darkFlatDay(), battery(50.0)));
        verifyNoInteractions(ruleBasedPlanner);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldSkipOptimalPlanner_whenRuleBasedRequested() {
        PlanningResult result = service.plan(darkFlatDay(), battery(50.0), PlannerType.RULE_BASED);

        assertSame(rulePlan, result.plan());
        assertEquals(PlannerType.RULE_BASED, result.requestedPlanner());
        assertFalse(result.isFallback());
        verifyNoInteractions(mathOptimalPlanner);
    }

    @Test
    void shouldPassConfiguredConstraints_toPlanner() {
        properties.setStrategy(PlannerType.RULE_BASED);
        properties.setMinSocPercent(20.0);
        ArgumentCaptor<PlanningConstraints> captor = ArgumentCaptor.forClass(PlanningConstraints.class);

        service.plan(darkFlatDay(), battery(50.0));

        verify(ruleBasedPlanner).createPlan(any(), any(), captor.capture());
        assertEquals(20.0, captor.getValue().minSocPercent());
    }

    @Test
    void shouldPublishEvent_whenPlanCreated() {
        ArgumentCaptor<PlanCreatedEvent> captor = ArgumentCaptor.forClass(PlanCreatedEvent.class);

        PlanningResult result = service.plan(darkFlatDay(), battery(50.0));

        verify(eventPublisher).publishEvent(captor.capture());
        assertSame(result, captor.getValue().getResult());
        assertSame(service, captor.getValue().getSource());
    }

    @Test
    void shouldReject_whenInputsMissing() {
        assertThrows(ForecastInputException.class, () -> service.plan(null, battery(50.0)));
        assertThrows(ForecastInputException.class, () -> service.plan(darkFlatDay(), null));
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void shouldReject_whenSlotLengthDiffersFromConfiguration() {
        ForecastSeries hourly = new ForecastSeries(START, Duration.ofHours(1), flat(2, 20.0), flat(2, 5.0),
                flat(2, 0.0), flat(2, 0.5));

        assertThrows(ForecastInputException.class, () -> service.plan(hourly, battery(50.0)));
        verifyNoInteractions(ruleBasedPlanner, mathOptimalPlanner);
    }

    private static Plan emptyPlan(PlannerType type) {
        return new Plan(type, Instant.now(), START, 50.0, List.of(),
                PlanMetrics.of(List.of(), 50.0, 10.0, 5.0, 50.0));
    }
}
