package de.zeus.planner.controller;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.exception.ForecastInputException;
import de.zeus.planner.model.ApiResponse;
import de.zeus.planner.model.Plan;
import de.zeus.planner.model.PlanComparison;
import de.zeus.planner.model.PlanMetrics;
import de.zeus.planner.model.PlanRequest;
import de.zeus.planner.model.PlannerType;
import de.zeus.planner.model.PlanningResult;
import de.zeus.planner.service.PlanningService;
import de.zeus.planner.util.PlanComparator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.lang.reflect.Field;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static de.zeus.planner.support.ScenarioFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PlanControllerTest {

    private PlanController controller;
    private PlanningService planningService;
    private PlanComparator planComparator;

    @BeforeEach
    void setUp() {
        planningService = mock(PlanningService.class);
        planComparator = mock(PlanComparator.class);
        controller = new PlanController();
        inject(controller, "planningService", planningService);
        inject(controller, "planComparator", planComparator);
        inject(controller, "plannerProperties", new PlannerProperties());
    }

    @Test
    void shouldReturnOk_whenPlanCreated() {
        PlanningResult result = new PlanningResult(plan(PlannerType.RULE_BASED), PlannerType.RULE_BASED, null);
        when(planningService.plan(any(), any(), eq(PlannerType.RULE_BASED))).thenReturn(result);
        PlanRequest request = request();
        request.setPlanner(PlannerType.RULE_BASED);

        ApiResponse<PlanningResult> response = controller.createPlan(request);

        assertTrue(response.success());
        assertEquals(HttpStatus.OK, response.statusCode());
        assertSame(result, response.data());
        assertEquals("Plan created by RULE_BASED", response.message());
    }

    @Test
    void shouldMentionFallback_whenOptimalPlannerFailed() {
        PlanningResult result = new PlanningResult(plan(PlannerType.RULE_BASED), PlannerType.MATH_OPTIMAL,
                "LP timeout: LP solver exceeded 10 ms");
        when(planningService.plan(any(), any(), any())).thenReturn(result);

        ApiResponse<PlanningResult> response = controller.createPlan(request());

        assertTrue(response.success());
        assertTrue(response.message().contains("after fallback: LP timeout"), response.message());
    }

    @Test
    void shouldReturnBadRequest_whenBatteryMissing() {
        PlanRequest request = request();
        request.setBattery(null);

        ApiResponse<PlanningResult> response = controller.createPlan(request);

        assertFalse(response.success());
        assertEquals(HttpStatus.BAD_REQUEST, response.statusCode());
        assertNull(response.data());
        verifyNoInteractions(planningService);
    }

    @Test
    void shouldReturnBadRequest_whenSeriesLengthsDiffer() {
        PlanRequest request = request();
        request.setLoadKw(new double[]{0.5});

        ApiResponse<PlanningResult> response = controller.createPlan(request);

        assertEquals(HttpStatus.BAD_REQUEST, response.statusCode());
    }

    @Test
    void shouldReturnBadRequest_whenServiceRejectsInput() {
        when(planningService.plan(any(), any(), any())).thenThrow(new ForecastInputException("slot mismatch"));

        ApiResponse<PlanningResult> response = controller.createPlan(request());

        assertEquals(HttpStatus.BAD_REQUEST, response.statusCode());
        assertTrue(response.message().contains("slot mismatch"));
    }

    @Test
    void shouldReturnServerError_whenPlanningFails() {
        when(planningService.plan(any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        ApiResponse<PlanningResult> response = controller.createPlan(request());

        assertFalse(response.success());
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.statusCode());
        assertEquals("Failed to create plan: boom", response.message());
    }

    @Test
    void shouldCompareBothPlanners() {
        Plan rulePlan = plan(PlannerType.RULE_BASED);
        Plan optimalPlan = plan(PlannerType.MATH_OPTIMAL);
        when(planningService.plan(any(), any(), eq(PlannerType.RULE_BASED)))
                .thenReturn(new PlanningResult(rulePlan, PlannerType.RULE_BASED, null));
        when(planningService.plan(any(), any(), eq(PlannerType.MATH_OPTIMAL)))
                .thenReturn(new PlanningResult(optimalPlan, PlannerType.MATH_OPTIMAL, null));
        PlanComparison comparison = new PlanComparison(PlannerType.RULE_BASED, PlannerType.MATH_OPTIMAL,
                -3.0, -4.0, 0.0, Map.of(), Map.of(), List.of());
        when(planComparator.compare(rulePlan, optimalPlan)).thenReturn(comparison);

        ApiResponse<PlanComparison> response = controller.comparePlanners(request());

        assertEquals(HttpStatus.OK, response.statusCode());
        assertSame(comparison, response.data());
    }

    @Test
    void shouldReturnBadRequest_whenCompareBodyMissing() {
        ApiResponse<PlanComparison> response = controller.comparePlanners(null);

        assertEquals(HttpStatus.BAD_REQUEST, response.statusCode());
        verifyNoInteractions(planComparator);
    }

    private static PlanRequest request() {
        PlanRequest request = new PlanRequest();
        request.setStartTime(START);
        request.setImportPrice(new double[]{20.0, 30.0});
        request.setExportPrice(new double[]{5.0, 5.0});
        request.setSolarKw(new double[]{0.0, 0.0});
        request.setLoadKw(new double[]{0.5, 0.5});
        PlanRequest.Battery battery = new PlanRequest.Battery();
        battery.setSocPercent(50.0);
        battery.setCapacityKwh(10.0);
        battery.setMaxChargeKw(3.0);
        battery.setMaxDischargeKw(3.0);
        request.setBattery(battery);
        return request;
    }

    private static Plan plan(PlannerType type) {
        return new Plan(type, Instant.now(), START, 50.0, List.of(),
                PlanMetrics.of(List.of(), 50.0, 10.0, 5.0, 50.0));
    }

    private static void inject(Object target, String fieldName, Object value) {
        try {
            Field field = target.getClass().getDeclaredField(fieldName);
            field.setAccessible(true);
            field.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException("Failed to inject field " + fieldName, e);
        }
    }
}
