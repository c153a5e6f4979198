package org.funnelscope.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.funnelscope.util.ValidationException;
import org.testng.annotations.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.google.common.collect.ImmutableList.of;
import static java.util.concurrent.TimeUnit.HOURS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

public abstract class TestFunnelPlanExecutor {
    private static final Instant START = Instant.parse("2024-03-10T10:00:00Z");
    private static final DateRange MARCH = DateRange.of("2024-03-01", "2024-03-31");

    private final FunnelPlanBuilder planBuilder = new FunnelPlanBuilder();

    public abstract FunnelPlanExecutor getFunnelPlanExecutor(List<EventRecord> events, Map<String, String> groupCodes);

    private FunnelResult run(List<EventRecord> events, FunnelDefinition definition) {
        return getFunnelPlanExecutor(events, ImmutableMap.of())
                .execute(planBuilder.build(definition))
                .join();
    }

    private static FunnelDefinition funnel(FunnelWindow window, String... steps) {
        ImmutableList.Builder<EventStep> builder = ImmutableList.builder();
        for (String step : steps) {
            builder.add(EventStep.named(step));
        }
        return new FunnelDefinition(builder.build(), MARCH, window, ImmutableMap.of(), DataSource.STANDARD);
    }

    private static EventRecord event(String user, String name, long secondsAfterStart) {
        return new EventRecord(user, name, START.plusSeconds(secondsAfterStart));
    }

    private static List<Long> counts(FunnelResult result) {
        return result.getSteps().stream().map(FunnelResult.StepCount::getUserCount).collect(ImmutableList.toImmutableList());
    }

    @Test
    public void testStrictOrder() {
        List<EventRecord> events = of(
                event("a", "view", 0), event("a", "cart", 10), event("a", "buy", 20),
                event("b", "cart", 0), event("b", "view", 10),
                event("c", "view", 0), event("c", "buy", 5), event("c", "cart", 10));

        FunnelResult result = run(events, funnel(FunnelWindow.DEFAULT, "view", "cart", "buy"));

        assertEquals(counts(result), of(3L, 2L, 1L));
        assertEquals(result.get(1).getStepLabel(), "cart");
    }

    @Test
    public void testWindowBoundaryIsInclusive() {
        List<EventRecord> events = of(
                event("a", "view", 0), event("a", "cart", 3600),
                event("b", "view", 0), event("b", "cart", 3601));

        FunnelResult result = run(events, funnel(FunnelWindow.of(1, HOURS), "view", "cart"));

        assertEquals(counts(result), of(2L, 1L));
    }

    @Test
    public void testWindowIsAnchoredAtFirstStep() {
        List<EventRecord> events = of(
                event("a", "view", 0), event("a", "cart", 50 * 60), event("a", "buy", 70 * 60));

        FunnelResult result = run(events, funnel(FunnelWindow.of(1, HOURS), "view", "cart", "buy"));

        assertEquals(counts(result), of(1L, 1L, 0L));
    }

    @Test
    public void testAnchorIsEarliestFirstStep() {
        List<EventRecord> events = of(
                event("a", "view", 0), event("a", "view", 2 * 3600), event("a", "cart", 2 * 3600 + 1800));

        FunnelResult result = run(events, funnel(FunnelWindow.of(1, HOURS), "view", "cart"));

        assertEquals(counts(result), of(1L, 0L));
    }

    @Test
    public void testDuplicateEventsCountOnce() {
        List<EventRecord> events = of(
                event("a", "view", 0), event("a", "view", 1), event("a", "view", 2),
                event("a", "cart", 3), event("a", "cart", 4));

        FunnelResult result = run(events, funnel(FunnelWindow.DEFAULT, "view", "cart"));

        assertEquals(counts(result), of(1L, 1L));
    }

    @Test
    public void testSameEventInConsecutiveSteps() {
        List<EventRecord> events = of(
                event("a", "view", 0), event("a", "view", 60),
                event("b", "view", 0));

        FunnelResult result = run(events, funnel(FunnelWindow.DEFAULT, "view", "view"));

        assertEquals(counts(result), of(2L, 1L));
    }

    @Test
    public void testEventsInputOrderDoesNotMatter() {
        List<EventRecord> events = of(
                event("a", "buy", 20), event("a", "cart", 10), event("a", "view", 0));

        FunnelResult result = run(events, funnel(FunnelWindow.DEFAULT, "view", "cart", "buy"));

        assertEquals(counts(result), of(1L, 1L, 1L));
    }

    @Test
    public void testDateRangeAppliesToEveryStep() {
        Instant lastEvening = Instant.parse("2024-03-31T23:30:00Z");
        List<EventRecord> events = of(
                new EventRecord("a", "view", Instant.parse("2024-02-29T23:59:00Z")),
                new EventRecord("a", "cart", Instant.parse("2024-03-01T00:01:00Z")),
                new EventRecord("b", "view", lastEvening),
                new EventRecord("b", "cart", lastEvening.plusSeconds(3600)));

        FunnelResult result = run(events, funnel(FunnelWindow.DEFAULT, "view", "cart"));

        assertEquals(counts(result), of(1L, 0L));
    }

    @Test
    public void testStepParameters() {
        List<EventRecord> events = of(
                new EventRecord("a", "page_view", START, ImmutableMap.of("page", "/products/shoes")),
                new EventRecord("a", "purchase", START.plusSeconds(10), ImmutableMap.of("amount", 20)),
                new EventRecord("b", "page_view", START, ImmutableMap.of("page", "/checkout")),
                new EventRecord("c", "page_view", START, ImmutableMap.of("page", "/products/hats")),
                new EventRecord("c", "purchase", START.plusSeconds(10), ImmutableMap.of("amount", 5)));

        FunnelDefinition definition = new FunnelDefinition(of(
                new EventStep("page_view", ImmutableMap.of("page", ParameterMatch.of("/products/%"))),
                new EventStep("purchase", ImmutableMap.of("amount", ParameterMatch.of(of(20, 30))))),
                MARCH, FunnelWindow.DEFAULT, ImmutableMap.of(), DataSource.STANDARD);

        assertEquals(counts(run(events, definition)), of(2L, 1L));
    }

    @Test
    public void testGlobalFilters() {
        List<EventRecord> events = of(
                new EventRecord("a", "view", START, ImmutableMap.of("country", "US")),
                new EventRecord("a", "cart", START.plusSeconds(5), ImmutableMap.of("country", "US")),
                new EventRecord("b", "view", START, ImmutableMap.of("country", "DE")),
                new EventRecord("c", "view", START, ImmutableMap.of("country", "US")),
                new EventRecord("c", "cart", START.plusSeconds(5), ImmutableMap.of("country", "DE")));

        FunnelDefinition definition = new FunnelDefinition(of(EventStep.named("view"), EventStep.named("cart")),
                MARCH, FunnelWindow.DEFAULT, ImmutableMap.of("country", ParameterMatch.of("US")), DataSource.STANDARD);

        assertEquals(counts(run(events, definition)), of(2L, 1L));
    }

    @Test
    public void testStructColumnFilter() {
        List<EventRecord> events = of(
                new EventRecord("a", "view", START, ImmutableMap.of("geo", ImmutableMap.of("country", "US"))),
                new EventRecord("a", "cart", START.plusSeconds(5), ImmutableMap.of("geo", ImmutableMap.of("country", "US"))),
                new EventRecord("b", "view", START, ImmutableMap.of("geo", ImmutableMap.of("country", "DE"))),
                new EventRecord("c", "view", START, ImmutableMap.of("device", "desktop")));

        FunnelDefinition definition = new FunnelDefinition(of(EventStep.named("view"), EventStep.named("cart")),
                MARCH, FunnelWindow.DEFAULT, ImmutableMap.of("geo.country", ParameterMatch.of("US")), DataSource.GA4);

        assertEquals(counts(run(events, definition)), of(1L, 1L));
    }

    @Test
    public void testExecuteBySegment() {
        List<EventRecord> events = of(
                new EventRecord("a", "view", START, ImmutableMap.of("platform", "ios")),
                new EventRecord("a", "buy", START.plusSeconds(10), ImmutableMap.of("platform", "ios")),
                new EventRecord("b", "view", START, ImmutableMap.of("platform", "android")),
                new EventRecord("b", "buy", START.plusSeconds(10), ImmutableMap.of("platform", "ios")),
                new EventRecord("c", "view", START, ImmutableMap.of("platform", "ios")),
                event("d", "view", 0), event("d", "buy", 10),
                new EventRecord("e", "buy", START, ImmutableMap.of("platform", "web")));

        FunnelQueryPlan plan = planBuilder.build(funnel(FunnelWindow.DEFAULT, "view", "buy").withGroupBy("platform"));
        Map<String, FunnelResult> segments = getFunnelPlanExecutor(events, ImmutableMap.of())
                .executeBySegment(plan)
                .join();

        assertEquals(ImmutableList.copyOf(segments.keySet()), of("android", "ios"));
        assertEquals(counts(segments.get("android")), of(1L, 0L));
        assertEquals(counts(segments.get("ios")), of(2L, 1L));
        assertEquals(segments.get("ios").get(1).getStepLabel(), "buy");
    }

    @Test
    public void testExecuteBySegmentWithoutSegmentColumn() {
        FunnelQueryPlan plan = planBuilder.build(funnel(FunnelWindow.DEFAULT, "view", "buy"));

        expectThrows(ValidationException.class,
                () -> getFunnelPlanExecutor(of(event("a", "view", 0)), ImmutableMap.of()).executeBySegment(plan));
    }

    @Test
    public void testGa4Events() {
        LocalDate day = LocalDate.of(2024, 3, 10);
        List<EventRecord> events = of(
                ga4("a", "page_view", START, day, "/products/shoes"),
                ga4("a", "add_to_cart", START.plusSeconds(3600), day, null),
                ga4("b", "page_view", START, day, "/products/hats"),
                ga4("b", "add_to_cart", START.plusSeconds(3600).plusNanos(1000), day, null),
                ga4("c", "page_view", START, day, "/checkout"),
                ga4("d", "page_view", START, LocalDate.of(2024, 4, 1), "/products/shoes"));

        FunnelDefinition definition = new FunnelDefinition(of(
                new EventStep("page_view", ImmutableMap.of("page_location", ParameterMatch.of("/products/%"))),
                EventStep.named("add_to_cart")),
                MARCH, FunnelWindow.of(1, HOURS), ImmutableMap.of(), DataSource.GA4);

        assertEquals(counts(run(events, definition)), of(2L, 1L));
    }

    private static EventRecord ga4(String user, String name, Instant time, LocalDate eventDate, String location) {
        return new EventRecord(user, name, time, eventDate, ImmutableMap.of(),
                location == null ? ImmutableMap.<String, Object>of() : ImmutableMap.<String, Object>of("page_location", location));
    }

    @Test
    public void testExecuteByArm() {
        List<EventRecord> events = of(
                event("a", "view", 0), event("a", "buy", 10),
                event("b", "view", 0),
                event("c", "view", 0), event("c", "buy", 10),
                event("d", "view", 0), event("d", "buy", 10),
                event("e", "view", 0), event("e", "buy", 10));
        Map<String, String> groupCodes = ImmutableMap.of(
                "a", "EXP-A1",
                "b", "EXP-A2",
                "c", "EXP-B1",
                "d", "OTHER-B1");

        FunnelQueryPlan plan = planBuilder.build(funnel(FunnelWindow.DEFAULT, "view", "buy"));
        Map<Arm, FunnelResult> arms = getFunnelPlanExecutor(events, groupCodes)
                .executeByArm(plan, new ABTestConfig("project.dataset.ab_tests", "EXP", "user_id"))
                .join();

        assertEquals(arms.keySet(), ImmutableSet.of(Arm.CONTROL, Arm.TEST, Arm.ALL));
        assertEquals(counts(arms.get(Arm.CONTROL)), of(2L, 1L));
        assertEquals(counts(arms.get(Arm.TEST)), of(1L, 1L));
        assertEquals(counts(arms.get(Arm.ALL)), of(3L, 2L));
    }

    @Test
    public void testExecuteByArmWithoutUsers() {
        FunnelQueryPlan plan = planBuilder.build(funnel(FunnelWindow.DEFAULT, "view", "buy"));
        Map<Arm, FunnelResult> arms = getFunnelPlanExecutor(of(event("a", "view", 0)), ImmutableMap.of())
                .executeByArm(plan, new ABTestConfig("project.dataset.ab_tests", "EXP", "user_id"))
                .join();

        assertEquals(counts(arms.get(Arm.CONTROL)), of(0L, 0L));
        assertEquals(counts(arms.get(Arm.TEST)), of(0L, 0L));
        assertEquals(counts(arms.get(Arm.ALL)), of(0L, 0L));
    }

    @Test
    public void testEstimate() {
        FunnelQueryPlan plan = planBuilder.build(funnel(FunnelWindow.DEFAULT, "view", "buy"));
        CostEstimate estimate = getFunnelPlanExecutor(of(event("a", "view", 0)), ImmutableMap.of())
                .estimate(plan)
                .join();

        assertTrue(estimate.getBytesProcessed() >= 0);
    }
}
