package org.funnelscope.analysis;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.funnelscope.analysis.SignificanceReport.Recommendation;
import org.funnelscope.config.FunnelConfig;
import org.funnelscope.util.ValidationException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.expectThrows;

public class TestFunnelAnalysisService {
    private static final Instant START = Instant.parse("2024-05-02T08:00:00Z");

    private FunnelAnalysisService service;
    private FunnelDefinition definition;

    @BeforeMethod
    public void setUp() {
        ImmutableList.Builder<EventRecord> events = ImmutableList.builder();
        ImmutableMap.Builder<String, String> groupCodes = ImmutableMap.builder();
        for (int i = 0; i < 40; i++) {
            String user = "user" + i;
            events.add(new EventRecord(user, "view", START.plusSeconds(i)));
            if (i % 2 == 0) {
                events.add(new EventRecord(user, "signup", START.plusSeconds(i + 60)));
            }
            groupCodes.put(user, i < 20 ? "SIGNUP-A" : "SIGNUP-B");
        }

        service = new FunnelAnalysisService(
                new InMemoryFunnelPlanExecutor(events.build(), new InMemoryArmAssignment(groupCodes.build())),
                new FunnelConfig());
        definition = new FunnelDefinition(
                ImmutableList.of(EventStep.named("view"), EventStep.named("signup")),
                DateRange.of("2024-05-01", "2024-05-31"),
                FunnelWindow.valueOf("1h"),
                ImmutableMap.of(),
                DataSource.STANDARD);
    }

    @Test
    public void testFunnel() {
        FunnelResult result = service.funnel(definition).join();

        assertEquals(result, FunnelResult.of(ImmutableList.of("view", "signup"), 40, 20));
    }

    @Test
    public void testAnalyze() {
        ConversionReport report = service.analyze(service.funnel(definition).join());

        assertEquals(report.getOverallConversion(), 0.5, 1e-9);
    }

    @Test
    public void testFunnelWithAbTest() {
        Map<Arm, FunnelResult> arms = service.funnelWithAbTest(definition,
                new ABTestConfig("project.dataset.ab_tests", "SIGNUP", "user_id")).join();

        assertEquals(arms.get(Arm.CONTROL), FunnelResult.of(ImmutableList.of("view", "signup"), 20, 10));
        assertEquals(arms.get(Arm.TEST), FunnelResult.of(ImmutableList.of("view", "signup"), 20, 10));
        assertEquals(arms.get(Arm.ALL), FunnelResult.of(ImmutableList.of("view", "signup"), 40, 20));
    }

    @Test
    public void testFunnelBySegment() {
        ImmutableList.Builder<EventRecord> events = ImmutableList.builder();
        for (int i = 0; i < 10; i++) {
            Map<String, Object> columns = ImmutableMap.of("country", i < 4 ? "DE" : "US");
            events.add(new EventRecord("user" + i, "view", START.plusSeconds(i), columns));
            if (i % 4 == 0) {
                events.add(new EventRecord("user" + i, "signup", START.plusSeconds(i + 60), columns));
            }
        }
        FunnelAnalysisService segmented = new FunnelAnalysisService(
                new InMemoryFunnelPlanExecutor(events.build()), new FunnelConfig());

        Map<String, FunnelResult> segments = segmented.funnelBySegment(definition.withGroupBy("country")).join();

        assertEquals(ImmutableList.copyOf(segments.keySet()), ImmutableList.of("DE", "US"));
        assertEquals(segments.get("DE"), FunnelResult.of(ImmutableList.of("view", "signup"), 4, 1));
        assertEquals(segments.get("US"), FunnelResult.of(ImmutableList.of("view", "signup"), 6, 2));

        Map<String, ConversionReport> reports = segmented.analyzeSegments(segments);
        assertEquals(reports.get("DE").getOverallConversion(), 0.25, 1e-9);
        assertEquals(reports.get("US").getOverallConversion(), 2.0 / 6, 1e-9);
    }

    @Test(expectedExceptions = ValidationException.class)
    public void testFunnelBySegmentWithoutGroupBy() {
        service.funnelBySegment(definition);
    }

    @Test
    public void testAbTest() {
        SignificanceReport report = service.abTest(definition,
                new ABTestConfig("project.dataset.ab_tests", "SIGNUP", "user_id")).join();

        assertEquals(report.getRelativeLift(), 0.0, 1e-9);
        assertFalse(report.isSignificant());
        assertEquals(report.getRecommendation(), Recommendation.CONTINUE);
        assertEquals(report.getConfidenceLevel(), 0.95, 1e-9);
    }

    @Test
    public void testConfiguredTimestampColumn() {
        FunnelAnalysisService configured = new FunnelAnalysisService(
                new InMemoryFunnelPlanExecutor(ImmutableList.of()),
                new FunnelConfig().setTimestampColumn("server_time").setConfidenceLevel(0.9));
        FunnelQueryPlan plan = configured.plan(definition);

        assertEquals(plan.getProfile().getTimestampColumn(), "server_time");
        assertEquals(plan.getWindow(), 3600L);
    }

    @Test
    public void testEstimate() {
        assertEquals(service.estimate(definition).join(), new CostEstimate(0));
    }

    @Test
    public void testFailedExecution() {
        FunnelAnalysisService failing = new FunnelAnalysisService(new FailingExecutor(), new FunnelConfig());

        CompletionException e = expectThrows(CompletionException.class, () -> failing.funnel(definition).join());
        assertEquals(e.getCause().getMessage(), "backend unavailable");
    }

    private static class FailingExecutor
            implements FunnelPlanExecutor {
        @Override
        public CompletableFuture<FunnelResult> execute(FunnelQueryPlan plan) {
            return CompletableFuture.failedFuture(new IllegalStateException("backend unavailable"));
        }

        @Override
        public CompletableFuture<CostEstimate> estimate(FunnelQueryPlan plan) {
            return execute(plan).thenApply(result -> new CostEstimate(0));
        }

        @Override
        public CompletableFuture<Map<Arm, FunnelResult>> executeByArm(FunnelQueryPlan plan, ABTestConfig config) {
            return execute(plan).thenApply(result -> ImmutableMap.of());
        }

        @Override
        public CompletableFuture<Map<String, FunnelResult>> executeBySegment(FunnelQueryPlan plan) {
            return execute(plan).thenApply(result -> ImmutableMap.of());
        }
    }
}
