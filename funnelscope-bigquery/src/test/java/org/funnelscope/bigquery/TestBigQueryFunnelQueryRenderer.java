package org.funnelscope.bigquery;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.funnelscope.analysis.ABTestConfig;
import org.funnelscope.analysis.DataSource;
import org.funnelscope.analysis.DateRange;
import org.funnelscope.analysis.EventStep;
import org.funnelscope.analysis.FunnelDefinition;
import org.funnelscope.analysis.FunnelPlanBuilder;
import org.funnelscope.analysis.FunnelQueryPlan;
import org.funnelscope.analysis.FunnelWindow;
import org.funnelscope.analysis.ParameterMatch;
import org.funnelscope.analysis.SchemaProfile;
import org.funnelscope.util.ConfigurationException;
import org.funnelscope.util.ValidationException;
import org.testng.annotations.Test;

import java.util.regex.Pattern;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestBigQueryFunnelQueryRenderer {
    private static final BigQueryConfig CONFIG = new BigQueryConfig()
            .setProjectId("proj")
            .setDataset("analytics")
            .setTable("events");

    private final BigQueryFunnelQueryRenderer renderer = new BigQueryFunnelQueryRenderer(CONFIG);
    private final FunnelPlanBuilder planBuilder = new FunnelPlanBuilder();

    private static FunnelDefinition definition(DataSource dataSource) {
        return new FunnelDefinition(ImmutableList.of(
                new EventStep("page_view", ImmutableMap.of("page_location", ParameterMatch.of("/products/%"))),
                EventStep.named("add_to_cart"),
                new EventStep("purchase", "Bob's purchase", ImmutableMap.of(
                        "amount", ParameterMatch.of(20),
                        "plan", ParameterMatch.of(ImmutableList.of("pro", "team"))))),
                DateRange.of("2024-01-01", "2024-01-31"),
                FunnelWindow.DEFAULT,
                ImmutableMap.of("country", ParameterMatch.of("US")),
                dataSource);
    }

    private static void assertContains(String query, String expected) {
        assertTrue(query.contains(expected), "expected <" + expected + "> in:\n" + query);
    }

    private static int occurrences(String query, String part) {
        return query.split(Pattern.quote(part), -1).length - 1;
    }

    @Test
    public void testStandard() {
        String query = renderer.render(planBuilder.build(definition(DataSource.STANDARD)));

        assertContains(query, "FROM `proj.analytics.events` e");
        assertContains(query, "SELECT e.`user_id` AS user_id, MIN(e.`timestamp`) AS anchor_ts, MIN(e.`timestamp`) AS ts");
        assertContains(query, "DATE(e.`timestamp`) BETWEEN '2024-01-01' AND '2024-01-31'");
        assertContains(query, "e.`event_name` = 'page_view'");
        assertContains(query, "e.`page_location` LIKE '/products/%'");
        assertContains(query, "e.`country` = 'US'");
        assertContains(query, "JOIN step0 prev ON e.`user_id` = prev.user_id");
        assertContains(query, "e.`timestamp` > prev.ts");
        assertContains(query, "e.`timestamp` <= TIMESTAMP_ADD(prev.anchor_ts, INTERVAL 86400 SECOND)");
        assertContains(query, "GROUP BY e.`user_id`\n");
        assertContains(query, "GROUP BY e.`user_id`, prev.anchor_ts");
        assertContains(query, "SELECT 0 AS step_index, 'page_view' AS step_label, COUNT(DISTINCT user_id) AS user_count FROM step0");
        assertTrue(query.endsWith("ORDER BY step_index"), query);
        assertFalse(query.contains("GROUP BY ALL"));
    }

    @Test
    public void testGa4() {
        String query = renderer.render(planBuilder.build(definition(DataSource.GA4)));

        assertContains(query, "SELECT e.`user_pseudo_id` AS user_id, MIN(e.`event_timestamp`) AS anchor_ts");
        assertContains(query, "e.`event_date` BETWEEN '20240101' AND '20240131'");
        assertContains(query, "EXISTS (SELECT 1 FROM UNNEST(e.`event_params`) p WHERE p.key = 'page_location' AND COALESCE(");
        assertContains(query, ") LIKE '/products/%')");
        assertContains(query, "p.key = 'amount' AND COALESCE(");
        assertContains(query, ") = '20')");
        assertContains(query, ") IN ('pro', 'team'))");
        assertContains(query, "e.`country` = 'US'");
        assertContains(query, "e.`event_timestamp` <= prev.anchor_ts + 86400000000");
        assertContains(query, "GROUP BY ALL");
        assertFalse(query.contains("DATE(e."), query);
        assertFalse(query.contains("TIMESTAMP_ADD"), query);
    }

    @Test
    public void testProfilesShareStepLayout() {
        String standard = renderer.render(planBuilder.build(definition(DataSource.STANDARD)));
        String ga4 = renderer.render(planBuilder.build(definition(DataSource.GA4)));

        for (String part : ImmutableList.of("AS step_index", "UNION ALL", " AS (\n", "JOIN step")) {
            assertEquals(occurrences(standard, part), occurrences(ga4, part), part);
        }
        assertEquals(occurrences(standard, "AS step_index"), 3);
        assertTrue(standard.indexOf("'page_view' AS step_label") < standard.indexOf("'add_to_cart' AS step_label"));
    }

    @Test
    public void testTypedLiterals() {
        String query = renderer.render(planBuilder.build(definition(DataSource.STANDARD)));

        assertContains(query, "e.`amount` = 20");
        assertContains(query, "e.`plan` IN ('pro', 'team')");
        assertContains(query, "'Bob\\'s purchase' AS step_label");
    }

    @Test
    public void testLikeEscaping() {
        FunnelDefinition definition = new FunnelDefinition(ImmutableList.of(
                new EventStep("view", ImmutableMap.of("path", ParameterMatch.of("/a_b/it's%"))),
                EventStep.named("buy")),
                DateRange.of("2024-01-01", "2024-01-31"), FunnelWindow.DEFAULT, ImmutableMap.of(), DataSource.STANDARD);

        String query = renderer.render(planBuilder.build(definition));

        assertContains(query, "e.`path` LIKE '/a\\\\_b/it\\'s%'");
    }

    @Test
    public void testByArm() {
        FunnelQueryPlan plan = planBuilder.build(definition(DataSource.STANDARD));
        String query = renderer.renderByArm(plan, new ABTestConfig("proj.experiments.ab_tests", "EXP_1", "googleID"));

        assertTrue(query.startsWith("WITH ab_assignment AS ("), query);
        assertContains(query, "SELECT CAST(a.`googleID` AS STRING) AS user_id");
        assertContains(query, "CASE WHEN a.`GroupCode` LIKE '%-A%' THEN 'control' WHEN a.`GroupCode` LIKE '%-B%' THEN 'test' END AS arm");
        assertContains(query, "FROM `proj.experiments.ab_tests` a");
        assertContains(query, "WHERE a.`GroupCode` LIKE 'EXP\\\\_1-%'");
        assertContains(query, "AND DATE(a.`date`) BETWEEN '2024-01-01' AND '2024-01-31'");
        assertContains(query, "HAVING COUNT(DISTINCT arm) = 1");
        assertContains(query, "JOIN ab_users ab ON CAST(e.`user_id` AS STRING) = ab.user_id");
        assertContains(query, "GROUP BY e.`user_id`, ab.arm");
        assertContains(query, "GROUP BY e.`user_id`, prev.anchor_ts, prev.arm");
        assertContains(query, "SELECT arm, 2 AS step_index");
        assertContains(query, "FROM step2 GROUP BY arm");
        assertContains(query, "SELECT 'all' AS arm, 0 AS step_index, 'page_view' AS step_label, COUNT(DISTINCT user_id) AS user_count FROM step0\n");
        assertContains(query, "SELECT 'all' AS arm, 2 AS step_index");
        assertEquals(occurrences(query, "AS step_index"), 6);
        assertTrue(query.endsWith("ORDER BY arm, step_index"), query);
    }

    @Test
    public void testStructColumnFilter() {
        FunnelDefinition definition = new FunnelDefinition(ImmutableList.of(
                EventStep.named("page_view"), EventStep.named("purchase")),
                DateRange.of("2024-01-01", "2024-01-31"), FunnelWindow.DEFAULT,
                ImmutableMap.of("geo.country", ParameterMatch.of("US")), DataSource.GA4);

        String query = renderer.render(planBuilder.build(definition));

        assertContains(query, "e.`geo`.`country` = 'US'");
        assertFalse(query.contains("`geo.country`"), query);
        assertEquals(occurrences(query, "e.`geo`.`country` = 'US'"), 2);
    }

    @Test
    public void testBySegment() {
        FunnelQueryPlan plan = planBuilder.build(definition(DataSource.STANDARD).withGroupBy("platform"));
        String query = renderer.renderBySegment(plan);

        assertContains(query, "SELECT e.`user_id` AS user_id, CAST(e.`platform` AS STRING) AS segment, MIN(e.`timestamp`) AS anchor_ts");
        assertContains(query, "AND e.`platform` IS NOT NULL");
        assertContains(query, "GROUP BY e.`user_id`, CAST(e.`platform` AS STRING)\n");
        assertContains(query, "SELECT e.`user_id` AS user_id, prev.segment AS segment, prev.anchor_ts AS anchor_ts");
        assertContains(query, "AND CAST(e.`platform` AS STRING) = prev.segment");
        assertContains(query, "GROUP BY e.`user_id`, prev.anchor_ts, prev.segment");
        assertContains(query, "SELECT segment, 0 AS step_index, 'page_view' AS step_label");
        assertContains(query, "FROM step2 GROUP BY segment");
        assertEquals(occurrences(query, "= prev.segment"), 2);
        assertTrue(query.endsWith("ORDER BY segment, step_index"), query);
    }

    @Test
    public void testBySegmentStructColumn() {
        FunnelQueryPlan plan = planBuilder.build(definition(DataSource.GA4).withGroupBy("device.category"));
        String query = renderer.renderBySegment(plan);

        assertContains(query, "CAST(e.`device`.`category` AS STRING) AS segment");
        assertContains(query, "AND e.`device`.`category` IS NOT NULL");
        assertContains(query, "GROUP BY ALL");
    }

    @Test(expectedExceptions = ValidationException.class)
    public void testBySegmentWithoutSegmentColumn() {
        renderer.renderBySegment(planBuilder.build(definition(DataSource.STANDARD)));
    }

    @Test
    public void testTimestampOverride() {
        FunnelQueryPlan plan = planBuilder.build(definition(DataSource.STANDARD),
                SchemaProfile.STANDARD.withTimestampColumn("server_time"));
        String query = renderer.render(plan);

        assertContains(query, "DATE(e.`server_time`) BETWEEN");
        assertContains(query, "MIN(e.`server_time`) AS ts");
        assertFalse(query.contains("e.`timestamp`"), query);
    }

    @Test(expectedExceptions = ConfigurationException.class)
    public void testMissingTable() {
        new BigQueryFunnelQueryRenderer(new BigQueryConfig().setProjectId("proj"))
                .render(planBuilder.build(definition(DataSource.STANDARD)));
    }
}
