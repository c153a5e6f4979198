/*
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
package org.funnelscope.bigquery;

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import org.funnelscope.analysis.ABTestConfig;
import org.funnelscope.analysis.AggregationDirective;
import org.funnelscope.analysis.Arm;
import org.funnelscope.analysis.DateRange;
import org.funnelscope.analysis.FunnelQueryPlan;
import org.funnelscope.analysis.ParameterMatch;
import org.funnelscope.analysis.SchemaProfile;
import org.funnelscope.analysis.StepPredicate;
import org.funnelscope.analysis.TimestampUnit;
import org.funnelscope.util.ValidationException;

import javax.inject.Inject;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static org.funnelscope.analysis.SchemaProfile.ParameterAccessor.NESTED_KEY_VALUE;
import static org.funnelscope.util.ValidationUtil.checkColumnPath;
import static org.funnelscope.util.ValidationUtil.checkLiteral;
import static org.funnelscope.util.ValidationUtil.checkNotNull;
import static org.funnelscope.util.ValidationUtil.checkTableColumn;
import static org.funnelscope.util.ValidationUtil.checkTableReference;

/**
 * Renders funnel plans as BigQuery standard SQL.
 * <p>
 * Each step is a CTE holding one row per user with the earliest qualifying timestamp of the step. Step 0 also fixes
 * the anchor timestamp that bounds the window of every later step; step {@code i} joins the users of step
 * {@code i - 1} and only accepts events strictly after the previous step. The query returns one
 * {@code (step_index, step_label, user_count)} row per step, prefixed with the arm for experiment queries and with the
 * segment for segmented queries.
 */
public class BigQueryFunnelQueryRenderer {
    private final static Logger LOGGER = Logger.get(BigQueryFunnelQueryRenderer.class);

    public static final String ARM = "arm";
    public static final String SEGMENT = "segment";
    public static final String STEP_INDEX = "step_index";
    public static final String STEP_LABEL = "step_label";
    public static final String USER_COUNT = "user_count";

    private static final String EVENT_ALIAS = "e";
    private static final String PARAMETER_VALUE = "COALESCE(p.value.string_value, CAST(p.value.int_value AS STRING), " +
            "CAST(p.value.double_value AS STRING), CAST(p.value.float_value AS STRING))";

    private final BigQueryConfig config;

    @Inject
    public BigQueryFunnelQueryRenderer(BigQueryConfig config) {
        this.config = checkNotNull(config, "config");
    }

    public String render(FunnelQueryPlan plan) {
        return render(plan, Optional.empty(), Optional.empty());
    }

    /**
     * Same funnel, counted separately for the control and test arm, followed by the {@code all} rows that count
     * every user of either arm. Users without an arm or with codes of both arms are left out.
     */
    public String renderByArm(FunnelQueryPlan plan, ABTestConfig testConfig) {
        return render(plan, Optional.of(checkNotNull(testConfig, "testConfig")), Optional.empty());
    }

    /**
     * Same funnel, counted separately for every value of the plan's segment column. Every step of a user must carry
     * the segment value of its first step, events without a value are left out.
     */
    public String renderBySegment(FunnelQueryPlan plan) {
        checkNotNull(plan, "plan");
        String segment = plan.getSegmentColumn()
                .orElseThrow(() -> new ValidationException("Funnel has no segment column"));
        return render(plan, Optional.empty(), Optional.of(column(segment)));
    }

    private String render(FunnelQueryPlan plan, Optional<ABTestConfig> testConfig, Optional<String> segment) {
        checkNotNull(plan, "plan");
        SchemaProfile profile = plan.getProfile();
        String table = checkTableReference(config.getFullTableId());
        String user = column(profile.getUserIdColumn());
        String time = column(profile.getTimestampColumn());
        boolean byArm = testConfig.isPresent();
        Optional<String> segmentValue = segment.map(expression -> format("CAST(%s AS STRING)", expression));
        Optional<String> partition = byArm ? Optional.of(ARM) : segment.map(expression -> SEGMENT);

        List<String> ctes = new ArrayList<>();
        testConfig.ifPresent(test -> ctes.addAll(renderArmAssignment(test, plan.getDateRange())));

        for (StepPredicate step : plan.getSteps()) {
            List<String> conditions = new ArrayList<>();
            conditions.add(renderDateCondition(profile, plan.getDateRange()));
            conditions.add(format("%s = '%s'", column(profile.getEventNameColumn()), checkLiteral(step.getEventName())));
            conditions.addAll(renderParameters(profile, step.getParameters()));
            for (Map.Entry<String, ParameterMatch> filter : step.getFilters().entrySet()) {
                conditions.add(renderMatch(column(filter.getKey()), filter.getValue(), false));
            }

            String cte;
            if (step.isAnchor()) {
                List<String> extraKeys = new ArrayList<>();
                String partitionSelect = "";
                if (byArm) {
                    partitionSelect = "ab.arm AS arm, ";
                    extraKeys.add("ab.arm");
                }
                if (segmentValue.isPresent()) {
                    partitionSelect = segmentValue.get() + " AS " + SEGMENT + ", ";
                    conditions.add(segment.get() + " IS NOT NULL");
                    extraKeys.add(segmentValue.get());
                }
                cte = format("step%d AS (\n" +
                                "  SELECT %s AS user_id, %sMIN(%s) AS anchor_ts, MIN(%s) AS ts\n" +
                                "  FROM %s %s%s\n" +
                                "  WHERE %s\n" +
                                "  %s\n" +
                                ")",
                        step.getIndex(),
                        user, partitionSelect, time, time,
                        table, EVENT_ALIAS,
                        byArm ? format("\n  JOIN ab_users ab ON CAST(%s AS STRING) = ab.user_id", user) : "",
                        String.join("\n    AND ", conditions),
                        groupBy(plan.getAggregation(), extraKeys));
            }
            else {
                conditions.add(format("%s > prev.ts", time));
                conditions.add(format("%s <= %s", time, windowEnd(profile.getTimestampUnit(), plan.getWindow())));
                segmentValue.ifPresent(value -> conditions.add(value + " = prev." + SEGMENT));
                List<String> extraKeys = new ArrayList<>();
                extraKeys.add("prev.anchor_ts");
                partition.ifPresent(name -> extraKeys.add("prev." + name));
                cte = format("step%d AS (\n" +
                                "  SELECT %s AS user_id, %sprev.anchor_ts AS anchor_ts, MIN(%s) AS ts\n" +
                                "  FROM %s %s\n" +
                                "  JOIN step%d prev ON %s = prev.user_id\n" +
                                "  WHERE %s\n" +
                                "  %s\n" +
                                ")",
                        step.getIndex(),
                        user, partition.map(name -> format("prev.%s AS %s, ", name, name)).orElse(""), time,
                        table, EVENT_ALIAS,
                        step.getIndex() - 1, user,
                        String.join("\n    AND ", conditions),
                        groupBy(plan.getAggregation(), extraKeys));
            }
            ctes.add(cte);
        }

        List<String> counts = new ArrayList<>();
        for (StepPredicate step : plan.getSteps()) {
            counts.add(renderCount(step, partition.map(name -> name + ", ").orElse(""),
                    partition.map(name -> " GROUP BY " + name).orElse("")));
        }
        if (byArm) {
            for (StepPredicate step : plan.getSteps()) {
                counts.add(renderCount(step, format("'%s' AS %s, ", Arm.ALL.value(), ARM), ""));
            }
        }

        String query = format("WITH %s\n%s\nORDER BY %s%s",
                String.join(",\n", ctes),
                String.join("\nUNION ALL\n", counts),
                partition.map(name -> name + ", ").orElse(""),
                STEP_INDEX);
        LOGGER.debug("Rendered funnel query for %s: %s", profile.getDataSource(), query);
        return query;
    }

    private static String renderCount(StepPredicate step, String prefix, String suffix) {
        return format("SELECT %s%d AS %s, '%s' AS %s, COUNT(DISTINCT user_id) AS %s FROM step%d%s",
                prefix,
                step.getIndex(), STEP_INDEX,
                checkLiteral(step.getLabel()), STEP_LABEL,
                USER_COUNT,
                step.getIndex(),
                suffix);
    }

    private List<String> renderArmAssignment(ABTestConfig test, DateRange dateRange) {
        String groupCode = "a." + checkTableColumn(test.getGroupCodeColumn());
        String assignment = format("ab_assignment AS (\n" +
                        "  SELECT CAST(a.%s AS STRING) AS user_id,\n" +
                        "    CASE WHEN %s LIKE '%%-A%%' THEN '%s' WHEN %s LIKE '%%-B%%' THEN '%s' END AS arm\n" +
                        "  FROM %s a\n" +
                        "  WHERE %s LIKE '%s-%%'\n" +
                        "    AND DATE(a.%s) BETWEEN '%s' AND '%s'\n" +
                        ")",
                checkTableColumn(test.getUserIdColumn()),
                groupCode, Arm.CONTROL.value(), groupCode, Arm.TEST.value(),
                checkTableReference(test.getTableId()),
                groupCode, checkLiteral(escapeLike(test.getTestCode())),
                checkTableColumn(test.getDateColumn()), dateRange.getStart(), dateRange.getEnd());
        String users = "ab_users AS (\n" +
                "  SELECT user_id, ANY_VALUE(arm) AS arm\n" +
                "  FROM ab_assignment\n" +
                "  WHERE arm IS NOT NULL\n" +
                "  GROUP BY user_id\n" +
                "  HAVING COUNT(DISTINCT arm) = 1\n" +
                ")";
        return ImmutableList.of(assignment, users);
    }

    private static String renderDateCondition(SchemaProfile profile, DateRange dateRange) {
        switch (profile.getDateFilter()) {
            case TIMESTAMP_CAST:
                return format("DATE(%s) BETWEEN '%s' AND '%s'", column(profile.getDateColumn()),
                        dateRange.getStart(), dateRange.getEnd());
            case DATE_COLUMN:
                return format("%s BETWEEN '%s' AND '%s'", column(profile.getDateColumn()),
                        dateRange.getStart().format(DateTimeFormatter.BASIC_ISO_DATE),
                        dateRange.getEnd().format(DateTimeFormatter.BASIC_ISO_DATE));
            default:
                throw new IllegalStateException("Unknown date filter: " + profile.getDateFilter());
        }
    }

    private static List<String> renderParameters(SchemaProfile profile, Map<String, ParameterMatch> parameters) {
        List<String> conditions = new ArrayList<>();
        for (Map.Entry<String, ParameterMatch> parameter : parameters.entrySet()) {
            if (profile.getParameterAccessor() == NESTED_KEY_VALUE) {
                conditions.add(format("EXISTS (SELECT 1 FROM UNNEST(%s) p WHERE p.key = '%s' AND %s)",
                        column(profile.getParametersColumn()),
                        checkLiteral(parameter.getKey()),
                        renderMatch(PARAMETER_VALUE, parameter.getValue(), true)));
            }
            else {
                conditions.add(renderMatch(column(parameter.getKey()), parameter.getValue(), false));
            }
        }
        return conditions;
    }

    /**
     * @param asString the expression is a string, so values are compared as string literals
     */
    private static String renderMatch(String expression, ParameterMatch match, boolean asString) {
        return match.accept(new ParameterMatch.Visitor<String>() {
            @Override
            public String visitEquals(ParameterMatch.Equals equals) {
                return expression + " = " + literal(equals.value(), asString);
            }

            @Override
            public String visitLike(ParameterMatch.Like like) {
                return format("%s LIKE '%s'", expression, checkLiteral(escapeLike(like.getPattern())));
            }

            @Override
            public String visitAnyOf(ParameterMatch.AnyOf anyOf) {
                return format("%s IN (%s)", expression, anyOf.getValues().stream()
                        .map(value -> literal(value, asString))
                        .collect(Collectors.joining(", ")));
            }
        });
    }

    private static String literal(Object value, boolean asString) {
        if (!asString && value instanceof Number) {
            return ParameterMatch.asString(value);
        }
        if (!asString && value instanceof Boolean) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        return "'" + checkLiteral(ParameterMatch.asString(value)) + "'";
    }

    /**
     * Only {@code %} stays a wildcard, {@code _} and the escape character match literally.
     */
    static String escapeLike(String pattern) {
        return pattern.replace("\\", "\\\\").replace("_", "\\_");
    }

    private static String windowEnd(TimestampUnit unit, long window) {
        switch (unit) {
            case SECONDS:
                return format("TIMESTAMP_ADD(prev.anchor_ts, INTERVAL %d SECOND)", window);
            case MICROSECONDS:
                return format("prev.anchor_ts + %d", window);
            default:
                throw new IllegalStateException("Unknown timestamp unit: " + unit);
        }
    }

    private static String groupBy(AggregationDirective aggregation, List<String> extraKeys) {
        if (aggregation.isImplicit()) {
            return "GROUP BY ALL";
        }
        List<String> keys = new ArrayList<>();
        for (String key : aggregation.getGroupKeys()) {
            keys.add(column(key));
        }
        keys.addAll(extraKeys);
        return "GROUP BY " + String.join(", ", keys);
    }

    private static String column(String name) {
        return EVENT_ALIAS + "." + checkColumnPath(name);
    }
}
