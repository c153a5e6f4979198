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

import com.google.common.base.Enums;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import org.funnelscope.analysis.ABTestConfig;
import org.funnelscope.analysis.Arm;
import org.funnelscope.analysis.CostEstimate;
import org.funnelscope.analysis.FunnelPlanExecutor;
import org.funnelscope.analysis.FunnelQueryPlan;
import org.funnelscope.analysis.FunnelResult;
import org.funnelscope.analysis.FunnelResult.StepCount;
import org.funnelscope.analysis.StepPredicate;
import org.funnelscope.report.QueryExecution;
import org.funnelscope.report.QueryExecutor;
import org.funnelscope.report.QueryResult;
import org.funnelscope.util.FunnelException;

import javax.inject.Inject;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;

import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static java.util.Locale.ENGLISH;
import static org.funnelscope.bigquery.BigQueryFunnelQueryRenderer.ARM;
import static org.funnelscope.bigquery.BigQueryFunnelQueryRenderer.SEGMENT;
import static org.funnelscope.bigquery.BigQueryFunnelQueryRenderer.STEP_INDEX;
import static org.funnelscope.bigquery.BigQueryFunnelQueryRenderer.USER_COUNT;
import static org.funnelscope.bigquery.BigQueryResults.checkSucceeded;
import static org.funnelscope.bigquery.BigQueryResults.processedBytes;
import static org.funnelscope.bigquery.BigQueryResults.toLong;
import static org.funnelscope.util.ValidationUtil.checkNotNull;

public class BigQueryFunnelPlanExecutor
        implements FunnelPlanExecutor {
    private final static Logger LOGGER = Logger.get(BigQueryFunnelPlanExecutor.class);

    private final QueryExecutor executor;
    private final BigQueryFunnelQueryRenderer renderer;

    @Inject
    public BigQueryFunnelPlanExecutor(QueryExecutor executor, BigQueryFunnelQueryRenderer renderer) {
        this.executor = checkNotNull(executor, "executor");
        this.renderer = checkNotNull(renderer, "renderer");
    }

    @Override
    public CompletableFuture<FunnelResult> execute(FunnelQueryPlan plan) {
        String query = renderer.render(plan);
        return executor.executeRawQuery(query).getResult()
                .thenApply(result -> {
                    List<List<Object>> rows = rows(query, result);
                    long[] counts = new long[plan.getSteps().size()];
                    int stepColumn = column(result, STEP_INDEX, 0);
                    int countColumn = column(result, USER_COUNT, 2);
                    for (List<Object> row : rows) {
                        counts[stepIndex(plan, row.get(stepColumn))] = toLong(row.get(countColumn));
                    }
                    return toFunnelResult(plan, counts);
                });
    }

    @Override
    public CompletableFuture<CostEstimate> estimate(FunnelQueryPlan plan) {
        String query = renderer.render(plan);
        QueryExecution execution = executor.executeRawQuery(query, ImmutableMap.of(), true);
        return execution.getResult()
                .thenApply(result -> {
                    checkSucceeded(result);
                    return new CostEstimate(processedBytes(execution.currentStats()));
                });
    }

    @Override
    public CompletableFuture<Map<Arm, FunnelResult>> executeByArm(FunnelQueryPlan plan, ABTestConfig config) {
        String query = renderer.renderByArm(plan, config);
        return executor.executeRawQuery(query).getResult()
                .thenApply(result -> {
                    Map<Arm, long[]> counts = new EnumMap<>(Arm.class);
                    counts.put(Arm.CONTROL, new long[plan.getSteps().size()]);
                    counts.put(Arm.TEST, new long[plan.getSteps().size()]);
                    counts.put(Arm.ALL, new long[plan.getSteps().size()]);

                    List<List<Object>> rows = rows(query, result);
                    int armColumn = column(result, ARM, 0);
                    int stepColumn = column(result, STEP_INDEX, 1);
                    int countColumn = column(result, USER_COUNT, 3);
                    for (List<Object> row : rows) {
                        Object value = row.get(armColumn);
                        Arm arm = value == null ? Arm.UNASSIGNED :
                                Enums.getIfPresent(Arm.class, value.toString().toUpperCase(ENGLISH)).or(Arm.UNASSIGNED);
                        long[] armCounts = counts.get(arm);
                        if (armCounts == null) {
                            LOGGER.warn("Ignoring row of arm '%s' in result of test %s", value, config.getTestCode());
                            continue;
                        }
                        armCounts[stepIndex(plan, row.get(stepColumn))] = toLong(row.get(countColumn));
                    }

                    return ImmutableMap.of(
                            Arm.CONTROL, toFunnelResult(plan, counts.get(Arm.CONTROL)),
                            Arm.TEST, toFunnelResult(plan, counts.get(Arm.TEST)),
                            Arm.ALL, toFunnelResult(plan, counts.get(Arm.ALL)));
                });
    }

    @Override
    public CompletableFuture<Map<String, FunnelResult>> executeBySegment(FunnelQueryPlan plan) {
        String query = renderer.renderBySegment(plan);
        return executor.executeRawQuery(query).getResult()
                .thenApply(result -> {
                    List<List<Object>> rows = rows(query, result);
                    int segmentColumn = column(result, SEGMENT, 0);
                    int stepColumn = column(result, STEP_INDEX, 1);
                    int countColumn = column(result, USER_COUNT, 3);

                    Map<String, long[]> counts = new TreeMap<>();
                    for (List<Object> row : rows) {
                        Object segment = row.get(segmentColumn);
                        if (segment == null) {
                            continue;
                        }
                        long[] segmentCounts = counts.computeIfAbsent(segment.toString(), key -> new long[plan.getSteps().size()]);
                        segmentCounts[stepIndex(plan, row.get(stepColumn))] = toLong(row.get(countColumn));
                    }

                    ImmutableMap.Builder<String, FunnelResult> segments = ImmutableMap.builder();
                    for (Map.Entry<String, long[]> entry : counts.entrySet()) {
                        if (entry.getValue()[0] > 0) {
                            segments.put(entry.getKey(), toFunnelResult(plan, entry.getValue()));
                        }
                    }
                    return segments.build();
                });
    }

    private static List<List<Object>> rows(String query, QueryResult result) {
        try {
            checkSucceeded(result);
        } catch (FunnelException e) {
            LOGGER.error("Funnel query failed: %s\n%s", e.getMessage(), query);
            throw e;
        }
        return result.getResult() == null ? ImmutableList.of() : result.getResult();
    }

    /**
     * Cells are looked up by column name, falling back to the rendered column order when the backend sends no
     * metadata.
     */
    private static int column(QueryResult result, String name, int position) {
        int index = result.columnIndex(name);
        return index < 0 ? position : index;
    }

    private static int stepIndex(FunnelQueryPlan plan, Object value) {
        long index = toLong(value);
        if (index < 0 || index >= plan.getSteps().size()) {
            throw new FunnelException("Query returned unknown step index " + value, INTERNAL_SERVER_ERROR);
        }
        return (int) index;
    }

    private static FunnelResult toFunnelResult(FunnelQueryPlan plan, long[] counts) {
        ImmutableList.Builder<StepCount> steps = ImmutableList.builder();
        for (StepPredicate step : plan.getSteps()) {
            steps.add(new StepCount(step.getIndex(), step.getLabel(), counts[step.getIndex()]));
        }
        return new FunnelResult(steps.build());
    }
}
