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
package org.funnelscope.analysis;

import io.airlift.log.Logger;
import org.funnelscope.config.FunnelConfig;
import org.funnelscope.util.ValidationException;

import javax.inject.Inject;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Entry point of funnel analysis: builds plans from definitions, runs them on the configured
 * {@link FunnelPlanExecutor} and derives conversion and A/B reports from the results.
 */
public class FunnelAnalysisService {
    private final static Logger LOGGER = Logger.get(FunnelAnalysisService.class);

    private final FunnelPlanExecutor executor;
    private final FunnelConfig config;
    private final FunnelPlanBuilder planBuilder = new FunnelPlanBuilder();
    private final ConversionAnalyzer conversionAnalyzer = new ConversionAnalyzer();
    private final SignificanceEngine significanceEngine = new SignificanceEngine();

    @Inject
    public FunnelAnalysisService(FunnelPlanExecutor executor, FunnelConfig config) {
        this.executor = checkNotNull(executor, "executor");
        this.config = checkNotNull(config, "config");
    }

    public FunnelQueryPlan plan(FunnelDefinition definition) {
        checkNotNull(definition, "definition");
        SchemaProfile profile = SchemaProfile.forDataSource(definition.getDataSource());
        if (config.getTimestampColumn() != null) {
            profile = profile.withTimestampColumn(config.getTimestampColumn());
        }
        return planBuilder.build(definition, profile);
    }

    public CompletableFuture<FunnelResult> funnel(FunnelDefinition definition) {
        FunnelQueryPlan plan = plan(definition);
        return executor.execute(plan).whenComplete((result, ex) -> {
            if (ex != null) {
                LOGGER.warn(ex, "Funnel query failed for steps %s", plan.getSteps());
            }
        });
    }

    /**
     * Dry run of {@link #funnel(FunnelDefinition)}.
     */
    public CompletableFuture<CostEstimate> estimate(FunnelDefinition definition) {
        return executor.estimate(plan(definition));
    }

    public CompletableFuture<Map<Arm, FunnelResult>> funnelWithAbTest(FunnelDefinition definition, ABTestConfig testConfig) {
        checkNotNull(testConfig, "testConfig");
        FunnelQueryPlan plan = plan(definition);
        return executor.executeByArm(plan, testConfig).whenComplete((result, ex) -> {
            if (ex != null) {
                LOGGER.warn(ex, "A/B funnel query failed for test %s", testConfig.getTestCode());
            }
        });
    }

    /**
     * Funnel per value of the definition's {@code groupBy} column.
     */
    public CompletableFuture<Map<String, FunnelResult>> funnelBySegment(FunnelDefinition definition) {
        FunnelQueryPlan plan = plan(definition);
        if (!plan.getSegmentColumn().isPresent()) {
            throw new ValidationException("groupBy is not set");
        }
        return executor.executeBySegment(plan).whenComplete((result, ex) -> {
            if (ex != null) {
                LOGGER.warn(ex, "Segmented funnel query failed for column %s", definition.getGroupBy());
            }
        });
    }

    /**
     * Runs the funnel for both arms and compares conversion from the first to the last step.
     */
    public CompletableFuture<SignificanceReport> abTest(FunnelDefinition definition, ABTestConfig testConfig) {
        return funnelWithAbTest(definition, testConfig)
                .thenApply(arms -> significance(arms.get(Arm.CONTROL), arms.get(Arm.TEST)));
    }

    public ConversionReport analyze(FunnelResult result) {
        return conversionAnalyzer.analyze(result);
    }

    public Map<String, ConversionReport> analyzeSegments(Map<String, FunnelResult> segments) {
        return conversionAnalyzer.analyzeSegments(segments);
    }

    public SignificanceReport significance(FunnelResult control, FunnelResult test) {
        return significanceEngine.evaluate(control, test, config.getConfidenceLevel());
    }

    public SignificanceReport significance(FunnelResult control, FunnelResult test, String firstStep, String lastStep) {
        return significanceEngine.evaluate(control, test, firstStep, lastStep, config.getConfidenceLevel());
    }
}
