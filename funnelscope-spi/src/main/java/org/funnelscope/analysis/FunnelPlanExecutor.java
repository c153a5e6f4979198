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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Renders a {@link FunnelQueryPlan} for a backend and runs it. Waiting, retries and the backend session belong to
 * the implementation; failures complete the returned future exceptionally.
 */
public interface FunnelPlanExecutor {
    CompletableFuture<FunnelResult> execute(FunnelQueryPlan plan);

    /**
     * Dry run of {@link #execute(FunnelQueryPlan)}, nothing is computed.
     */
    CompletableFuture<CostEstimate> estimate(FunnelQueryPlan plan);

    /**
     * Runs the plan separately for the control and test arm of an experiment, and once over the users of both arms
     * under {@link Arm#ALL}. Users without an arm are left out of every result; the three keys are always present.
     */
    CompletableFuture<Map<Arm, FunnelResult>> executeByArm(FunnelQueryPlan plan, ABTestConfig config);

    /**
     * Runs the plan once per value of {@link FunnelQueryPlan#getSegmentColumn()}, ordered by segment value. Only
     * segments with users at the first step are returned.
     *
     * @throws org.funnelscope.util.ValidationException when the plan has no segment column
     */
    CompletableFuture<Map<String, FunnelResult>> executeBySegment(FunnelQueryPlan plan);
}
