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

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import org.funnelscope.util.ValidationException;

import java.util.List;
import java.util.Optional;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Compiles a {@link FunnelDefinition} into a {@link FunnelQueryPlan}. Stateless and thread-safe.
 */
public class FunnelPlanBuilder {
    private final static Logger LOGGER = Logger.get(FunnelPlanBuilder.class);

    public FunnelQueryPlan build(FunnelDefinition definition) {
        checkNotNull(definition, "definition");
        return build(definition, SchemaProfile.forDataSource(definition.getDataSource()));
    }

    public FunnelQueryPlan build(FunnelDefinition definition, SchemaProfile profile) {
        checkNotNull(definition, "definition");
        checkNotNull(profile, "profile");

        List<EventStep> steps = definition.getSteps();
        if (steps.size() < 2) {
            throw new ValidationException(String.format("Funnel must have at least 2 steps, %d given", steps.size()));
        }
        if (!definition.getDateRange().isValid()) {
            throw new ValidationException(String.format("Start date %s is after end date %s",
                    definition.getDateRange().getStart(), definition.getDateRange().getEnd()));
        }
        if (!definition.getWindow().isPositive()) {
            throw new ValidationException("Window must be positive: " + definition.getWindow());
        }

        long window = definition.getWindow().toUnits(profile.getTimestampUnit());
        if (window <= 0) {
            throw new ValidationException(String.format("Window %s is shorter than the timestamp resolution (%s)",
                    definition.getWindow(), profile.getTimestampUnit()));
        }

        ImmutableList.Builder<StepPredicate> predicates = ImmutableList.builder();
        for (int i = 0; i < steps.size(); i++) {
            EventStep step = steps.get(i);
            predicates.add(new StepPredicate(i, step.getLabel(), step.getName(), step.getParams(), definition.getFilters()));
        }

        FunnelQueryPlan plan = new FunnelQueryPlan(predicates.build(),
                definition.getDateRange(),
                window,
                profile,
                AggregationDirective.countDistinctUsers(profile),
                Optional.ofNullable(definition.getGroupBy()));
        LOGGER.debug("Built funnel plan %s", plan);
        return plan;
    }
}
