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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Backend agnostic description of a strictly ordered funnel computation. Built by {@link FunnelPlanBuilder},
 * never mutated; rebuild it when the definition or the profile changes.
 */
public final class FunnelQueryPlan {
    private final List<StepPredicate> steps;
    private final DateRange dateRange;
    private final long window;
    private final SchemaProfile profile;
    private final AggregationDirective aggregation;
    private final Optional<String> segmentColumn;

    public FunnelQueryPlan(List<StepPredicate> steps, DateRange dateRange, long window,
                           SchemaProfile profile, AggregationDirective aggregation) {
        this(steps, dateRange, window, profile, aggregation, Optional.empty());
    }

    public FunnelQueryPlan(List<StepPredicate> steps, DateRange dateRange, long window,
                           SchemaProfile profile, AggregationDirective aggregation, Optional<String> segmentColumn) {
        this.steps = ImmutableList.copyOf(steps);
        this.dateRange = dateRange;
        this.window = window;
        this.profile = profile;
        this.aggregation = aggregation;
        this.segmentColumn = segmentColumn;
    }

    public List<StepPredicate> getSteps() {
        return steps;
    }

    public StepPredicate getAnchor() {
        return steps.get(0);
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    /**
     * The window in {@link SchemaProfile#getTimestampUnit()} units.
     */
    public long getWindow() {
        return window;
    }

    public SchemaProfile getProfile() {
        return profile;
    }

    public AggregationDirective getAggregation() {
        return aggregation;
    }

    /**
     * Top level column splitting the funnel into segments. Every step of a user's path must carry the segment value
     * of the user's first step event, events without a value are left out.
     */
    public Optional<String> getSegmentColumn() {
        return segmentColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelQueryPlan)) {
            return false;
        }
        FunnelQueryPlan that = (FunnelQueryPlan) o;
        return window == that.window &&
                steps.equals(that.steps) &&
                dateRange.equals(that.dateRange) &&
                profile.equals(that.profile) &&
                aggregation.equals(that.aggregation) &&
                segmentColumn.equals(that.segmentColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(steps, dateRange, window, profile, aggregation, segmentColumn);
    }

    @Override
    public String toString() {
        return "FunnelQueryPlan{" +
                "steps=" + steps +
                ", dateRange=" + dateRange +
                ", window=" + window + " " + profile.getTimestampUnit() +
                ", profile=" + profile.getDataSource() +
                ", aggregation=" + aggregation +
                segmentColumn.map(column -> ", segment=" + column).orElse("") +
                '}';
    }
}
