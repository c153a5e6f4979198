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
import org.funnelscope.analysis.SchemaProfile.GroupingStrategy;

import java.util.List;
import java.util.Objects;

/**
 * How per-step rows are aggregated: distinct users reaching each step, grouped by the user key.
 * A backend that lacks implicit grouping expands the directive with {@link #getGroupKeys()}.
 */
public final class AggregationDirective {
    private final GroupingStrategy strategy;
    private final List<String> groupKeys;

    public AggregationDirective(GroupingStrategy strategy, List<String> groupKeys) {
        this.strategy = strategy;
        this.groupKeys = ImmutableList.copyOf(groupKeys);
    }

    public static AggregationDirective countDistinctUsers(SchemaProfile profile) {
        return new AggregationDirective(profile.getGroupingStrategy(), ImmutableList.of(profile.getUserIdColumn()));
    }

    public GroupingStrategy getStrategy() {
        return strategy;
    }

    public boolean isImplicit() {
        return strategy == GroupingStrategy.ALL_NON_AGGREGATED_IMPLICIT;
    }

    /**
     * Non-aggregated columns the rows are grouped by, listed even when the grouping is implicit.
     */
    public List<String> getGroupKeys() {
        return groupKeys;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregationDirective)) {
            return false;
        }
        AggregationDirective that = (AggregationDirective) o;
        return strategy == that.strategy && groupKeys.equals(that.groupKeys);
    }

    @Override
    public int hashCode() {
        return Objects.hash(strategy, groupKeys);
    }

    @Override
    public String toString() {
        return "COUNT(DISTINCT user) GROUP BY " + (isImplicit() ? "ALL" : groupKeys);
    }
}
