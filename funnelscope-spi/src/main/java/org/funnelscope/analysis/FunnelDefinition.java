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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.funnelscope.util.ValidationException;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.funnelscope.util.ValidationUtil.checkNotEmpty;
import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * User authored description of an ordered funnel. Validated on construction and never mutated.
 */
public final class FunnelDefinition {
    private final List<EventStep> steps;
    private final DateRange dateRange;
    private final FunnelWindow window;
    private final Map<String, ParameterMatch> filters;
    private final DataSource dataSource;
    private final String groupBy;

    public FunnelDefinition(List<EventStep> steps,
                            DateRange dateRange,
                            FunnelWindow window,
                            Map<String, ParameterMatch> filters,
                            DataSource dataSource) {
        this(steps, dateRange, window, filters, dataSource, null);
    }

    /**
     * @param groupBy column that splits the funnel into segments, null for a single funnel
     */
    public FunnelDefinition(List<EventStep> steps,
                            DateRange dateRange,
                            FunnelWindow window,
                            Map<String, ParameterMatch> filters,
                            DataSource dataSource,
                            String groupBy) {
        checkNotNull(steps, "steps");
        if (steps.isEmpty()) {
            throw new ValidationException("Funnel must have at least one step");
        }
        for (EventStep step : steps) {
            checkNotNull(step, "step");
        }
        this.steps = ImmutableList.copyOf(steps);
        this.dateRange = checkNotNull(dateRange, "dateRange");
        this.window = checkNotNull(window, "window");
        this.filters = filters == null ? ImmutableMap.of() : ImmutableMap.copyOf(filters);
        this.dataSource = checkNotNull(dataSource, "dataSource");
        this.groupBy = groupBy == null ? null : checkNotEmpty(groupBy, "groupBy");
    }

    @JsonCreator
    public static FunnelDefinition create(@JsonProperty("steps") List<EventStep> steps,
                                          @JsonProperty("dateRange") DateRange dateRange,
                                          @JsonProperty("window") FunnelWindow window,
                                          @JsonProperty("filters") Map<String, Object> filters,
                                          @JsonProperty("dataSource") DataSource dataSource,
                                          @JsonProperty("groupBy") String groupBy) {
        ImmutableMap.Builder<String, ParameterMatch> matches = ImmutableMap.builder();
        if (filters != null) {
            filters.forEach((column, value) -> matches.put(checkNotEmpty(column, "filter column"), ParameterMatch.of(value)));
        }
        return new FunnelDefinition(steps, dateRange,
                window == null ? FunnelWindow.DEFAULT : window,
                matches.build(),
                dataSource == null ? DataSource.STANDARD : dataSource,
                groupBy);
    }

    @JsonProperty
    public List<EventStep> getSteps() {
        return steps;
    }

    @JsonProperty
    public DateRange getDateRange() {
        return dateRange;
    }

    @JsonProperty
    public FunnelWindow getWindow() {
        return window;
    }

    @JsonProperty
    public Map<String, ParameterMatch> getFilters() {
        return filters;
    }

    @JsonProperty
    public DataSource getDataSource() {
        return dataSource;
    }

    @JsonProperty
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getGroupBy() {
        return groupBy;
    }

    public FunnelDefinition withDataSource(DataSource dataSource) {
        return new FunnelDefinition(steps, dateRange, window, filters, dataSource, groupBy);
    }

    public FunnelDefinition withGroupBy(String groupBy) {
        return new FunnelDefinition(steps, dateRange, window, filters, dataSource, groupBy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunnelDefinition)) {
            return false;
        }
        FunnelDefinition that = (FunnelDefinition) o;
        return steps.equals(that.steps) &&
                dateRange.equals(that.dateRange) &&
                window.equals(that.window) &&
                filters.equals(that.filters) &&
                dataSource == that.dataSource &&
                Objects.equals(groupBy, that.groupBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(steps, dateRange, window, filters, dataSource, groupBy);
    }

    @Override
    public String toString() {
        return "FunnelDefinition{" +
                "steps=" + steps +
                ", dateRange=" + dateRange +
                ", window=" + window +
                ", filters=" + filters +
                ", dataSource=" + dataSource +
                (groupBy == null ? "" : ", groupBy=" + groupBy) +
                '}';
    }
}
