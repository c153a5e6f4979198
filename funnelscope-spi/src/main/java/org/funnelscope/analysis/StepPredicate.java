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

import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

/**
 * Logical predicate selecting the events that can satisfy one funnel step.
 * <p>
 * Every predicate requires the event name, the step's parameter matches, the funnel's global filters and the
 * date range. Predicates of later steps additionally require the event to happen strictly after the event that
 * satisfied the previous step and no later than the anchor (step 0) time plus the window. Only the earliest such
 * event of a user counts.
 */
public final class StepPredicate {
    private final int index;
    private final String label;
    private final String eventName;
    private final Map<String, ParameterMatch> parameters;
    private final Map<String, ParameterMatch> filters;

    public StepPredicate(int index, String label, String eventName,
                         Map<String, ParameterMatch> parameters,
                         Map<String, ParameterMatch> filters) {
        this.index = index;
        this.label = label;
        this.eventName = eventName;
        this.parameters = ImmutableMap.copyOf(parameters);
        this.filters = ImmutableMap.copyOf(filters);
    }

    public int getIndex() {
        return index;
    }

    public String getLabel() {
        return label;
    }

    public String getEventName() {
        return eventName;
    }

    public Map<String, ParameterMatch> getParameters() {
        return parameters;
    }

    public Map<String, ParameterMatch> getFilters() {
        return filters;
    }

    public boolean isAnchor() {
        return index == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StepPredicate)) {
            return false;
        }
        StepPredicate that = (StepPredicate) o;
        return index == that.index &&
                label.equals(that.label) &&
                eventName.equals(that.eventName) &&
                parameters.equals(that.parameters) &&
                filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, label, eventName, parameters, filters);
    }

    @Override
    public String toString() {
        return "StepPredicate{" +
                "index=" + index +
                ", eventName='" + eventName + '\'' +
                ", parameters=" + parameters +
                ", filters=" + filters +
                '}';
    }
}
