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
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableMap;

import java.util.Map;
import java.util.Objects;

import static org.funnelscope.util.ValidationUtil.checkNotEmpty;

public final class EventStep {
    private final String name;
    private final String label;
    private final Map<String, ParameterMatch> params;

    public EventStep(String name, String label, Map<String, ParameterMatch> params) {
        this.name = checkNotEmpty(name, "step name");
        this.label = label == null ? name : checkNotEmpty(label, "step label");
        this.params = params == null ? ImmutableMap.of() : ImmutableMap.copyOf(params);
    }

    public EventStep(String name, Map<String, ParameterMatch> params) {
        this(name, null, params);
    }

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public static EventStep create(@JsonProperty("name") String name,
                                   @JsonProperty("label") String label,
                                   @JsonProperty("params") Map<String, Object> params) {
        ImmutableMap.Builder<String, ParameterMatch> matches = ImmutableMap.builder();
        if (params != null) {
            params.forEach((key, value) -> matches.put(checkNotEmpty(key, "parameter name"), ParameterMatch.of(value)));
        }
        return new EventStep(name, label, matches.build());
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EventStep named(String name) {
        return new EventStep(name, null, ImmutableMap.of());
    }

    @JsonProperty
    public String getName() {
        return name;
    }

    @JsonProperty
    public String getLabel() {
        return label;
    }

    @JsonProperty
    public Map<String, ParameterMatch> getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventStep)) {
            return false;
        }
        EventStep that = (EventStep) o;
        return name.equals(that.name) && label.equals(that.label) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, label, params);
    }

    @Override
    public String toString() {
        return params.isEmpty() ? name : name + params;
    }
}
