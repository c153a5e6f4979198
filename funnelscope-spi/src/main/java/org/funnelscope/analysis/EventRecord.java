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

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * A single row of an event table held in memory. {@code columns} are top level columns, {@code parameters} the
 * nested key/value event parameters of tables that store them that way.
 */
public final class EventRecord {
    private final String userId;
    private final String eventName;
    private final Instant time;
    private final LocalDate eventDate;
    private final Map<String, Object> columns;
    private final Map<String, Object> parameters;

    public EventRecord(String userId, String eventName, Instant time, LocalDate eventDate,
                       Map<String, Object> columns, Map<String, Object> parameters) {
        this.userId = checkNotNull(userId, "userId");
        this.eventName = checkNotNull(eventName, "eventName");
        this.time = checkNotNull(time, "time");
        this.eventDate = eventDate == null ? time.atOffset(ZoneOffset.UTC).toLocalDate() : eventDate;
        this.columns = columns == null ? ImmutableMap.of() : ImmutableMap.copyOf(columns);
        this.parameters = parameters == null ? ImmutableMap.of() : ImmutableMap.copyOf(parameters);
    }

    public EventRecord(String userId, String eventName, Instant time, Map<String, Object> columns) {
        this(userId, eventName, time, null, columns, null);
    }

    public EventRecord(String userId, String eventName, Instant time) {
        this(userId, eventName, time, null, null, null);
    }

    public String getUserId() {
        return userId;
    }

    public String getEventName() {
        return eventName;
    }

    public Instant getTime() {
        return time;
    }

    /**
     * The partition date of the row; the UTC date of {@link #getTime()} unless the table records its own.
     */
    public LocalDate getEventDate() {
        return eventDate;
    }

    public Map<String, Object> getColumns() {
        return columns;
    }

    /**
     * Value of a top level column, or of a struct field when {@code path} is dotted like {@code geo.country}.
     */
    public Object getColumn(String path) {
        if (columns.containsKey(path)) {
            return columns.get(path);
        }
        Object value = columns;
        for (String part : path.split("\\.")) {
            if (!(value instanceof Map)) {
                return null;
            }
            value = ((Map<?, ?>) value).get(part);
        }
        return value;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "EventRecord{" + userId + ", " + eventName + " @ " + time + '}';
    }
}
