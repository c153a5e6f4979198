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
import com.fasterxml.jackson.annotation.JsonValue;
import org.funnelscope.util.ConfigurationException;

import static java.util.Locale.ENGLISH;

/**
 * The event table layout a funnel is computed against.
 */
public enum DataSource {
    /**
     * Generic event table: {@code timestamp}, {@code user_id} and event parameters as flat columns.
     */
    STANDARD,
    /**
     * Google Analytics 4 export: microsecond {@code event_timestamp}, {@code event_date} partition column,
     * {@code user_pseudo_id} and nested {@code event_params}.
     */
    GA4;

    @JsonCreator
    public static DataSource get(String name) {
        if (name == null) {
            throw new ConfigurationException("Data source is not set. Use 'standard' or 'ga4'.");
        }
        try {
            return valueOf(name.trim().toUpperCase(ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(String.format("Unsupported data source: %s. Use 'standard' or 'ga4'.", name));
        }
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(ENGLISH);
    }
}
