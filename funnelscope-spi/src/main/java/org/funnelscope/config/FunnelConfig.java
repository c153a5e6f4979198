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
package org.funnelscope.config;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;

public class FunnelConfig {
    private double confidenceLevel = 0.95;
    private String timestampColumn;

    public double getConfidenceLevel() {
        return confidenceLevel;
    }

    @Config("funnel.confidence-level")
    @ConfigDescription("Confidence level of the A/B significance test, between 0 and 1")
    public FunnelConfig setConfidenceLevel(double confidenceLevel) {
        this.confidenceLevel = confidenceLevel;
        return this;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    @Config("funnel.timestamp-column")
    @ConfigDescription("Overrides the timestamp column of the event table")
    public FunnelConfig setTimestampColumn(String timestampColumn) {
        this.timestampColumn = timestampColumn != null && timestampColumn.isEmpty() ? null : timestampColumn;
        return this;
    }
}
