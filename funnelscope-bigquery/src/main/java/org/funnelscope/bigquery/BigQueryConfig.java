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
package org.funnelscope.bigquery;

import io.airlift.configuration.Config;
import io.airlift.configuration.ConfigDescription;
import org.funnelscope.util.ConfigurationException;

public class BigQueryConfig {
    private String projectId;
    private String dataset;
    private String table;

    public String getProjectId() {
        return projectId;
    }

    @Config("bigquery.project-id")
    @ConfigDescription("Google Cloud project that owns the event table")
    public BigQueryConfig setProjectId(String projectId) {
        this.projectId = projectId;
        return this;
    }

    public String getDataset() {
        return dataset;
    }

    @Config("bigquery.dataset")
    public BigQueryConfig setDataset(String dataset) {
        this.dataset = dataset;
        return this;
    }

    public String getTable() {
        return table;
    }

    @Config("bigquery.table")
    @ConfigDescription("Event table, or the wildcard table of daily GA4 exports such as events_*")
    public BigQueryConfig setTable(String table) {
        this.table = table;
        return this;
    }

    /**
     * {@code project.dataset.table}
     */
    public String getFullTableId() {
        if (isBlank(projectId) || isBlank(dataset) || isBlank(table)) {
            throw new ConfigurationException("bigquery.project-id, bigquery.dataset and bigquery.table must be set");
        }
        return projectId + "." + dataset + "." + table;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
