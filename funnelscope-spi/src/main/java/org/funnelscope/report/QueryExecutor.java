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
package org.funnelscope.report;

import com.google.common.collect.ImmutableMap;
import org.funnelscope.sql.NamedParameterValue;

import java.util.Map;

/**
 * Ships a rendered query to the data backend. Authentication, sessions and result paging belong to the
 * implementation provided by the application.
 */
public interface QueryExecutor {
    /**
     * @param parameters values of the {@code @name} placeholders in the query, bound by the backend
     * @param dryRun     validate the query and report the bytes it would scan in {@link QueryStats#processedBytes}
     *                   without running it
     */
    QueryExecution executeRawQuery(String sqlQuery, Map<String, NamedParameterValue> parameters, boolean dryRun);

    default QueryExecution executeRawQuery(String sqlQuery, Map<String, NamedParameterValue> parameters) {
        return executeRawQuery(sqlQuery, parameters, false);
    }

    default QueryExecution executeRawQuery(String sqlQuery) {
        return executeRawQuery(sqlQuery, ImmutableMap.of(), false);
    }
}
