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

import org.funnelscope.report.QueryResult;
import org.funnelscope.report.QueryStats;
import org.funnelscope.util.FunnelException;

import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;

final class BigQueryResults {
    private BigQueryResults() {
    }

    static QueryResult checkSucceeded(QueryResult result) {
        if (result == null) {
            throw new FunnelException("Query returned no result", INTERNAL_SERVER_ERROR);
        }
        if (result.isFailed()) {
            throw new FunnelException("Query failed: " + result.getError().message, INTERNAL_SERVER_ERROR);
        }
        return result;
    }

    static long processedBytes(QueryStats stats) {
        return stats == null || stats.processedBytes == null ? 0 : stats.processedBytes;
    }

    /**
     * Numeric cells may arrive as numbers or, from the REST API, as strings.
     */
    static long toLong(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new FunnelException("Unexpected numeric value in query result: " + value, INTERNAL_SERVER_ERROR, e);
        }
    }
}
