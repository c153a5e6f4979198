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

import com.google.common.collect.ImmutableMap;
import io.airlift.log.Logger;
import org.funnelscope.analysis.CostEstimate;
import org.funnelscope.report.QueryExecution;
import org.funnelscope.report.QueryExecutor;
import org.funnelscope.report.QueryResult;
import org.funnelscope.sql.FieldType;
import org.funnelscope.sql.QueryParameterBinder;
import org.funnelscope.sql.QueryParameterBinder.BoundQuery;

import javax.inject.Inject;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.funnelscope.bigquery.BigQueryResults.checkSucceeded;
import static org.funnelscope.bigquery.BigQueryResults.processedBytes;
import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Runs ad-hoc queries with {@code @name} placeholders. Parameter values are sent to BigQuery as typed named
 * parameters, see {@link #toBigQueryType(FieldType)}.
 */
public class CustomQueryService {
    private final static Logger LOGGER = Logger.get(CustomQueryService.class);

    private final QueryExecutor executor;
    private final QueryParameterBinder binder = new QueryParameterBinder();

    @Inject
    public CustomQueryService(QueryExecutor executor) {
        this.executor = checkNotNull(executor, "executor");
    }

    public QueryExecution query(String query, Map<String, ?> parameters, boolean dryRun) {
        BoundQuery bound = binder.bind(query, parameters == null ? ImmutableMap.of() : parameters);
        LOGGER.debug("Running custom query (dry run: %s) with parameters %s", dryRun, bound.getParameters().keySet());

        QueryExecution execution = executor.executeRawQuery(bound.getQuery(), bound.getParameters(), dryRun);
        return execution.map(result -> result == null || result.isFailed()
                ? result
                : result.withProperty(QueryResult.QUERY, bound.getQuery()));
    }

    public QueryExecution query(String query, Map<String, ?> parameters) {
        return query(query, parameters, false);
    }

    /**
     * Dry run of the query. Fails like {@link #query(String, Map)} on a missing parameter or an invalid query.
     */
    public CompletableFuture<CostEstimate> estimate(String query, Map<String, ?> parameters) {
        QueryExecution execution = query(query, parameters, true);
        return execution.getResult().thenApply(result -> {
            checkSucceeded(result);
            return new CostEstimate(processedBytes(execution.currentStats()));
        });
    }

    public static String toBigQueryType(FieldType type) {
        switch (type) {
            case STRING:
                return "STRING";
            case LONG:
                return "INT64";
            case DOUBLE:
                return "FLOAT64";
            case BOOLEAN:
                return "BOOL";
            case DATE:
                return "DATE";
            case TIMESTAMP:
                return "TIMESTAMP";
            default:
                throw new IllegalArgumentException("Unsupported type: " + type);
        }
    }
}
