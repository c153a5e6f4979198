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

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Handle on a query sent to the backend. The result future fails only on transport errors, a query rejected by the
 * backend completes with a failed {@link QueryResult}.
 */
public interface QueryExecution {
    static QueryExecution completedQueryExecution(QueryResult result) {
        return completedQueryExecution(result, QueryStats.finished());
    }

    static QueryExecution completedQueryExecution(QueryResult result, QueryStats stats) {
        CompletableFuture<QueryResult> future = CompletableFuture.completedFuture(result);
        return new QueryExecution() {
            @Override
            public QueryStats currentStats() {
                return stats;
            }

            @Override
            public boolean isFinished() {
                return true;
            }

            @Override
            public CompletableFuture<QueryResult> getResult() {
                return future;
            }

            @Override
            public void kill() {
            }
        };
    }

    QueryStats currentStats();

    boolean isFinished();

    CompletableFuture<QueryResult> getResult();

    void kill();

    default QueryExecution map(Function<QueryResult, QueryResult> function) {
        return new DelegateQueryExecution(this, function);
    }
}
