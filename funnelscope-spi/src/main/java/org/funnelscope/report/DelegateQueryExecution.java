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

import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Passes the result of another execution through a function. Stats and cancellation go to the wrapped execution.
 */
public class DelegateQueryExecution
        implements QueryExecution {
    private final QueryExecution delegate;
    private final CompletableFuture<QueryResult> result;

    public DelegateQueryExecution(QueryExecution delegate, Function<QueryResult, QueryResult> function) {
        this.delegate = checkNotNull(delegate, "delegate");
        this.result = delegate.getResult().thenApply(checkNotNull(function, "function"));
    }

    @Override
    public QueryStats currentStats() {
        return delegate.currentStats();
    }

    @Override
    public boolean isFinished() {
        return result.isDone();
    }

    @Override
    public CompletableFuture<QueryResult> getResult() {
        return result;
    }

    @Override
    public void kill() {
        result.cancel(false);
        delegate.kill();
    }
}
