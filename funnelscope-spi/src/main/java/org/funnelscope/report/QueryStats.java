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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

/**
 * Progress of a query. For a dry run {@link #processedBytes} is the number of bytes the query would scan.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryStats {
    public final Integer percentage;
    public final State state;
    public final Long processedRows;
    public final Long processedBytes;

    @JsonCreator
    public QueryStats(@JsonProperty("percentage") Integer percentage,
                      @JsonProperty("state") State state,
                      @JsonProperty("processedRows") Long processedRows,
                      @JsonProperty("processedBytes") Long processedBytes) {
        this.percentage = percentage;
        this.state = state;
        this.processedRows = processedRows;
        this.processedBytes = processedBytes;
    }

    public QueryStats(State state) {
        this(state.isDone() ? 100 : null, state, null, null);
    }

    public static QueryStats finished() {
        return new QueryStats(State.FINISHED);
    }

    public static QueryStats dryRun(long processedBytes) {
        return new QueryStats(100, State.FINISHED, 0L, processedBytes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("state", state)
                .add("percentage", percentage)
                .add("processedRows", processedRows)
                .add("processedBytes", processedBytes)
                .toString();
    }

    public enum State {
        QUEUED(false),
        RUNNING(false),
        FINISHED(true),
        FAILED(true);

        private final boolean done;

        State(boolean done) {
            this.done = done;
        }

        public boolean isDone() {
            return done;
        }
    }
}
