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
import com.fasterxml.jackson.annotation.JsonProperty;

public final class CostEstimate {
    private final long bytesProcessed;

    @JsonCreator
    public CostEstimate(@JsonProperty("bytesProcessed") long bytesProcessed) {
        this.bytesProcessed = bytesProcessed;
    }

    @JsonProperty
    public long getBytesProcessed() {
        return bytesProcessed;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CostEstimate && bytesProcessed == ((CostEstimate) o).bytesProcessed);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bytesProcessed);
    }

    @Override
    public String toString() {
        return "CostEstimate{bytesProcessed=" + bytesProcessed + '}';
    }
}
