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
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.funnelscope.sql.SchemaField;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Rows returned by the backend, or the error it reported. A failed result carries no rows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {
    public static final String QUERY = "query";
    private static final QueryResult EMPTY = new QueryResult(ImmutableList.of(), ImmutableList.of());

    private final List<SchemaField> metadata;
    private final List<List<Object>> result;
    private final QueryError error;
    private final Map<String, Object> properties;

    @JsonCreator
    private QueryResult(
            @JsonProperty("metadata") List<SchemaField> metadata,
            @JsonProperty("result") List<List<Object>> result,
            @JsonProperty("error") QueryError error,
            @JsonProperty("properties") Map<String, Object> properties) {
        this.metadata = metadata;
        this.result = result;
        this.error = error;
        this.properties = properties == null ? ImmutableMap.of() : ImmutableMap.copyOf(properties);
    }

    public QueryResult(List<SchemaField> metadata, List<List<Object>> result) {
        this(metadata, result, null, null);
    }

    public QueryResult(List<SchemaField> metadata, List<List<Object>> result, Map<String, Object> properties) {
        this(metadata, result, null, properties);
    }

    public static QueryResult errorResult(QueryError error) {
        return new QueryResult(null, null, error, null);
    }

    public static QueryResult errorResult(QueryError error, String query) {
        return new QueryResult(null, null, error, ImmutableMap.of(QUERY, query));
    }

    public static QueryResult empty() {
        return EMPTY;
    }

    /**
     * Copy of this result with {@code key} set, replacing a previous value.
     */
    public QueryResult withProperty(String key, Object value) {
        ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
        properties.forEach((name, existing) -> {
            if (!name.equals(key)) {
                builder.put(name, existing);
            }
        });
        builder.put(key, value);
        return new QueryResult(metadata, result, error, builder.build());
    }

    @JsonProperty
    public QueryError getError() {
        return error;
    }

    @JsonProperty
    public Map<String, Object> getProperties() {
        return properties;
    }

    public boolean isFailed() {
        return error != null;
    }

    /**
     * Each row holds the values of the columns described by {@link #getMetadata()}, in the same order.
     */
    @JsonProperty
    public List<List<Object>> getResult() {
        return result;
    }

    @JsonProperty
    public List<SchemaField> getMetadata() {
        return metadata;
    }

    @JsonIgnore
    public int getRowCount() {
        return result == null ? 0 : result.size();
    }

    @JsonIgnore
    public Optional<String> getQuery() {
        return Optional.ofNullable(properties.get(QUERY)).map(Object::toString);
    }

    /**
     * Position of the named column in each row, -1 when the metadata does not describe it.
     */
    public int columnIndex(String name) {
        if (metadata == null) {
            return -1;
        }
        for (int i = 0; i < metadata.size(); i++) {
            if (metadata.get(i).getName().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("error", error)
                .add("metadata", metadata)
                .add("rows", result == null ? null : result.size())
                .toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryResult)) {
            return false;
        }
        QueryResult that = (QueryResult) o;
        return Objects.equals(metadata, that.metadata) &&
                Objects.equals(result, that.result) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, result, error);
    }
}
