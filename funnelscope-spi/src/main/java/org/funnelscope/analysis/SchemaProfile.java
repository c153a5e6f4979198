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

import com.google.common.base.MoreObjects;

import java.util.Objects;

import static org.funnelscope.util.ValidationUtil.checkNotEmpty;
import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Maps the abstract columns a funnel needs onto the concrete layout of a {@link DataSource}.
 * Resolved once per plan, every column and unit difference between event tables flows through this value.
 */
public final class SchemaProfile {
    public static final SchemaProfile STANDARD = new SchemaProfile(DataSource.STANDARD,
            "timestamp", TimestampUnit.SECONDS,
            "timestamp", DateFilter.TIMESTAMP_CAST,
            "user_id", "event_name",
            ParameterAccessor.FLAT_COLUMN, null,
            GroupingStrategy.EXPLICIT_GROUP_KEYS);

    public static final SchemaProfile GA4 = new SchemaProfile(DataSource.GA4,
            "event_timestamp", TimestampUnit.MICROSECONDS,
            "event_date", DateFilter.DATE_COLUMN,
            "user_pseudo_id", "event_name",
            ParameterAccessor.NESTED_KEY_VALUE, "event_params",
            GroupingStrategy.ALL_NON_AGGREGATED_IMPLICIT);

    private final DataSource dataSource;
    private final String timestampColumn;
    private final TimestampUnit timestampUnit;
    private final String dateColumn;
    private final DateFilter dateFilter;
    private final String userIdColumn;
    private final String eventNameColumn;
    private final ParameterAccessor parameterAccessor;
    private final String parametersColumn;
    private final GroupingStrategy groupingStrategy;

    private SchemaProfile(DataSource dataSource,
                          String timestampColumn,
                          TimestampUnit timestampUnit,
                          String dateColumn,
                          DateFilter dateFilter,
                          String userIdColumn,
                          String eventNameColumn,
                          ParameterAccessor parameterAccessor,
                          String parametersColumn,
                          GroupingStrategy groupingStrategy) {
        this.dataSource = dataSource;
        this.timestampColumn = timestampColumn;
        this.timestampUnit = timestampUnit;
        this.dateColumn = dateColumn;
        this.dateFilter = dateFilter;
        this.userIdColumn = userIdColumn;
        this.eventNameColumn = eventNameColumn;
        this.parameterAccessor = parameterAccessor;
        this.parametersColumn = parametersColumn;
        this.groupingStrategy = groupingStrategy;
    }

    public static SchemaProfile forDataSource(DataSource dataSource) {
        checkNotNull(dataSource, "dataSource");
        switch (dataSource) {
            case STANDARD:
                return STANDARD;
            case GA4:
                return GA4;
            default:
                throw new IllegalStateException("Unknown data source: " + dataSource);
        }
    }

    /**
     * Returns a copy that reads event time from another column. When dates are derived from the
     * timestamp, the date binding follows the new column.
     */
    public SchemaProfile withTimestampColumn(String column) {
        checkNotEmpty(column, "timestamp column");
        return new SchemaProfile(dataSource, column, timestampUnit,
                dateFilter == DateFilter.TIMESTAMP_CAST ? column : dateColumn, dateFilter,
                userIdColumn, eventNameColumn, parameterAccessor, parametersColumn, groupingStrategy);
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public TimestampUnit getTimestampUnit() {
        return timestampUnit;
    }

    public String getDateColumn() {
        return dateColumn;
    }

    public DateFilter getDateFilter() {
        return dateFilter;
    }

    public String getUserIdColumn() {
        return userIdColumn;
    }

    public String getEventNameColumn() {
        return eventNameColumn;
    }

    public ParameterAccessor getParameterAccessor() {
        return parameterAccessor;
    }

    /**
     * The repeated key/value column holding event parameters, null when parameters are flat columns.
     */
    public String getParametersColumn() {
        return parametersColumn;
    }

    public GroupingStrategy getGroupingStrategy() {
        return groupingStrategy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SchemaProfile)) {
            return false;
        }
        SchemaProfile that = (SchemaProfile) o;
        return dataSource == that.dataSource &&
                timestampColumn.equals(that.timestampColumn) &&
                timestampUnit == that.timestampUnit &&
                dateColumn.equals(that.dateColumn) &&
                dateFilter == that.dateFilter &&
                userIdColumn.equals(that.userIdColumn) &&
                eventNameColumn.equals(that.eventNameColumn) &&
                parameterAccessor == that.parameterAccessor &&
                Objects.equals(parametersColumn, that.parametersColumn) &&
                groupingStrategy == that.groupingStrategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataSource, timestampColumn, timestampUnit, dateColumn, dateFilter,
                userIdColumn, eventNameColumn, parameterAccessor, parametersColumn, groupingStrategy);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("dataSource", dataSource)
                .add("timestampColumn", timestampColumn)
                .add("timestampUnit", timestampUnit)
                .add("dateColumn", dateColumn)
                .add("userIdColumn", userIdColumn)
                .toString();
    }

    public enum DateFilter {
        /**
         * The date range is applied to the calendar date of the timestamp column.
         */
        TIMESTAMP_CAST,
        /**
         * The date range is applied to a dedicated (partition) date column.
         */
        DATE_COLUMN
    }

    public enum ParameterAccessor {
        FLAT_COLUMN,
        NESTED_KEY_VALUE
    }

    public enum GroupingStrategy {
        EXPLICIT_GROUP_KEYS,
        /**
         * The backend groups by every non-aggregated output column without an explicit key list.
         */
        ALL_NON_AGGREGATED_IMPLICIT
    }
}
