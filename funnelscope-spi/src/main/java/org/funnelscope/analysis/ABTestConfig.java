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

import java.util.Objects;

import static org.funnelscope.util.ValidationUtil.checkNotEmpty;

/**
 * Where the arm of each user is recorded for an experiment. Rows of {@code tableId} whose group code starts
 * with {@code testCode + "-"} belong to the experiment.
 */
public final class ABTestConfig {
    public static final String DEFAULT_GROUP_CODE_COLUMN = "GroupCode";
    public static final String DEFAULT_DATE_COLUMN = "date";

    private final String tableId;
    private final String testCode;
    private final String userIdColumn;
    private final String groupCodeColumn;
    private final String dateColumn;

    @JsonCreator
    public ABTestConfig(@JsonProperty("tableId") String tableId,
                        @JsonProperty("testCode") String testCode,
                        @JsonProperty("userIdColumn") String userIdColumn,
                        @JsonProperty("groupCodeColumn") String groupCodeColumn,
                        @JsonProperty("dateColumn") String dateColumn) {
        this.tableId = checkNotEmpty(tableId, "tableId");
        this.testCode = checkNotEmpty(testCode, "testCode");
        this.userIdColumn = checkNotEmpty(userIdColumn, "userIdColumn");
        this.groupCodeColumn = groupCodeColumn == null ? DEFAULT_GROUP_CODE_COLUMN : checkNotEmpty(groupCodeColumn, "groupCodeColumn");
        this.dateColumn = dateColumn == null ? DEFAULT_DATE_COLUMN : checkNotEmpty(dateColumn, "dateColumn");
    }

    public ABTestConfig(String tableId, String testCode, String userIdColumn) {
        this(tableId, testCode, userIdColumn, null, null);
    }

    @JsonProperty
    public String getTableId() {
        return tableId;
    }

    @JsonProperty
    public String getTestCode() {
        return testCode;
    }

    @JsonProperty
    public String getUserIdColumn() {
        return userIdColumn;
    }

    @JsonProperty
    public String getGroupCodeColumn() {
        return groupCodeColumn;
    }

    @JsonProperty
    public String getDateColumn() {
        return dateColumn;
    }

    public Arm armOf(String groupCode) {
        return Arm.fromGroupCode(testCode, groupCode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ABTestConfig)) {
            return false;
        }
        ABTestConfig that = (ABTestConfig) o;
        return tableId.equals(that.tableId) &&
                testCode.equals(that.testCode) &&
                userIdColumn.equals(that.userIdColumn) &&
                groupCodeColumn.equals(that.groupCodeColumn) &&
                dateColumn.equals(that.dateColumn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableId, testCode, userIdColumn, groupCodeColumn, dateColumn);
    }
}
