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
package org.funnelscope.sql;

import com.fasterxml.jackson.annotation.JsonCreator;
import org.funnelscope.util.ValidationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

import static java.util.Locale.ENGLISH;

public enum FieldType {
    STRING, LONG, DOUBLE, BOOLEAN, DATE, TIMESTAMP;

    @JsonCreator
    public static FieldType fromString(String key) {
        return key == null ? null : FieldType.valueOf(key.toUpperCase(ENGLISH));
    }

    /**
     * Type of a Java value bound as a query parameter.
     */
    public static FieldType fromValue(Object value) {
        if (value instanceof String) {
            return STRING;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return LONG;
        }
        if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            return DOUBLE;
        }
        if (value instanceof LocalDate) {
            return DATE;
        }
        if (value instanceof Instant || value instanceof ZonedDateTime
                || value instanceof OffsetDateTime || value instanceof LocalDateTime) {
            return TIMESTAMP;
        }
        if (value == null) {
            throw new ValidationException("Parameter value is null");
        }
        throw new ValidationException("Unsupported parameter value type: " + value.getClass().getSimpleName());
    }

    public boolean isNumeric() {
        return this == LONG || this == DOUBLE;
    }
}
