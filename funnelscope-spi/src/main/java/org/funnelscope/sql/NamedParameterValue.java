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

import java.util.Objects;

import static org.funnelscope.util.ValidationUtil.checkNotNull;

public class NamedParameterValue {
    public final FieldType type;
    public final Object value;

    public NamedParameterValue(FieldType type, Object value) {
        this.type = checkNotNull(type, "type");
        this.value = checkNotNull(value, "value");
    }

    public static NamedParameterValue of(Object value) {
        return new NamedParameterValue(FieldType.fromValue(value), value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NamedParameterValue)) {
            return false;
        }
        NamedParameterValue that = (NamedParameterValue) o;
        return type == that.type && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        return type + " " + value;
    }
}
