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
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.collect.ImmutableList;
import org.funnelscope.util.ValidationException;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A constraint on a single event parameter or column. The variant is chosen once when the funnel
 * definition is parsed: a list becomes {@link AnyOf}, a string containing {@value #WILDCARD} becomes
 * {@link Like}, any other scalar becomes {@link Equals}.
 */
public abstract class ParameterMatch {
    public static final char WILDCARD = '%';

    private ParameterMatch() {
    }

    @JsonCreator
    public static ParameterMatch of(Object value) {
        if (value instanceof ParameterMatch) {
            return (ParameterMatch) value;
        }
        if (value instanceof Collection) {
            Collection<?> values = (Collection<?>) value;
            if (values.isEmpty()) {
                throw new ValidationException("Parameter value list is empty");
            }
            ImmutableList.Builder<Object> builder = ImmutableList.builder();
            for (Object item : values) {
                builder.add(checkScalar(item));
            }
            return new AnyOf(builder.build());
        }
        Object scalar = checkScalar(value);
        if (scalar instanceof String && ((String) scalar).indexOf(WILDCARD) >= 0) {
            return new Like((String) scalar);
        }
        return new Equals(scalar);
    }

    private static Object checkScalar(Object value) {
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value == null) {
            throw new ValidationException("Parameter value is null");
        }
        throw new ValidationException("Unsupported parameter value type: " + value.getClass().getSimpleName());
    }

    public abstract boolean matches(Object actual);

    public abstract <R> R accept(Visitor<R> visitor);

    @JsonValue
    public abstract Object value();

    public static String asString(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && !Double.isInfinite(number)) {
                return Long.toString((long) number);
            }
        }
        return String.valueOf(value);
    }

    public interface Visitor<R> {
        R visitEquals(Equals match);

        R visitLike(Like match);

        R visitAnyOf(AnyOf match);
    }

    public static final class Equals
            extends ParameterMatch {
        private final Object value;

        public Equals(Object value) {
            this.value = value;
        }

        @Override
        public boolean matches(Object actual) {
            return actual != null && asString(value).equals(asString(actual));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEquals(this);
        }

        @Override
        public Object value() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Equals && value.equals(((Equals) o).value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Equals.class, value);
        }

        @Override
        public String toString() {
            return "= " + value;
        }
    }

    /**
     * SQL {@code LIKE} style pattern where {@code %} stands for any run of characters. Every other
     * character, including {@code _}, is matched literally.
     */
    public static final class Like
            extends ParameterMatch {
        private final String pattern;
        private final Pattern regex;

        public Like(String pattern) {
            this.pattern = pattern;
            StringBuilder builder = new StringBuilder();
            int start = 0;
            for (int i = 0; i < pattern.length(); i++) {
                if (pattern.charAt(i) == WILDCARD) {
                    if (i > start) {
                        builder.append(Pattern.quote(pattern.substring(start, i)));
                    }
                    builder.append(".*");
                    start = i + 1;
                }
            }
            if (start < pattern.length()) {
                builder.append(Pattern.quote(pattern.substring(start)));
            }
            this.regex = Pattern.compile(builder.toString(), Pattern.DOTALL);
        }

        public String getPattern() {
            return pattern;
        }

        @Override
        public boolean matches(Object actual) {
            return actual != null && regex.matcher(asString(actual)).matches();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLike(this);
        }

        @Override
        public Object value() {
            return pattern;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Like && pattern.equals(((Like) o).pattern);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Like.class, pattern);
        }

        @Override
        public String toString() {
            return "LIKE " + pattern;
        }
    }

    public static final class AnyOf
            extends ParameterMatch {
        private final List<Object> values;

        public AnyOf(List<Object> values) {
            this.values = ImmutableList.copyOf(values);
        }

        public List<Object> getValues() {
            return values;
        }

        @Override
        public boolean matches(Object actual) {
            if (actual == null) {
                return false;
            }
            String value = asString(actual);
            return values.stream().anyMatch(item -> asString(item).equals(value));
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAnyOf(this);
        }

        @Override
        public Object value() {
            return values;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof AnyOf && values.equals(((AnyOf) o).values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(AnyOf.class, values);
        }

        @Override
        public String toString() {
            return "IN " + values;
        }
    }
}
