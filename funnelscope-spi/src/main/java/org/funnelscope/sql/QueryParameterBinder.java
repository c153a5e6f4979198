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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.funnelscope.util.MissingParameterException;
import org.funnelscope.util.ValidationException;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.funnelscope.util.ValidationUtil.checkNotEmpty;
import static org.funnelscope.util.ValidationUtil.checkNotNull;

/**
 * Binds the {@code @name} placeholders of a query to typed parameter values. Values are never written into the query
 * text, the backend receives them as named parameters. Placeholders inside string literals, quoted identifiers and
 * comments are ignored, as are {@code @@} system variables.
 */
public class QueryParameterBinder {
    public static final char PLACEHOLDER_PREFIX = '@';

    public BoundQuery bind(String query, Map<String, ?> parameters) {
        checkNotEmpty(query, "query");
        checkNotNull(parameters, "parameters");

        Set<String> placeholders = placeholders(query);
        Set<String> missing = new TreeSet<>();
        ImmutableMap.Builder<String, NamedParameterValue> bound = ImmutableMap.builder();
        for (String name : placeholders) {
            if (!parameters.containsKey(name)) {
                missing.add(name);
                continue;
            }
            Object value = parameters.get(name);
            if (value == null) {
                throw new ValidationException("Query parameter " + name + " is null");
            }
            bound.put(name, value instanceof NamedParameterValue ? (NamedParameterValue) value : NamedParameterValue.of(value));
        }

        if (!missing.isEmpty()) {
            throw new MissingParameterException(missing);
        }
        return new BoundQuery(query, bound.build());
    }

    /**
     * Placeholder names in order of first appearance.
     */
    public static Set<String> placeholders(String query) {
        ImmutableSet.Builder<String> names = ImmutableSet.builder();
        int length = query.length();
        int i = 0;
        while (i < length) {
            char c = query.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                i = skipQuoted(query, i, c);
            }
            else if (c == '-' && i + 1 < length && query.charAt(i + 1) == '-' || c == '#') {
                int end = query.indexOf('\n', i);
                i = end == -1 ? length : end + 1;
            }
            else if (c == '/' && i + 1 < length && query.charAt(i + 1) == '*') {
                int end = query.indexOf("*/", i + 2);
                i = end == -1 ? length : end + 2;
            }
            else if (c == PLACEHOLDER_PREFIX) {
                if (i + 1 < length && query.charAt(i + 1) == PLACEHOLDER_PREFIX) {
                    i += 2;
                    while (i < length && isIdentifierPart(query.charAt(i))) {
                        i++;
                    }
                    continue;
                }
                int start = i + 1;
                int end = start;
                if (end < length && isIdentifierStart(query.charAt(end))) {
                    while (end < length && isIdentifierPart(query.charAt(end))) {
                        end++;
                    }
                    names.add(query.substring(start, end));
                }
                i = Math.max(end, start);
            }
            else {
                i++;
            }
        }
        return names.build();
    }

    private static int skipQuoted(String query, int start, char quote) {
        int i = start + 1;
        while (i < query.length()) {
            char c = query.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return query.length();
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public static class BoundQuery {
        private final String query;
        private final Map<String, NamedParameterValue> parameters;

        public BoundQuery(String query, Map<String, NamedParameterValue> parameters) {
            this.query = query;
            this.parameters = ImmutableMap.copyOf(parameters);
        }

        public String getQuery() {
            return query;
        }

        public Map<String, NamedParameterValue> getParameters() {
            return parameters;
        }

        @Override
        public String toString() {
            return query + " " + parameters;
        }
    }
}
