package org.funnelscope.util;

public final class ValidationUtil {
    private ValidationUtil()
            throws InstantiationException {
        throw new InstantiationException("The class is not created for instantiation");
    }

    public static <T> T checkNotNull(T value, String name) {
        checkArgument(value != null, name + " is null");
        return value;
    }

    public static String checkNotEmpty(String value, String name) {
        checkArgument(value != null, name + " is null");
        checkArgument(!value.trim().isEmpty(), name + " is empty string");
        return value;
    }

    public static void checkArgument(boolean expression, String errorMessage) {
        if (!expression) {
            throw new ValidationException(errorMessage == null ? "Invalid argument" : errorMessage);
        }
    }

    /**
     * Backtick-quoted column name. Quotes inside the name are dropped.
     */
    public static String checkTableColumn(String column) {
        checkNotNull(column, "column");
        return '`' + stripName(column, "column name") + '`';
    }

    /**
     * Quotes each part of a column path such as {@code geo.country}, which addresses a field of a struct column.
     */
    public static String checkColumnPath(String path) {
        checkNotEmpty(path, "column");
        StringBuilder builder = new StringBuilder();
        for (String part : path.split("\\.", -1)) {
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(checkTableColumn(part));
        }
        return builder.toString();
    }

    /**
     * Quotes a dotted table reference such as {@code project.dataset.table} as a single identifier.
     */
    public static String checkTableReference(String table) {
        checkNotEmpty(table, "table");
        for (String part : table.split("\\.", -1)) {
            if (part.isEmpty()) {
                throw new ValidationException("Invalid table reference: " + table);
            }
        }
        return '`' + table.replace("`", "") + '`';
    }

    public static String checkLiteral(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    public static String stripName(String name, String type) {
        String stripped = name.replace("`", "").replace("\"", "").trim();
        if (stripped.isEmpty()) {
            throw new ValidationException(String.format("Invalid %s: '%s'", type, name));
        }
        return stripped;
    }
}
