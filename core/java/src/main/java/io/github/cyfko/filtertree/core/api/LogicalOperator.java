package io.github.cyfko.filtertree.core.api;

/**
 * Connector a {@link Group} applies uniformly between all of its direct children.
 * <p>
 * There is no mixed variant: {@code a AND b OR c} is expressed as an
 * {@code OR} group holding an {@code AND} group and {@code c}.
 * </p>
 *
 * @since 1.0.0
 */
public enum LogicalOperator {
    AND,
    OR;

    /**
     * @param value "AND" or "OR", ignoring case and surrounding whitespace
     * @return the matching connector
     * @throws IllegalArgumentException if {@code value} is neither
     */
    public static LogicalOperator fromString(String value) {
        String trimmed = value.trim();
        for (LogicalOperator op : values()) {
            if (op.name().equalsIgnoreCase(trimmed)) return op;
        }
        throw new IllegalArgumentException("Unknown logical operator: '" + value + "'");
    }
}
