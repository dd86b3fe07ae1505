package io.github.cyfko.filtertree.core.exception;

import io.github.cyfko.filtertree.core.api.Operator;

/**
 * Thrown when {@code IN} or {@code NOT IN} is given an empty list. {@code IN ()} is a syntax
 * error in some dialects and always-false in others, so it is rejected rather than emitted.
 *
 * @since 1.0.0
 */
public class EmptyListOperandException extends FilterCompilationException {

    private final String field;
    private final Operator operator;

    public EmptyListOperandException(String field, Operator operator) {
        super(String.format("Operator %s on field '%s' requires a non-empty list", operator, field));
        this.field = field;
        this.operator = operator;
    }

    /**
     * @return the field of the offending condition, or {@code null} when the list was formatted on its own
     */
    public String field() {
        return field;
    }

    public Operator operator() {
        return operator;
    }
}
