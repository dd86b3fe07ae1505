package io.github.cyfko.filtertree.core.api;

import io.github.cyfko.filtertree.core.exception.MalformedTreeException;
import io.github.cyfko.filtertree.core.exception.UnsupportedOperatorException;
import io.github.cyfko.filtertree.core.value.TypedValue;

import java.util.Objects;

/**
 * Leaf node comparing a field against a typed value.
 * <p>
 * The canonical constructor validates eagerly:
 * </p>
 * <ul>
 *   <li>field, operator and value must not be null</li>
 *   <li>field must not be blank</li>
 *   <li>the value kind must be accepted by the operator ({@link Operator#acceptedKinds()})</li>
 * </ul>
 * <p>
 * The field is emitted verbatim, so it may be a column name or a dialect expression such as
 * {@code SUBSTR(first_name, 1, 3)}. Whether it exists is not checked.
 * </p>
 *
 * <pre>{@code
 * Condition hr      = Condition.of("department", Operator.EQ, TypedValue.of("HR"));
 * Condition noEmail = Condition.isNull("email");
 * Condition notIn   = Condition.of("role", Operator.IN, TypedValue.list("ADMIN")).negate();  // role NOT IN ('ADMIN')
 * }</pre>
 *
 * @param field    column or expression text on the left-hand side
 * @param operator comparison operator
 * @param value    right-hand operand, {@link TypedValue#none()} for null checks
 * @param negated  whether the comparison is negated
 * @param sequence position among siblings
 * @since 1.0.0
 */
public record Condition(String field, Operator operator, TypedValue value, boolean negated, int sequence)
        implements FilterNode {

    public Condition {
        Objects.requireNonNull(field, "field cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (field.isBlank()) {
            throw new MalformedTreeException("Condition field cannot be blank", null);
        }
        if (!operator.accepts(value.kind())) {
            throw new UnsupportedOperatorException(operator, value.kind());
        }
    }

    public static Condition of(String field, Operator operator, TypedValue value) {
        return new Condition(field, operator, value, false, 0);
    }

    public static Condition isNull(String field) {
        return new Condition(field, Operator.IS_NULL, TypedValue.none(), false, 0);
    }

    public static Condition isNotNull(String field) {
        return new Condition(field, Operator.IS_NOT_NULL, TypedValue.none(), false, 0);
    }

    /**
     * @return a copy of this condition with the negation flag flipped
     */
    public Condition negate() {
        return new Condition(field, operator, value, !negated, sequence);
    }

    @Override
    public Condition withSequence(int sequence) {
        return new Condition(field, operator, value, negated, sequence);
    }
}
