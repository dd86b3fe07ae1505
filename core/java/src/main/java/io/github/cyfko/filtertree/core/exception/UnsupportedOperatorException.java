package io.github.cyfko.filtertree.core.exception;

import io.github.cyfko.filtertree.core.api.Operator;
import io.github.cyfko.filtertree.core.value.TypedValue;

/**
 * Thrown when a condition pairs an operator with a value kind it cannot take, for example
 * {@code BETWEEN} with a plain string or {@code IS_NULL} with any operand.
 * <p>
 * Raised eagerly by the {@code Condition} constructor and again by the value formatter,
 * which accepts no pairing it cannot render.
 * </p>
 *
 * <pre>{@code
 * Condition.of("age", Operator.BETWEEN, TypedValue.of(18));
 * // → "Operator BETWEEN does not accept a NUMBER value. Accepted: [RANGE]"
 * }</pre>
 *
 * @since 1.0.0
 */
public class UnsupportedOperatorException extends FilterCompilationException {

    private final Operator operator;
    private final TypedValue.Kind valueKind;

    public UnsupportedOperatorException(Operator operator, TypedValue.Kind valueKind) {
        super(String.format("Operator %s does not accept a %s value. Accepted: %s",
                operator, valueKind, operator.acceptedKinds()));
        this.operator = operator;
        this.valueKind = valueKind;
    }

    public Operator operator() {
        return operator;
    }

    public TypedValue.Kind valueKind() {
        return valueKind;
    }
}
