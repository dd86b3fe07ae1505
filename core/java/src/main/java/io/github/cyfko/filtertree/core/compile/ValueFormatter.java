package io.github.cyfko.filtertree.core.compile;

import io.github.cyfko.filtertree.core.api.Operator;
import io.github.cyfko.filtertree.core.config.ExpressionDialect;
import io.github.cyfko.filtertree.core.exception.EmptyListOperandException;
import io.github.cyfko.filtertree.core.exception.UnsupportedOperatorException;
import io.github.cyfko.filtertree.core.value.TypedValue;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders {@link TypedValue} operands as literals of an {@link ExpressionDialect}.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li><strong>String</strong>: quoted, embedded quote characters doubled ({@code O'Brien → 'O''Brien'})</li>
 *   <li><strong>Number</strong>: bare, in the literal's own form (no rounding, scale kept)</li>
 *   <li><strong>Date</strong>: the dialect's date template filled with {@code yyyy-MM-dd}, always four year digits</li>
 *   <li><strong>Boolean</strong>: the dialect's true/false literal pair</li>
 *   <li><strong>String list</strong>: {@code ('a', 'b')}; an empty list is rejected</li>
 *   <li><strong>Range</strong>: {@code <lower> AND <upper>}, each bound per its own kind</li>
 *   <li><strong>None</strong>: empty text</li>
 * </ul>
 * <p>
 * Formatting is locale independent and has no side effects. Instances are immutable and
 * thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public final class ValueFormatter {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd", Locale.ROOT);

    private final ExpressionDialect dialect;
    private final LiteralVisitor literals;

    public ValueFormatter(ExpressionDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
        this.literals = new LiteralVisitor();
    }

    /**
     * Formats {@code value} as the right-hand operand of {@code operator}.
     *
     * @param value    the operand
     * @param operator the operator it is used with
     * @return the literal text, empty for {@link TypedValue.NoneValue}
     * @throws UnsupportedOperatorException if the operator does not accept the value kind
     * @throws EmptyListOperandException    if a string list is empty
     */
    public String format(TypedValue value, Operator operator) {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(operator, "operator cannot be null");
        if (!operator.accepts(value.kind())) {
            throw new UnsupportedOperatorException(operator, value.kind());
        }
        if (value instanceof TypedValue.StringListValue list && list.elements().isEmpty()) {
            throw new EmptyListOperandException(null, operator);
        }
        return value.accept(literals);
    }

    /**
     * @param text raw text
     * @return {@code text} quoted with the dialect's quote character, embedded quotes doubled
     */
    public String quote(String text) {
        char q = dialect.getQuoteChar();
        StringBuilder sb = new StringBuilder(text.length() + 2).append(q);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == q) sb.append(q);
            sb.append(c);
        }
        return sb.append(q).toString();
    }

    private final class LiteralVisitor implements TypedValue.Visitor<String> {

        @Override
        public String visitString(TypedValue.StringValue value) {
            return quote(value.text());
        }

        @Override
        public String visitNumber(TypedValue.NumberValue value) {
            return value.literal();
        }

        @Override
        public String visitDate(TypedValue.DateValue value) {
            return dialect.getDateTemplate().replace(ExpressionDialect.DATE_PLACEHOLDER, ISO_DATE.format(value.date()));
        }

        @Override
        public String visitBoolean(TypedValue.BooleanValue value) {
            return value.flag() ? dialect.getTrueLiteral() : dialect.getFalseLiteral();
        }

        @Override
        public String visitStringList(TypedValue.StringListValue value) {
            List<String> elements = value.elements();
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < elements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(quote(elements.get(i)));
            }
            return sb.append(')').toString();
        }

        @Override
        public String visitRange(TypedValue.RangeValue value) {
            return value.lower().accept(this) + " " + dialect.getAndKeyword() + " " + value.upper().accept(this);
        }

        @Override
        public String visitNone(TypedValue.NoneValue value) {
            return "";
        }
    }
}
