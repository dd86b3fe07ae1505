package io.github.cyfko.filtertree.core.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Closed set of literal kinds a {@code Condition} can compare its field against.
 * <p>
 * Each kind is an immutable record. Consumers dispatch through {@link Visitor} rather than
 * switching on a tag, so adding a kind is a change the compiler checks in every consumer.
 * </p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * TypedValue name   = TypedValue.of("O'Brien");             // 'O''Brien'
 * TypedValue salary = TypedValue.of(50000);                 // 50000
 * TypedValue since  = TypedValue.of(LocalDate.of(2024, 1, 31));
 * TypedValue roles  = TypedValue.list("ADMIN", "OWNER");    // ('ADMIN', 'OWNER')
 * TypedValue ages   = TypedValue.range(TypedValue.of(18), TypedValue.of(65));
 * TypedValue none   = TypedValue.none();                    // IS NULL / IS NOT NULL
 * }</pre>
 *
 * @since 1.0.0
 */
public sealed interface TypedValue permits TypedValue.StringValue, TypedValue.NumberValue,
        TypedValue.DateValue, TypedValue.BooleanValue, TypedValue.StringListValue,
        TypedValue.RangeValue, TypedValue.NoneValue {

    /**
     * Discriminator of the value kinds, used in operator compatibility tables and error reports.
     */
    enum Kind {
        STRING, NUMBER, DATE, BOOLEAN, STRING_LIST, RANGE, NONE;

        /**
         * @return {@code true} for kinds that can stand alone as a range bound
         */
        public boolean isScalar() {
            return this == STRING || this == NUMBER || this == DATE;
        }
    }

    /**
     * Exhaustive dispatch over the value kinds.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitString(StringValue value);

        R visitNumber(NumberValue value);

        R visitDate(DateValue value);

        R visitBoolean(BooleanValue value);

        R visitStringList(StringListValue value);

        R visitRange(RangeValue value);

        R visitNone(NoneValue value);
    }

    Kind kind();

    <R> R accept(Visitor<R> visitor);

    // ---------------------------------------------------------------- factories

    static TypedValue of(String text) {
        return new StringValue(text);
    }

    /**
     * Wraps a numeric value, keeping the textual form of the input: integral types stay
     * integral and decimals keep their scale. A {@code double} or {@code float} is written
     * with its shortest digits and at least one fractional digit ({@code 1.0e10 → 10000000000.0}).
     *
     * @param number the number, never {@code null}
     * @return the number value
     * @throws IllegalArgumentException if the number is NaN or infinite
     */
    static TypedValue of(Number number) {
        Objects.requireNonNull(number, "number cannot be null");
        if (number instanceof BigDecimal decimal) {
            return new NumberValue(decimal.toPlainString());
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Number value must be finite, got: " + number);
            }
            BigDecimal decimal = new BigDecimal(number.toString()).stripTrailingZeros();
            return new NumberValue(decimal.setScale(Math.max(decimal.scale(), 1)).toPlainString());
        }
        if (number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return new NumberValue(number.toString());
        }
        return new NumberValue(new BigDecimal(number.toString()).toPlainString());
    }

    static TypedValue of(LocalDate date) {
        return new DateValue(date);
    }

    static TypedValue of(boolean flag) {
        return new BooleanValue(flag);
    }

    static TypedValue list(String... elements) {
        Objects.requireNonNull(elements, "elements cannot be null");
        return new StringListValue(Arrays.asList(elements));
    }

    static TypedValue list(List<String> elements) {
        return new StringListValue(elements);
    }

    static TypedValue range(TypedValue lower, TypedValue upper) {
        return new RangeValue(lower, upper);
    }

    static TypedValue none() {
        return NoneValue.INSTANCE;
    }

    // ---------------------------------------------------------------- kinds

    record StringValue(String text) implements TypedValue {
        public StringValue {
            Objects.requireNonNull(text, "text cannot be null");
        }

        @Override
        public Kind kind() {
            return Kind.STRING;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitString(this);
        }
    }

    /**
     * Numeric literal held as its plain textual form, so no rounding happens between
     * construction and rendering.
     *
     * @param literal a text accepted by {@link BigDecimal#BigDecimal(String)}
     */
    record NumberValue(String literal) implements TypedValue {
        public NumberValue {
            Objects.requireNonNull(literal, "literal cannot be null");
            literal = literal.trim();
            try {
                new BigDecimal(literal);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a numeric literal: '" + literal + "'", e);
            }
        }

        @Override
        public Kind kind() {
            return Kind.NUMBER;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNumber(this);
        }
    }

    /**
     * Calendar date, restricted to years {@value #MIN_YEAR} to {@value #MAX_YEAR} so that it
     * always fits the fixed four-digit {@code yyyy-MM-dd} form.
     */
    record DateValue(LocalDate date) implements TypedValue {
        public static final int MIN_YEAR = 0;
        public static final int MAX_YEAR = 9999;

        public DateValue {
            Objects.requireNonNull(date, "date cannot be null");
            if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
                throw new IllegalArgumentException(String.format(
                        "Date year must be between %d and %d, got: %s", MIN_YEAR, MAX_YEAR, date));
            }
        }

        @Override
        public Kind kind() {
            return Kind.DATE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDate(this);
        }
    }

    record BooleanValue(boolean flag) implements TypedValue {
        @Override
        public Kind kind() {
            return Kind.BOOLEAN;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBoolean(this);
        }
    }

    /**
     * Operand of IN / NOT IN. Emptiness is allowed here and rejected at compilation,
     * where the offending field and operator are known.
     */
    record StringListValue(List<String> elements) implements TypedValue {
        public StringListValue {
            Objects.requireNonNull(elements, "elements cannot be null");
            for (String element : elements) {
                Objects.requireNonNull(element, "list elements cannot be null");
            }
            elements = List.copyOf(elements);
        }

        @Override
        public Kind kind() {
            return Kind.STRING_LIST;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStringList(this);
        }
    }

    record RangeValue(TypedValue lower, TypedValue upper) implements TypedValue {
        public RangeValue {
            Objects.requireNonNull(lower, "lower bound cannot be null");
            Objects.requireNonNull(upper, "upper bound cannot be null");
            if (!lower.kind().isScalar() || !upper.kind().isScalar()) {
                throw new IllegalArgumentException(String.format(
                        "Range bounds must be STRING, NUMBER or DATE values, got %s and %s",
                        lower.kind(), upper.kind()));
            }
        }

        @Override
        public Kind kind() {
            return Kind.RANGE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRange(this);
        }
    }

    /**
     * Absence of an operand, paired with IS NULL / IS NOT NULL.
     */
    record NoneValue() implements TypedValue {
        static final NoneValue INSTANCE = new NoneValue();

        @Override
        public Kind kind() {
            return Kind.NONE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNone(this);
        }
    }
}
