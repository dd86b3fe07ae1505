package io.github.cyfko.filtertree.core.api;

import io.github.cyfko.filtertree.core.value.TypedValue.Kind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Comparison operators a {@link Condition} can apply to its field.
 * <p>
 * Each operator carries its default keyword (the spelling a dialect starts from), its code
 * and the value kinds it accepts. Operators with a natural negated keyword form expose it
 * through {@link #complement()}, which lets a negated condition render as {@code NOT IN}
 * rather than {@code NOT field IN (...)}.
 * </p>
 *
 * <p><strong>Operator mappings:</strong></p>
 * <ul>
 *     <li>EQ / =</li>
 *     <li>NEQ / &lt;&gt;</li>
 *     <li>LT / &lt;</li>
 *     <li>LTE / &lt;=</li>
 *     <li>GT / &gt;</li>
 *     <li>GTE / &gt;=</li>
 *     <li>LIKE / LIKE</li>
 *     <li>NOT_LIKE / NOT LIKE</li>
 *     <li>IN / IN</li>
 *     <li>NOT_IN / NOT IN</li>
 *     <li>BETWEEN / BETWEEN</li>
 *     <li>IS_NULL / IS NULL</li>
 *     <li>IS_NOT_NULL / IS NOT NULL</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum Operator {

    /** Equality operator: "=" */
    EQ("=", EnumSet.of(Kind.STRING, Kind.NUMBER, Kind.DATE, Kind.BOOLEAN)),

    /** Not equal operator: "&lt;&gt;" */
    NEQ("<>", EnumSet.of(Kind.STRING, Kind.NUMBER, Kind.DATE, Kind.BOOLEAN)),

    /** Less than operator: "&lt;" */
    LT("<", EnumSet.of(Kind.STRING, Kind.NUMBER, Kind.DATE)),

    /** Less than or equal operator: "&lt;=" */
    LTE("<=", EnumSet.of(Kind.STRING, Kind.NUMBER, Kind.DATE)),

    /** Greater than operator: "&gt;" */
    GT(">", EnumSet.of(Kind.STRING, Kind.NUMBER, Kind.DATE)),

    /** Greater than or equal operator: "&gt;=" */
    GTE(">=", EnumSet.of(Kind.STRING, Kind.NUMBER, Kind.DATE)),

    /** Pattern matching operator: "LIKE" */
    LIKE("LIKE", EnumSet.of(Kind.STRING)),

    /** Negated pattern matching operator: "NOT LIKE" */
    NOT_LIKE("NOT LIKE", EnumSet.of(Kind.STRING)),

    /** Inclusion operator: "IN" */
    IN("IN", EnumSet.of(Kind.STRING_LIST)),

    /** Negated inclusion operator: "NOT IN" */
    NOT_IN("NOT IN", EnumSet.of(Kind.STRING_LIST)),

    /** Range operator: "BETWEEN" */
    BETWEEN("BETWEEN", EnumSet.of(Kind.RANGE)),

    /** Null check: "IS NULL" */
    IS_NULL("IS NULL", EnumSet.of(Kind.NONE)),

    /** Not-null check: "IS NOT NULL" */
    IS_NOT_NULL("IS NOT NULL", EnumSet.of(Kind.NONE));

    private final String symbol;
    private final Set<Kind> acceptedKinds;

    Operator(String symbol, Set<Kind> acceptedKinds) {
        this.symbol = symbol;
        this.acceptedKinds = Collections.unmodifiableSet(acceptedKinds);
    }

    /**
     * @return the default keyword, e.g. "=", "LIKE", "IS NOT NULL"
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return the code of this operator, identical to its constant name
     */
    public String getCode() {
        return name();
    }

    /**
     * @return the value kinds this operator can be paired with
     */
    public Set<Kind> acceptedKinds() {
        return acceptedKinds;
    }

    public boolean accepts(Kind kind) {
        return acceptedKinds.contains(kind);
    }

    /**
     * Returns the operator whose keyword is the natural negation of this one.
     * <p>
     * Only keyword operators have one ({@code IN}/{@code NOT IN}, {@code LIKE}/{@code NOT LIKE},
     * {@code IS NULL}/{@code IS NOT NULL}). Comparison operators and {@code BETWEEN} return
     * {@code null}.
     * </p>
     *
     * @return the complementary operator, or {@code null}
     */
    public Operator complement() {
        return switch (this) {
            case IN -> NOT_IN;
            case NOT_IN -> IN;
            case LIKE -> NOT_LIKE;
            case NOT_LIKE -> LIKE;
            case IS_NULL -> IS_NOT_NULL;
            case IS_NOT_NULL -> IS_NULL;
            default -> null;
        };
    }

    /**
     * Finds an {@code Operator} by its code or default symbol, ignoring case and surrounding
     * whitespace. Meant for collaborators mapping stored filter rows into the tree.
     *
     * @param value code (e.g. "NOT_IN") or symbol (e.g. "not in")
     * @return the matching operator
     * @throws NullPointerException     if {@code value} is {@code null}
     * @throws IllegalArgumentException if nothing matches
     */
    public static Operator fromString(String value) {
        String trimmed = value.trim();
        for (Operator op : values()) {
            if (op.name().equalsIgnoreCase(trimmed) || op.symbol.equalsIgnoreCase(trimmed)) return op;
        }
        if ("!=".equals(trimmed)) return NEQ;
        throw new IllegalArgumentException("Unknown operator: '" + value + "'");
    }
}
