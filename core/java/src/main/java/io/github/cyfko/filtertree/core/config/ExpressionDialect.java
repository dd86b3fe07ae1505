package io.github.cyfko.filtertree.core.config;

import io.github.cyfko.filtertree.core.api.Operator;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Textual conventions of the expression language a filter tree is compiled into.
 * <p>
 * A dialect fixes the spelling of the boolean connectives and comparison keywords, and the
 * literal policy (string quote, boolean pair, "always true" literal, date construction form).
 * It is passed to the compiler explicitly, so the same tree compiles deterministically
 * against several targets within one process.
 * </p>
 *
 * <h2>Presets</h2>
 * <ul>
 *   <li>{@link #defaults()}: {@code TO_DATE('2024-01-31', 'YYYY-MM-DD')}, booleans as {@code 1}/{@code 0}, empty filter {@code 1=1}</li>
 *   <li>{@link #ansi()}: {@code DATE '2024-01-31'}, booleans as {@code TRUE}/{@code FALSE}, empty filter {@code 1=1}</li>
 * </ul>
 *
 * <pre>{@code
 * ExpressionDialect dialect = ExpressionDialect.builder()
 *     .dialectName("postgres")
 *     .booleanLiterals("TRUE", "FALSE")
 *     .dateTemplate("CAST('{date}' AS DATE)")
 *     .keyword(Operator.NEQ, "!=")
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ExpressionDialect {

    /** Placeholder replaced by the ISO {@code yyyy-MM-dd} text in {@link #getDateTemplate()}. */
    public static final String DATE_PLACEHOLDER = "{date}";

    private final String dialectName;
    private final String andKeyword;
    private final String orKeyword;
    private final String notKeyword;
    private final Map<Operator, String> keywords;
    private final char quoteChar;
    private final String trueLiteral;
    private final String falseLiteral;
    private final String alwaysTrueLiteral;
    private final String dateTemplate;

    private ExpressionDialect(Builder builder) {
        this.dialectName = builder.dialectName;
        this.andKeyword = builder.andKeyword;
        this.orKeyword = builder.orKeyword;
        this.notKeyword = builder.notKeyword;
        this.keywords = Collections.unmodifiableMap(new EnumMap<>(builder.keywords));
        this.quoteChar = builder.quoteChar;
        this.trueLiteral = builder.trueLiteral;
        this.falseLiteral = builder.falseLiteral;
        this.alwaysTrueLiteral = builder.alwaysTrueLiteral;
        this.dateTemplate = builder.dateTemplate;
    }

    public static ExpressionDialect defaults() {
        return builder().build();
    }

    public static ExpressionDialect ansi() {
        return builder()
                .dialectName("ANSI")
                .booleanLiterals("TRUE", "FALSE")
                .dateTemplate("DATE '" + DATE_PLACEHOLDER + "'")
                .build();
    }

    public static Builder builder() { return new Builder(); }

    public String getDialectName() { return dialectName; }
    public String getAndKeyword() { return andKeyword; }
    public String getOrKeyword() { return orKeyword; }
    public String getNotKeyword() { return notKeyword; }
    public char getQuoteChar() { return quoteChar; }
    public String getTrueLiteral() { return trueLiteral; }
    public String getFalseLiteral() { return falseLiteral; }
    public String getAlwaysTrueLiteral() { return alwaysTrueLiteral; }
    public String getDateTemplate() { return dateTemplate; }

    /**
     * @param operator a comparison operator
     * @return its spelling in this dialect
     */
    public String keyword(Operator operator) {
        return keywords.get(Objects.requireNonNull(operator, "operator"));
    }

    @Override
    public String toString() {
        return "ExpressionDialect[" + dialectName + "]";
    }

    /**
     * Builder for {@link ExpressionDialect}. Unset knobs keep the values of {@link #defaults()}.
     */
    public static final class Builder {
        private String dialectName = "DEFAULT";
        private String andKeyword = "AND";
        private String orKeyword = "OR";
        private String notKeyword = "NOT";
        private final Map<Operator, String> keywords = new EnumMap<>(Operator.class);
        private char quoteChar = '\'';
        private String trueLiteral = "1";
        private String falseLiteral = "0";
        private String alwaysTrueLiteral = "1=1";
        private String dateTemplate = "TO_DATE('" + DATE_PLACEHOLDER + "', 'YYYY-MM-DD')";

        private Builder() {
            for (Operator op : Operator.values()) {
                keywords.put(op, op.getSymbol());
            }
        }

        public Builder dialectName(String name) {
            this.dialectName = requireText(name, "dialectName");
            return this;
        }

        public Builder andKeyword(String keyword) {
            this.andKeyword = requireText(keyword, "andKeyword");
            return this;
        }

        public Builder orKeyword(String keyword) {
            this.orKeyword = requireText(keyword, "orKeyword");
            return this;
        }

        public Builder notKeyword(String keyword) {
            this.notKeyword = requireText(keyword, "notKeyword");
            return this;
        }

        public Builder keyword(Operator operator, String keyword) {
            keywords.put(Objects.requireNonNull(operator, "operator"), requireText(keyword, "keyword"));
            return this;
        }

        public Builder quoteChar(char quoteChar) {
            this.quoteChar = quoteChar;
            return this;
        }

        public Builder booleanLiterals(String trueLiteral, String falseLiteral) {
            this.trueLiteral = requireText(trueLiteral, "trueLiteral");
            this.falseLiteral = requireText(falseLiteral, "falseLiteral");
            return this;
        }

        public Builder alwaysTrueLiteral(String literal) {
            this.alwaysTrueLiteral = requireText(literal, "alwaysTrueLiteral");
            return this;
        }

        /**
         * @param template date construction form containing {@code {date}} exactly once
         * @throws IllegalArgumentException if the placeholder is missing or repeated
         */
        public Builder dateTemplate(String template) {
            requireText(template, "dateTemplate");
            int first = template.indexOf(DATE_PLACEHOLDER);
            if (first < 0 || template.indexOf(DATE_PLACEHOLDER, first + 1) >= 0) {
                throw new IllegalArgumentException(
                        "dateTemplate must contain " + DATE_PLACEHOLDER + " exactly once, got: " + template);
            }
            this.dateTemplate = template;
            return this;
        }

        public ExpressionDialect build() { return new ExpressionDialect(this); }

        private static String requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " is required");
            }
            return value;
        }
    }
}
