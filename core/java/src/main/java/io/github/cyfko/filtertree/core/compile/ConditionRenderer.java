package io.github.cyfko.filtertree.core.compile;

import io.github.cyfko.filtertree.core.api.Condition;
import io.github.cyfko.filtertree.core.api.Operator;
import io.github.cyfko.filtertree.core.config.ExpressionDialect;

import java.util.Objects;

/**
 * Renders a single {@link Condition} leaf as {@code field keyword [operand]}.
 * <p>
 * Negation is normalized so that at most one NOT keyword appears:
 * </p>
 * <pre>
 * IN / NOT_IN, LIKE / NOT_LIKE, IS_NULL / IS_NOT_NULL  → complementary keyword   (role NOT IN ('A'))
 * BETWEEN                                              → infix NOT               (age NOT BETWEEN 18 AND 65)
 * comparison operators (=, &lt;&gt;, &lt;, ...)                → leading NOT             (NOT salary &gt; 50000)
 * </pre>
 *
 * @since 1.0.0
 */
public final class ConditionRenderer {

    private final ExpressionDialect dialect;
    private final ValueFormatter formatter;

    public ConditionRenderer(ExpressionDialect dialect, ValueFormatter formatter) {
        this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter cannot be null");
    }

    public String render(Condition condition) {
        Operator operator = condition.operator();
        String operand = formatter.format(condition.value(), operator);

        boolean leadingNot = false;
        String keyword;
        if (!condition.negated()) {
            keyword = dialect.keyword(operator);
        } else if (operator.complement() != null) {
            keyword = dialect.keyword(operator.complement());
        } else if (operator == Operator.BETWEEN) {
            keyword = dialect.getNotKeyword() + " " + dialect.keyword(operator);
        } else {
            keyword = dialect.keyword(operator);
            leadingNot = true;
        }

        StringBuilder sb = new StringBuilder();
        if (leadingNot) sb.append(dialect.getNotKeyword()).append(' ');
        sb.append(condition.field()).append(' ').append(keyword);
        if (!operand.isEmpty()) sb.append(' ').append(operand);
        return sb.toString();
    }
}
