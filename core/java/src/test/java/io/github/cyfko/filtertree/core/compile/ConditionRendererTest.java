package io.github.cyfko.filtertree.core.compile;

import io.github.cyfko.filtertree.core.api.Condition;
import io.github.cyfko.filtertree.core.api.Operator;
import io.github.cyfko.filtertree.core.config.ExpressionDialect;
import io.github.cyfko.filtertree.core.value.TypedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConditionRenderer Tests")
class ConditionRendererTest {

    private final ExpressionDialect dialect = ExpressionDialect.defaults();
    private final ConditionRenderer renderer = new ConditionRenderer(dialect, new ValueFormatter(dialect));

    private static TypedValue sample(Operator operator) {
        return switch (operator) {
            case LIKE, NOT_LIKE -> TypedValue.of("Jo%");
            case IN, NOT_IN -> TypedValue.list("A", "B");
            case BETWEEN -> TypedValue.range(TypedValue.of(1), TypedValue.of(9));
            case IS_NULL, IS_NOT_NULL -> TypedValue.none();
            default -> TypedValue.of(5);
        };
    }

    @ParameterizedTest(name = "{0}: {1} / {2}")
    @CsvSource(delimiter = '|', value = {
            "EQ          | f = 5                   | NOT f = 5",
            "NEQ         | f <> 5                  | NOT f <> 5",
            "LT          | f < 5                   | NOT f < 5",
            "LTE         | f <= 5                  | NOT f <= 5",
            "GT          | f > 5                   | NOT f > 5",
            "GTE         | f >= 5                  | NOT f >= 5",
            "LIKE        | f LIKE 'Jo%'            | f NOT LIKE 'Jo%'",
            "NOT_LIKE    | f NOT LIKE 'Jo%'        | f LIKE 'Jo%'",
            "IN          | f IN ('A', 'B')         | f NOT IN ('A', 'B')",
            "NOT_IN      | f NOT IN ('A', 'B')     | f IN ('A', 'B')",
            "BETWEEN     | f BETWEEN 1 AND 9       | f NOT BETWEEN 1 AND 9",
            "IS_NULL     | f IS NULL               | f IS NOT NULL",
            "IS_NOT_NULL | f IS NOT NULL           | f IS NULL"
    })
    @DisplayName("Should render plain and negated forms with a single NOT at most")
    void shouldRenderPlainAndNegated(Operator operator, String plain, String negated) {
        Condition condition = Condition.of("f", operator, sample(operator));

        assertEquals(plain, renderer.render(condition));
        assertEquals(negated, renderer.render(condition.negate()));
    }

    @Test
    @DisplayName("Should never stack two NOT keywords")
    void shouldNeverStackNot() {
        for (Operator operator : Operator.values()) {
            String text = renderer.render(Condition.of("f", operator, sample(operator)).negate());
            assertFalse(text.contains("NOT NOT"), text);
            assertFalse(text.startsWith("NOT ("), text);
        }
    }

    @Test
    @DisplayName("Should emit the field text verbatim")
    void shouldEmitFieldVerbatim() {
        Condition condition = Condition.of("SUBSTR(first_name, 1, 3)", Operator.EQ, TypedValue.of("Joh"));

        assertEquals("SUBSTR(first_name, 1, 3) = 'Joh'", renderer.render(condition));
    }

    @Test
    @DisplayName("Should use dialect keyword overrides")
    void shouldUseDialectKeywords() {
        ExpressionDialect custom = ExpressionDialect.builder()
                .keyword(Operator.NEQ, "!=")
                .keyword(Operator.LIKE, "ILIKE")
                .keyword(Operator.NOT_LIKE, "NOT ILIKE")
                .build();
        ConditionRenderer customRenderer = new ConditionRenderer(custom, new ValueFormatter(custom));

        assertEquals("f != 'x'", customRenderer.render(Condition.of("f", Operator.NEQ, TypedValue.of("x"))));
        assertEquals("f NOT ILIKE 'a%'", customRenderer.render(Condition.of("f", Operator.LIKE, TypedValue.of("a%")).negate()));
    }
}
