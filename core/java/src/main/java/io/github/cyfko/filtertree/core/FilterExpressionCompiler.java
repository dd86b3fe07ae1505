package io.github.cyfko.filtertree.core;

import io.github.cyfko.filtertree.core.api.Condition;
import io.github.cyfko.filtertree.core.api.FilterNode;
import io.github.cyfko.filtertree.core.api.Group;
import io.github.cyfko.filtertree.core.api.LogicalOperator;
import io.github.cyfko.filtertree.core.compile.ConditionRenderer;
import io.github.cyfko.filtertree.core.compile.TreeValidator;
import io.github.cyfko.filtertree.core.compile.ValueFormatter;
import io.github.cyfko.filtertree.core.config.CompilerPolicy;
import io.github.cyfko.filtertree.core.config.ExpressionDialect;
import io.github.cyfko.filtertree.core.exception.FilterCompilationException;
import io.github.cyfko.filtertree.core.utils.ValidationResult;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.logging.Logger;

/**
 * Compiles a filter tree into one boolean expression string, ready to follow a
 * conditional-clause keyword such as {@code WHERE}.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><strong>Validation</strong> ({@link TreeValidator}): the whole tree is checked first;
 *       an invalid tree is rejected with a {@link FilterCompilationException} subclass and no
 *       output is produced</li>
 *   <li><strong>Rendering</strong>: post-order walk, children in {@code sequence} order, each
 *       group joined by its own connector, leaves rendered by {@link ConditionRenderer}</li>
 * </ol>
 *
 * <h2>Parenthesization</h2>
 * <p>
 * A group with exactly one child is transparent and stands for that child. Once such groups
 * are collapsed, a child is parenthesized iff it is a group whose connector differs from its
 * parent's. Same-connector groups are flattened, conditions are never wrapped, and the root
 * is never wrapped. An empty root compiles to the dialect's "always true" literal.
 * </p>
 * <pre>{@code
 * Group root = Group.and(
 *     Condition.of("department", Operator.EQ, TypedValue.of("HR")),
 *     Group.or(
 *         Condition.of("salary", Operator.GT, TypedValue.of(50000)),
 *         Condition.of("SUBSTR(first_name, 1, 3)", Operator.EQ, TypedValue.of("Joh"))));
 *
 * new FilterExpressionCompiler().compile(root);
 * // department = 'HR' AND (salary > 50000 OR SUBSTR(first_name, 1, 3) = 'Joh')
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable. Each call only reads its input tree and allocates its own output,
 * so one compiler can serve concurrent callers.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterExpressionCompiler {

    private static final Logger log = Logger.getLogger(FilterExpressionCompiler.class.getName());

    private final ExpressionDialect dialect;
    private final CompilerPolicy policy;
    private final TreeValidator validator;
    private final ConditionRenderer renderer;

    /**
     * Creates a compiler using {@link ExpressionDialect#defaults()} and {@link CompilerPolicy#defaults()}.
     */
    public FilterExpressionCompiler() {
        this(ExpressionDialect.defaults(), CompilerPolicy.defaults());
    }

    public FilterExpressionCompiler(ExpressionDialect dialect, CompilerPolicy policy) {
        this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.validator = new TreeValidator(policy);
        this.renderer = rendererFor(dialect);
    }

    public ExpressionDialect getDialect() {
        return dialect;
    }

    public CompilerPolicy getPolicy() {
        return policy;
    }

    /**
     * Compiles {@code root} with this compiler's dialect.
     *
     * @param root root group of the filter tree
     * @return the boolean expression
     * @throws FilterCompilationException if the tree is invalid
     */
    public String compile(Group root) {
        return compile(root, dialect, renderer);
    }

    /**
     * Compiles {@code root} with an explicit dialect, keeping this compiler's policy.
     *
     * @param root    root group of the filter tree
     * @param dialect target dialect for this call
     * @return the boolean expression
     * @throws FilterCompilationException if the tree is invalid
     */
    public String compile(Group root, ExpressionDialect dialect) {
        Objects.requireNonNull(dialect, "dialect cannot be null");
        return compile(root, dialect, dialect == this.dialect ? renderer : rendererFor(dialect));
    }

    /**
     * Runs the validation pass only.
     *
     * @param root root group of the filter tree
     * @return success, or a failure carrying the exception {@link #compile(Group)} would throw
     */
    public ValidationResult validate(Group root) {
        try {
            validator.validate(root);
            return ValidationResult.success();
        } catch (FilterCompilationException e) {
            return ValidationResult.failure(e);
        }
    }

    private String compile(Group root, ExpressionDialect dialect, ConditionRenderer renderer) {
        Objects.requireNonNull(root, "root cannot be null");
        long start = System.nanoTime();

        int nodeCount = validateOrReject(root);

        FilterNode effective = collapse(root);
        String expression = (effective instanceof Group group && group.isEmpty())
                ? dialect.getAlwaysTrueLiteral()
                : render(effective, dialect, renderer);

        long micros = (System.nanoTime() - start) / 1_000;
        log.fine(() -> String.format("Compiled filter tree: nodes=%d, dialect=%s, policy=%s in %d us",
                nodeCount, dialect.getDialectName(), policy.policyName(), micros));
        return expression;
    }

    private int validateOrReject(Group root) {
        try {
            return validator.validate(root);
        } catch (FilterCompilationException e) {
            log.fine(() -> String.format("Rejected filter tree (%s): %s",
                    e.getClass().getSimpleName(), e.getMessage()));
            throw e;
        }
    }

    private static String render(FilterNode node, ExpressionDialect dialect, ConditionRenderer renderer) {
        if (node instanceof Condition condition) {
            return renderer.render(condition);
        }

        Group group = (Group) node;
        String connector = group.operator() == LogicalOperator.AND ? dialect.getAndKeyword() : dialect.getOrKeyword();
        StringJoiner joined = new StringJoiner(" " + connector + " ");
        for (FilterNode child : group.orderedChildren()) {
            FilterNode effective = collapse(child);
            String text = render(effective, dialect, renderer);
            if (effective instanceof Group nested && nested.operator() != group.operator()) {
                text = "(" + text + ")";
            }
            joined.add(text);
        }
        return joined.toString();
    }

    /**
     * Replaces single-child groups by their child, repeatedly.
     */
    private static FilterNode collapse(FilterNode node) {
        FilterNode current = node;
        while (current instanceof Group group && group.children().size() == 1) {
            current = group.children().get(0);
        }
        return current;
    }

    private static ConditionRenderer rendererFor(ExpressionDialect dialect) {
        return new ConditionRenderer(dialect, new ValueFormatter(dialect));
    }
}
