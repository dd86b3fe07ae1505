package io.github.cyfko.filtertree.core.api;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Internal node joining its direct children with one {@link LogicalOperator}.
 * <p>
 * Children are kept in the order they were given; {@link #orderedChildren()} returns them
 * sorted by sequence, which is the rendering order. Structural rules that span several
 * nodes (unique sibling sequences, no empty group below the root) are enforced by the
 * compiler's validation pass so they can be reported with the offending node's path.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * // department = 'HR' AND (salary > 50000 OR bonus > 1000)
 * Group root = Group.and(
 *     Condition.of("department", Operator.EQ, TypedValue.of("HR")),
 *     Group.or(
 *         Condition.of("salary", Operator.GT, TypedValue.of(50000)),
 *         Condition.of("bonus", Operator.GT, TypedValue.of(1000))));
 * }</pre>
 *
 * @param operator connector applied between all direct children
 * @param children direct children, in any order
 * @param sequence position among the siblings of this group
 * @since 1.0.0
 */
public record Group(LogicalOperator operator, List<FilterNode> children, int sequence) implements FilterNode {

    private static final Comparator<FilterNode> BY_SEQUENCE = Comparator.comparingInt(FilterNode::sequence);

    public Group {
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(children, "children cannot be null");
        children = List.copyOf(children);
    }

    public static Group of(LogicalOperator operator, List<? extends FilterNode> children, int sequence) {
        return new Group(operator, List.copyOf(children), sequence);
    }

    /**
     * Builds an {@code AND} group whose children are re-sequenced by argument position.
     */
    public static Group and(FilterNode... children) {
        return new Group(LogicalOperator.AND, sequenced(children), 0);
    }

    /**
     * Builds an {@code OR} group whose children are re-sequenced by argument position.
     */
    public static Group or(FilterNode... children) {
        return new Group(LogicalOperator.OR, sequenced(children), 0);
    }

    /**
     * @return an empty root group, which compiles to the dialect's "always true" literal
     */
    public static Group empty() {
        return new Group(LogicalOperator.AND, List.of(), 0);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * @return the children sorted by sequence; ties keep their given order
     */
    public List<FilterNode> orderedChildren() {
        List<FilterNode> ordered = new ArrayList<>(children);
        ordered.sort(BY_SEQUENCE);
        return ordered;
    }

    @Override
    public Group withSequence(int sequence) {
        return new Group(operator, children, sequence);
    }

    private static List<FilterNode> sequenced(FilterNode[] children) {
        Objects.requireNonNull(children, "children cannot be null");
        List<FilterNode> result = new ArrayList<>(children.length);
        for (int i = 0; i < children.length; i++) {
            result.add(Objects.requireNonNull(children[i], "child cannot be null").withSequence(i));
        }
        return result;
    }
}
