package io.github.cyfko.filtertree.core.compile;

import io.github.cyfko.filtertree.core.api.Condition;
import io.github.cyfko.filtertree.core.api.FilterNode;
import io.github.cyfko.filtertree.core.api.Group;
import io.github.cyfko.filtertree.core.api.Operator;
import io.github.cyfko.filtertree.core.config.CompilerPolicy;
import io.github.cyfko.filtertree.core.exception.EmptyListOperandException;
import io.github.cyfko.filtertree.core.exception.MalformedTreeException;
import io.github.cyfko.filtertree.core.exception.TreeTooDeepException;
import io.github.cyfko.filtertree.core.exception.UnsupportedOperatorException;
import io.github.cyfko.filtertree.core.value.TypedValue;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Structural validation pass run before any rendering.
 * <p>
 * Walks the tree pre-order, children in sequence order, and stops at the first violation:
 * </p>
 * <ol>
 *   <li>node deeper than {@link CompilerPolicy#maxDepth()} → {@link TreeTooDeepException}</li>
 *   <li>group below the root without children → {@link MalformedTreeException}</li>
 *   <li>two siblings with the same sequence → {@link MalformedTreeException}</li>
 *   <li>operator / value kind mismatch → {@link UnsupportedOperatorException}</li>
 *   <li>IN / NOT IN on an empty list → {@link EmptyListOperandException}</li>
 * </ol>
 * <p>
 * The depth check happens before a node's children are visited, so the walk itself never
 * recurses further than the policy allows.
 * </p>
 *
 * @since 1.0.0
 */
public final class TreeValidator {

    private static final String ROOT_PATH = "root";

    private final CompilerPolicy policy;

    public TreeValidator(CompilerPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    /**
     * Validates the tree rooted at {@code root}.
     *
     * @param root the root group; it alone may have no children
     * @return number of nodes in the tree, root included
     * @throws io.github.cyfko.filtertree.core.exception.FilterCompilationException on the first violation found
     */
    public int validate(Group root) {
        Objects.requireNonNull(root, "root cannot be null");
        return visit(root, 1, ROOT_PATH, true);
    }

    private int visit(FilterNode node, int depth, String path, boolean isRoot) {
        if (depth > policy.maxDepth()) {
            throw new TreeTooDeepException(policy.maxDepth(), path);
        }

        if (node instanceof Condition condition) {
            checkCondition(condition);
            return 1;
        }

        Group group = (Group) node;
        if (group.isEmpty()) {
            if (isRoot) return 1;
            throw new MalformedTreeException("Group has no children and is not the root", path);
        }

        Set<Integer> sequences = new HashSet<>();
        for (FilterNode child : group.children()) {
            if (!sequences.add(child.sequence())) {
                throw new MalformedTreeException(
                        "Duplicate sequence " + child.sequence() + " among children of " + group.operator() + " group",
                        path);
            }
        }

        int count = 1;
        for (FilterNode child : group.orderedChildren()) {
            count += visit(child, depth + 1, path + "/" + child.sequence(), false);
        }
        return count;
    }

    private void checkCondition(Condition condition) {
        Operator operator = condition.operator();
        TypedValue value = condition.value();
        if (!operator.accepts(value.kind())) {
            throw new UnsupportedOperatorException(operator, value.kind());
        }
        if (value instanceof TypedValue.StringListValue list && list.elements().isEmpty()) {
            throw new EmptyListOperandException(condition.field(), operator);
        }
    }
}
