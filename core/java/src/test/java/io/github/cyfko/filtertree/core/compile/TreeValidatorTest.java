package io.github.cyfko.filtertree.core.compile;

import io.github.cyfko.filtertree.core.api.Condition;
import io.github.cyfko.filtertree.core.api.FilterNode;
import io.github.cyfko.filtertree.core.api.Group;
import io.github.cyfko.filtertree.core.api.LogicalOperator;
import io.github.cyfko.filtertree.core.api.Operator;
import io.github.cyfko.filtertree.core.config.CompilerPolicy;
import io.github.cyfko.filtertree.core.exception.EmptyListOperandException;
import io.github.cyfko.filtertree.core.exception.MalformedTreeException;
import io.github.cyfko.filtertree.core.exception.TreeTooDeepException;
import io.github.cyfko.filtertree.core.value.TypedValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TreeValidator}: depth bound, structural errors, operand checks and the
 * order in which violations are reported.
 */
@DisplayName("TreeValidator Tests")
class TreeValidatorTest {

    private final TreeValidator validator = new TreeValidator(CompilerPolicy.defaults());

    private static Condition leaf(String name) {
        return Condition.of(name, Operator.EQ, TypedValue.of(1));
    }

    private static Group chain(int groups) {
        FilterNode node = leaf("x");
        for (int i = 1; i < groups; i++) {
            node = Group.or(node);
        }
        return node instanceof Group g ? g : Group.and(node);
    }

    @Test
    @DisplayName("Should count every node of a valid tree")
    void shouldCountNodes() {
        Group root = Group.and(leaf("a"), Group.or(leaf("b"), leaf("c")));

        assertEquals(5, validator.validate(root));
        assertEquals(1, validator.validate(Group.empty()));
    }

    @Test
    @DisplayName("Should accept a tree exactly at the depth limit")
    void shouldAcceptTreeAtLimit() {
        TreeValidator limited = new TreeValidator(CompilerPolicy.builder().maxDepth(4).build());

        // 3 groups + leaf = depth 4
        assertDoesNotThrow(() -> limited.validate(chain(4)));
        TreeTooDeepException e = assertThrows(TreeTooDeepException.class, () -> limited.validate(chain(5)));
        assertEquals(4, e.maxDepth());
        assertEquals("root/0/0/0/0", e.nodePath());
    }

    @Test
    @DisplayName("Should reject a 65-level tree under the default policy")
    void shouldRejectBeyondDefaultDepth() {
        assertDoesNotThrow(() -> validator.validate(chain(64)));
        assertThrows(TreeTooDeepException.class, () -> validator.validate(chain(65)));
    }

    @Test
    @DisplayName("Should reject an empty group at any depth below the root")
    void shouldRejectNestedEmptyGroup() {
        Group root = Group.or(leaf("a"), Group.and(leaf("b"), Group.empty()));

        MalformedTreeException e = assertThrows(MalformedTreeException.class, () -> validator.validate(root));
        assertEquals("root/1/1", e.nodePath());
        assertTrue(e.getMessage().contains("root/1/1"));
    }

    @Test
    @DisplayName("Should reject duplicate sequences among siblings only")
    void shouldRejectDuplicateSiblingSequences() {
        Group duplicates = Group.of(LogicalOperator.AND, List.of(leaf("a").withSequence(2), leaf("b").withSequence(2)), 0);
        assertThrows(MalformedTreeException.class, () -> validator.validate(duplicates));

        // equal sequences in different parents are fine
        Group cousins = Group.and(Group.or(leaf("a"), leaf("b")), Group.or(leaf("c"), leaf("d")));
        assertDoesNotThrow(() -> validator.validate(cousins));
    }

    @Test
    @DisplayName("Should report the empty list with its field")
    void shouldRejectEmptyInList() {
        Group root = Group.and(Condition.of("status", Operator.NOT_IN, TypedValue.list(List.of())));

        EmptyListOperandException e = assertThrows(EmptyListOperandException.class, () -> validator.validate(root));
        assertEquals("status", e.field());
        assertEquals(Operator.NOT_IN, e.operator());
    }

    @Test
    @DisplayName("Should report the first violation in sequence order")
    void shouldReportFirstViolationInSequenceOrder() {
        Group root = Group.of(LogicalOperator.OR, List.of(
                Group.empty().withSequence(9),
                Condition.of("status", Operator.IN, TypedValue.list(List.of())).withSequence(1)), 0);

        assertThrows(EmptyListOperandException.class, () -> validator.validate(root));
    }
}
