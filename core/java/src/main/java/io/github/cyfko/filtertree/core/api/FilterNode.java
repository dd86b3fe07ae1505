package io.github.cyfko.filtertree.core.api;

/**
 * A node of a filter tree: either a {@link Group} of nodes or a {@link Condition} leaf.
 * <p>
 * Nodes are immutable. Their {@link #sequence()} orders them among their siblings and is
 * the only ordering the compiler honours; the order in which a storage layer returned the
 * rows has no effect on the output.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations are records whose collections are copied on construction, so a tree can be shared
 * between threads and compiled concurrently.
 * </p>
 *
 * @see Group
 * @see Condition
 * @since 1.0.0
 */
public sealed interface FilterNode permits Group, Condition {

    /**
     * @return position of this node among its siblings
     */
    int sequence();

    /**
     * Returns a copy of this node positioned at another sequence.
     *
     * @param sequence the new sequence
     * @return a new node, identical apart from its sequence
     */
    FilterNode withSequence(int sequence);
}
