package io.github.cyfko.filtertree.core.exception;

import io.github.cyfko.filtertree.core.config.CompilerPolicy;

/**
 * Thrown when a tree nests deeper than {@link CompilerPolicy#maxDepth()}. The bound keeps
 * rendering recursion away from stack exhaustion on pathological input.
 *
 * @since 1.0.0
 */
public class TreeTooDeepException extends FilterCompilationException {

    private final int maxDepth;
    private final String nodePath;

    public TreeTooDeepException(int maxDepth, String nodePath) {
        super(String.format("Filter tree exceeds maximum depth %d (at %s)", maxDepth, nodePath));
        this.maxDepth = maxDepth;
        this.nodePath = nodePath;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * @return sequence path of the first node found beyond the limit
     */
    public String nodePath() {
        return nodePath;
    }
}
