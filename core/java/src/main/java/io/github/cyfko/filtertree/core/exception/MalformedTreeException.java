package io.github.cyfko.filtertree.core.exception;

/**
 * Thrown when a node is structurally invalid: a non-root group without children, two
 * siblings sharing the same {@code sequence}, or a condition without a field.
 *
 * @since 1.0.0
 */
public class MalformedTreeException extends FilterCompilationException {

    private final String nodePath;

    /**
     * @param message  description of the structural problem
     * @param nodePath sequence path of the offending node, e.g. {@code root/2/0}
     */
    public MalformedTreeException(String message, String nodePath) {
        super(nodePath == null ? message : message + " (at " + nodePath + ")");
        this.nodePath = nodePath;
    }

    /**
     * @return sequence path of the offending node, or {@code null} when raised during node construction
     */
    public String nodePath() {
        return nodePath;
    }
}
