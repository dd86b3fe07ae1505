package io.github.cyfko.filtertree.core.exception;

/**
 * Base type of every error raised while validating or compiling a filter tree.
 * <p>
 * Compilation never returns partial output: a tree is either rejected with one of the
 * subclasses below, or compiled in full. Each subclass maps to a different fix on the side
 * of whoever built the tree, so callers are expected to catch the specific type:
 * </p>
 * <ul>
 *   <li>{@link MalformedTreeException} - empty non-root group, duplicate sibling sequence, blank field</li>
 *   <li>{@link UnsupportedOperatorException} - operator paired with an incompatible value kind</li>
 *   <li>{@link EmptyListOperandException} - IN / NOT IN with no elements</li>
 *   <li>{@link TreeTooDeepException} - nesting beyond the configured maximum depth</li>
 * </ul>
 *
 * <p><strong>Handling example:</strong></p>
 * <pre>{@code
 * try {
 *     String where = compiler.compile(root);
 * } catch (EmptyListOperandException e) {
 *     // drop the condition or reject the request: IN () has no portable meaning
 *     logger.warn("Empty IN list on field {}", e.field());
 * } catch (FilterCompilationException e) {
 *     return ResponseEntity.badRequest().body("Invalid filter: " + e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public abstract class FilterCompilationException extends RuntimeException {

    protected FilterCompilationException(String message) {
        super(message);
    }
}
