package io.github.cyfko.filtertree.core.utils;

import io.github.cyfko.filtertree.core.exception.FilterCompilationException;

/**
 * Class representing the result of validating a filter tree.
 * <p>
 * The result either indicates success or carries the typed exception that compiling the
 * tree would have thrown, so callers can branch on the error kind without a try/catch.
 * </p>
 *
 * <p>Instances are immutable and created via the static methods
 * {@link #success()} and {@link #failure(FilterCompilationException)}.</p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ValidationResult result = compiler.validate(root);
 * if (!result.isValid()) {
 *     System.out.println("Validation error: " + result.getErrorMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(null);

    private final FilterCompilationException error;

    private ValidationResult(FilterCompilationException error) {
        this.error = error;
    }

    /**
     * @return a valid result with no error
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param error the exception describing why the tree was rejected
     * @return an invalid result carrying {@code error}
     */
    public static ValidationResult failure(FilterCompilationException error) {
        if (error == null) throw new NullPointerException("error cannot be null");
        return new ValidationResult(error);
    }

    public boolean isValid() {
        return error == null;
    }

    /**
     * @return the rejection cause, or null if valid
     */
    public FilterCompilationException getError() {
        return error;
    }

    /**
     * @return error message if invalid, or null if valid
     */
    public String getErrorMessage() {
        return error == null ? null : error.getMessage();
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, error=" + error.getMessage() + "]";
    }
}
