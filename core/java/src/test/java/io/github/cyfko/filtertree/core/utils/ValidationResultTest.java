package io.github.cyfko.filtertree.core.utils;

import io.github.cyfko.filtertree.core.api.Operator;
import io.github.cyfko.filtertree.core.exception.EmptyListOperandException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValidationResultTest {

    @Test
    void testSuccess() {
        ValidationResult result = ValidationResult.success();

        assertTrue(result.isValid());
        assertNull(result.getError());
        assertNull(result.getErrorMessage());
        assertSame(result, ValidationResult.success());
        assertEquals("ValidationResult[valid=true]", result.toString());
    }

    @Test
    void testFailure() {
        EmptyListOperandException error = new EmptyListOperandException("role", Operator.IN);

        ValidationResult result = ValidationResult.failure(error);

        assertFalse(result.isValid());
        assertSame(error, result.getError());
        assertEquals(error.getMessage(), result.getErrorMessage());
        assertTrue(result.toString().contains("role"));
    }

    @Test
    void testFailureRequiresError() {
        assertThrows(NullPointerException.class, () -> ValidationResult.failure(null));
    }
}
