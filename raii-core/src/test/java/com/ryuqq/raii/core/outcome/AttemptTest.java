package com.ryuqq.raii.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Attempt 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class AttemptTest {

    @Test
    void succeeded_CreatesSucceeded() {
        // When
        Attempt<Throwable, String> attempt = Attempt.succeeded("value");

        // Then
        assertTrue(attempt.isSucceeded());
        assertFalse(attempt.isFailed());
        assertEquals(new Succeeded<Throwable, String>("value"), attempt);
    }

    @Test
    void succeeded_NullValue_Allowed() {
        // When
        Attempt<Throwable, String> attempt = Attempt.succeeded(null);

        // Then
        assertTrue(attempt.isSucceeded());
        assertNull(attempt.fold(error -> "failed", value -> value));
    }

    @Test
    void failed_CreatesFailed() {
        // Given
        IllegalStateException error = new IllegalStateException("boom");

        // When
        Attempt<Throwable, String> attempt = Attempt.failed(error);

        // Then
        assertTrue(attempt.isFailed());
        assertSame(error, ((Failed<Throwable, String>) attempt).error());
    }

    @Test
    void failed_NullError_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Attempt.failed(null)
        );
        assertTrue(exception.getMessage().contains("error cannot be null"));
    }

    @Test
    void fold_Succeeded_AppliesSuccessBranch() {
        // Given
        Attempt<String, Integer> attempt = Attempt.succeeded(20);

        // When
        String result = attempt.fold(error -> "error:" + error, value -> "value:" + (value + 22));

        // Then
        assertEquals("value:42", result);
    }

    @Test
    void fold_Failed_AppliesFailureBranch() {
        // Given
        Attempt<String, Integer> attempt = Attempt.failed("E-001");

        // When
        String result = attempt.fold(error -> "error:" + error, value -> "value:" + value);

        // Then
        assertEquals("error:E-001", result);
    }
}
