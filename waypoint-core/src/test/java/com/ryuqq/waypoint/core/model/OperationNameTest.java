package com.ryuqq.waypoint.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OperationName Value Object 테스트.
 *
 * @author Waypoint Team
 * @since 1.0.0
 */
class OperationNameTest {

    @Test
    void of_ValidValue_CreatesOperationName() {
        // Given
        String value = "billing.charge:v2";

        // When
        OperationName name = OperationName.of(value);

        // Then
        assertEquals(value, name.getValue());
    }

    @Test
    void of_NullOrBlank_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OperationName.of(null));
        assertThrows(IllegalArgumentException.class, () -> OperationName.of("  "));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OperationName.of("fetch report")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OperationName.of("a".repeat(256)));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        assertEquals(OperationName.of("s1"), OperationName.of("s1"));
        assertEquals(OperationName.of("s1").hashCode(), OperationName.of("s1").hashCode());
        assertNotEquals(OperationName.of("s1"), OperationName.of("s2"));
    }
}
