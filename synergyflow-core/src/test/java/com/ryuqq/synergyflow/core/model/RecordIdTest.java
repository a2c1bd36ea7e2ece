package com.ryuqq.synergyflow.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RecordId Value Object 테스트.
 *
 * @author SynergyFlow Team
 * @since 1.0.0
 */
class RecordIdTest {

    @Test
    void of_ValidValue_CreatesRecordId() {
        // When
        RecordId recordId = RecordId.of("synergy-123_a");

        // Then
        assertEquals("synergy-123_a", recordId.getValue());
    }

    @Test
    void of_PositiveLong_UsesDecimalString() {
        // When
        RecordId recordId = RecordId.of(123L);

        // Then
        assertEquals("123", recordId.getValue());
        assertEquals(RecordId.of("123"), recordId);
    }

    @Test
    void of_NonPositiveLong_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of(0L)
        );
        assertTrue(exception.getMessage().contains("must be positive"));
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of((String) null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> RecordId.of("  "));
    }

    @Test
    void of_ValueExceeds255Characters_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 255"));
    }

    @Test
    void of_InvalidCharacters_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> RecordId.of("synergy/42")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void equals_SameValue_AreEqual() {
        // Given
        RecordId a = RecordId.of("42");
        RecordId b = RecordId.of("42");

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, RecordId.of("43"));
    }
}
