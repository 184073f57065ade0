package com.example.sclanalyzer.service.extraction;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SclSourceCleanerTest {

    private final SclSourceCleaner cleaner = new SclSourceCleaner();

    @Test
    void shouldRemoveAllCommentStyles() {
        // Given
        String code = """
                Motor := Start; // liga o motor
                (* bloco
                   de comentário IF *)
                { pragma } Lamp := TRUE;
                """;

        // When
        String cleaned = cleaner.clean(code);

        // Then
        assertFalse(cleaned.contains("liga"));
        assertFalse(cleaned.contains("IF"));
        assertFalse(cleaned.contains("pragma"));
        assertTrue(cleaned.contains("Motor := Start;"));
        assertTrue(cleaned.contains("Lamp := TRUE;"));
    }

    @Test
    void shouldEmptyStringLiteralsButKeepQuotedTags() {
        // When
        String cleaned = cleaner.clean("\"Message\" := 'IF alarm THEN';");

        // Then
        assertEquals("\"Message\" := '';", cleaned);
    }

    @Test
    void shouldHandleEmptyInput() {
        assertEquals("", cleaner.clean(null));
        assertEquals("", cleaner.clean(""));
    }
}
