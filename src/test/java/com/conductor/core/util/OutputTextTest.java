package com.conductor.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputTextTest {

    @Test
    void shortTextIsUnchanged() {
        assertEquals("hello", OutputText.truncate("hello", 10));
        assertNull(OutputText.truncate(null, 10));
    }

    @Test
    void longTextKeepsHeadAndTail() {
        String text = "A".repeat(50) + "B".repeat(50);
        String result = OutputText.truncate(text, 20);

        assertTrue(result.startsWith("A".repeat(10)));
        assertTrue(result.endsWith("B".repeat(10)));
        assertTrue(result.contains("[truncated 80 chars]"));
    }

    @Test
    void previewFlattensAndShortens() {
        assertEquals("add login form...", OutputText.preview("add login\nform with validation", 14));
        assertEquals("short", OutputText.preview("short", 50));
        assertEquals("", OutputText.preview(null, 50));
    }
}
