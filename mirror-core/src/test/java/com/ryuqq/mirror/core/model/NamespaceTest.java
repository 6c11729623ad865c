package com.ryuqq.mirror.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Namespace 테스트.
 *
 * @author Mirror Team
 * @since 1.0.0
 */
class NamespaceTest {

    @Test
    void parse_SplitsAtFirstDot() {
        // When
        Namespace ns = Namespace.parse("test.system.js");

        // Then
        assertEquals("test", ns.database());
        assertEquals("system.js", ns.collection());
        assertEquals("test.system.js", ns.fullName());
    }

    @Test
    void parse_DatabaseOnly_HasEmptyCollection() {
        // When
        Namespace ns = Namespace.parse("admin");

        // Then
        assertEquals("admin", ns.database());
        assertEquals("", ns.collection());
    }

    @Test
    void command_BuildsCommandNamespace() {
        // When
        Namespace ns = Namespace.command("admin");

        // Then
        assertTrue(ns.isCommand());
        assertEquals("admin.$cmd", ns.toString());
    }

    @Test
    void sibling_KeepsDatabase() {
        assertEquals("test.bar", Namespace.parse("test.foo").sibling("bar").fullName());
    }

    @Test
    void parse_NullOrEmpty_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Namespace.parse(null));
        assertThrows(IllegalArgumentException.class, () -> Namespace.parse(""));
    }
}
