package io.vfslite.storage;

import io.vfslite.core.ConflictException;
import io.vfslite.core.NotFoundException;
import io.vfslite.core.ValidationException;
import io.vfslite.core.VersionTree;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileRegistryTest {

    private final FileRegistry registry =
            new FileRegistry(Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    void create_then_lookup_returns_same_tree() {
        VersionTree created = registry.create("a.txt");

        assertSame(created, registry.lookup("a.txt"));
        assertEquals("", created.read());
        assertEquals(1, created.history().size());
        assertTrue(registry.contains("a.txt"));
    }

    @Test
    void duplicate_name_conflicts_and_keeps_original_tree() {
        VersionTree first = registry.create("a");
        first.insertContent("keep me");

        assertThrows(ConflictException.class, () -> registry.create("a"));
        assertEquals("keep me", registry.lookup("a").read());
        assertEquals(1, registry.size());
    }

    @Test
    void lookup_of_unknown_name_is_not_found() {
        var ex = assertThrows(NotFoundException.class, () -> registry.lookup("missing"));
        assertTrue(ex.getMessage().contains("missing"));
    }

    @Test
    void empty_name_is_a_validation_error_for_create_and_lookup() {
        assertThrows(ValidationException.class, () -> registry.create(""));
        assertThrows(ValidationException.class, () -> registry.lookup(""));
        assertThrows(ValidationException.class, () -> registry.create("two words"));
        assertEquals(0, registry.size());
    }

    @Test
    void names_keep_registration_order() {
        registry.create("b");
        registry.create("a");
        registry.create("c");

        assertEquals(List.of("b", "a", "c"), registry.names());
    }

    @Test
    void trees_are_independent() {
        registry.create("x").insertContent("1");
        registry.create("y");

        assertEquals("1", registry.lookup("x").read());
        assertEquals("", registry.lookup("y").read());
        assertEquals(2, registry.lookup("x").totalVersions());
        assertEquals(1, registry.lookup("y").totalVersions());
    }
}
