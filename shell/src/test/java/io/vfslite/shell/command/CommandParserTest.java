package io.vfslite.shell.command;

import io.vfslite.core.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class CommandParserTest {

    private static Command parse(String line) {
        return CommandParser.parse(line).orElseThrow();
    }

    @Test
    void blank_lines_are_skipped() {
        assertTrue(CommandParser.parse("").isEmpty());
        assertTrue(CommandParser.parse("   \t ").isEmpty());
        assertTrue(CommandParser.parse(null).isEmpty());
    }

    @Test
    void trailing_text_keeps_inner_whitespace_verbatim() {
        Command cmd = parse("INSERT notes   hello   big\tworld ");

        assertEquals(CommandType.INSERT, cmd.type());
        assertEquals("notes", cmd.filename());
        assertEquals("hello   big\tworld ", cmd.text());
    }

    @Test
    void missing_trailing_text_is_empty_string() {
        assertEquals("", parse("UPDATE notes").text());
        assertEquals("", parse("SNAPSHOT notes   ").text());
    }

    @Test
    void snapshot_message_may_contain_spaces() {
        Command cmd = parse("SNAPSHOT f first draft, v1");
        assertEquals("first draft, v1", cmd.text());
    }

    @Test
    void file_only_commands_reject_extra_arguments() {
        assertEquals("a", parse("READ a").filename());
        assertThrows(ValidationException.class, () -> CommandParser.parse("CREATE a b"));
        assertThrows(ValidationException.class, () -> CommandParser.parse("HISTORY"));
    }

    @Test
    void rollback_takes_an_optional_non_negative_id() {
        assertEquals(OptionalInt.empty(), parse("ROLLBACK f").number());
        assertEquals(OptionalInt.of(3), parse("ROLLBACK f 3").number());

        assertThrows(ValidationException.class, () -> CommandParser.parse("ROLLBACK f -1"));
        assertThrows(ValidationException.class, () -> CommandParser.parse("ROLLBACK f abc"));
        assertThrows(ValidationException.class, () -> CommandParser.parse("ROLLBACK f 1 2"));
        assertThrows(ValidationException.class, () -> CommandParser.parse("ROLLBACK"));
    }

    @Test
    void top_k_commands_take_an_optional_count() {
        Command all = parse("RECENT_FILES");
        assertNull(all.filename());
        assertEquals(OptionalInt.empty(), all.number());

        assertEquals(OptionalInt.of(2), parse("BIGGEST_TREES 2").number());
        assertEquals(OptionalInt.of(0), parse("RECENT_FILES 0").number());

        assertThrows(ValidationException.class, () -> CommandParser.parse("RECENT_FILES two"));
        assertThrows(ValidationException.class, () -> CommandParser.parse("RECENT_FILES -3"));
        assertThrows(ValidationException.class, () -> CommandParser.parse("BIGGEST_TREES 1 2"));
    }

    @Test
    void oversized_numbers_saturate_instead_of_failing_validation() {
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), parse("BIGGEST_TREES 99999999999").number());
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), parse("ROLLBACK a 99999999999").number());
        assertEquals(Integer.MAX_VALUE, CommandParser.parseNonNegativeInt("2147483648", "k"));
        assertEquals(2147483647, CommandParser.parseNonNegativeInt("2147483647", "k"));
    }

    @Test
    void unknown_and_lowercase_commands_are_rejected() {
        var ex = assertThrows(ValidationException.class, () -> CommandParser.parse("DELETE a"));
        assertEquals("Unknown command: DELETE", ex.getMessage());
        assertThrows(ValidationException.class, () -> CommandParser.parse("create a"));
    }

    @Test
    void help_and_exit_take_no_arguments() {
        assertEquals(CommandType.HELP, parse("HELP").type());
        assertEquals(CommandType.EXIT, parse("  EXIT  ").type());
        assertThrows(ValidationException.class, () -> CommandParser.parse("EXIT now"));
    }

    @Test
    void parse_non_negative_int() {
        assertEquals(42, CommandParser.parseNonNegativeInt("42", "k"));
        assertThrows(ValidationException.class, () -> CommandParser.parseNonNegativeInt("+1", "k"));
        assertThrows(ValidationException.class, () -> CommandParser.parseNonNegativeInt("", "k"));
    }
}
