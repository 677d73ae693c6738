package io.vfslite.shell.command;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * One parsed input line.
 *
 * @param type     command word
 * @param filename target file, or null for commands that take none
 * @param text     trailing free-form text for INSERT/UPDATE/SNAPSHOT; empty otherwise
 * @param number   optional numeric argument (ROLLBACK version id, top-k count)
 */
public record Command(CommandType type, String filename, String text, OptionalInt number) {
    public Command {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(number, "number");
    }

    static Command of(CommandType type) {
        return new Command(type, null, "", OptionalInt.empty());
    }
}
