package io.vfslite.shell.command;

import java.util.Arrays;
import java.util.Optional;

/**
 * Commands understood by the shell, with how each one consumes its arguments.
 */
public enum CommandType {
    CREATE("CREATE <filename>", Arity.FILE_ONLY),
    READ("READ <filename>", Arity.FILE_ONLY),
    INSERT("INSERT <filename> <content...>", Arity.FILE_AND_TEXT),
    UPDATE("UPDATE <filename> <content...>", Arity.FILE_AND_TEXT),
    SNAPSHOT("SNAPSHOT <filename> [message...]", Arity.FILE_AND_TEXT),
    ROLLBACK("ROLLBACK <filename> [version_id]", Arity.FILE_AND_NUMBER),
    HISTORY("HISTORY <filename>", Arity.FILE_ONLY),
    RECENT_FILES("RECENT_FILES [k]", Arity.NUMBER),
    BIGGEST_TREES("BIGGEST_TREES [k]", Arity.NUMBER),
    HELP("HELP", Arity.NONE),
    EXIT("EXIT", Arity.NONE);

    /** Argument shape of a command. */
    public enum Arity {
        /** No arguments. */
        NONE,
        /** Exactly a filename. */
        FILE_ONLY,
        /** Filename, then free-form trailing text (may be empty). */
        FILE_AND_TEXT,
        /** Filename, then an optional non-negative integer. */
        FILE_AND_NUMBER,
        /** An optional non-negative integer. */
        NUMBER
    }

    private final String usage;
    private final Arity arity;

    CommandType(String usage, Arity arity) {
        this.usage = usage;
        this.arity = arity;
    }

    public String usage() { return usage; }

    public Arity arity() { return arity; }

    /** Exact, case-sensitive lookup by command word. */
    public static Optional<CommandType> fromWord(String word) {
        return Arrays.stream(values())
                .filter(t -> t.name().equals(word))
                .findFirst();
    }
}
