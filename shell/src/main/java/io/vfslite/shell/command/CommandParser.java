package io.vfslite.shell.command;

import io.vfslite.core.FileNames;
import io.vfslite.core.ValidationException;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Turns one input line into a {@link Command}.
 * <p>
 * Tokenization:
 *  - Leading whitespace is skipped.
 *  - Token 1 is the command word, token 2 the filename (or the k of a top-k query).
 *  - Everything after the whitespace run that follows token 2 is kept
 *    verbatim as the trailing text, inner and trailing whitespace included.
 *    "INSERT f  a   b" carries the text "a   b".
 * <p>
 * All problems are reported as {@link ValidationException}.
 */
public final class CommandParser {

    private CommandParser() {
        // utility
    }

    /**
     * Parse a line.
     *
     * @return empty for blank lines
     * @throws ValidationException for unknown commands, missing or extra
     *                             arguments and malformed numbers
     */
    public static Optional<Command> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        var cursor = new Cursor(line);
        String word = cursor.nextToken();
        if (word.isEmpty()) {
            return Optional.empty();
        }
        CommandType type = CommandType.fromWord(word)
                .orElseThrow(() -> new ValidationException("Unknown command: " + word));

        String second = cursor.nextToken();
        String rest = cursor.rest();

        return Optional.of(switch (type.arity()) {
            case NONE -> {
                if (!second.isEmpty()) {
                    throw new ValidationException(type + " takes no arguments");
                }
                yield Command.of(type);
            }
            case FILE_ONLY -> {
                String file = requireFilename(type, second);
                if (!rest.isEmpty()) {
                    throw new ValidationException(type + " takes exactly one argument: " + type.usage());
                }
                yield new Command(type, file, "", OptionalInt.empty());
            }
            case FILE_AND_TEXT -> new Command(type, requireFilename(type, second), rest, OptionalInt.empty());
            case FILE_AND_NUMBER -> {
                String file = requireFilename(type, second);
                yield new Command(type, file, "", optionalNumber(type, rest.strip()));
            }
            case NUMBER -> {
                if (!rest.isEmpty()) {
                    throw new ValidationException(type + " takes at most one argument");
                }
                yield new Command(type, null, "", optionalNumber(type, second));
            }
        });
    }

    /**
     * Parse a non-negative decimal integer (digits only, no sign).
     * <p>
     * Values past {@link Integer#MAX_VALUE} saturate to it, so the range check
     * of the operation that consumes the number rejects them.
     *
     * @throws ValidationException if the text is not such a number
     */
    public static int parseNonNegativeInt(String text, String what) {
        if (text == null || text.isEmpty()) {
            throw new ValidationException(what + " requires a non-negative integer argument");
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new ValidationException(
                        what + " requires a non-negative integer argument, got '" + text + "'");
            }
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    // ---------- helpers ----------

    private static String requireFilename(CommandType type, String token) {
        if (token.isEmpty()) {
            throw new ValidationException(type + " command requires a file name");
        }
        return FileNames.requireValid(token);
    }

    private static OptionalInt optionalNumber(CommandType type, String token) {
        if (token.isEmpty()) {
            return OptionalInt.empty();
        }
        for (int i = 0; i < token.length(); i++) {
            if (Character.isWhitespace(token.charAt(i))) {
                throw new ValidationException(type + " takes at most one numeric argument");
            }
        }
        return OptionalInt.of(parseNonNegativeInt(token, type.name()));
    }

    /** Left-to-right scanner over a single line. */
    private static final class Cursor {
        private final String line;
        private int pos;

        Cursor(String line) {
            this.line = line;
        }

        /** Skip whitespace, then read up to the next whitespace; "" at end of line. */
        String nextToken() {
            skipWhitespace();
            int start = pos;
            while (pos < line.length() && !Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
            return line.substring(start, pos);
        }

        /** Skip the separator run, then return the remainder untouched. */
        String rest() {
            skipWhitespace();
            return line.substring(pos);
        }

        private void skipWhitespace() {
            while (pos < line.length() && Character.isWhitespace(line.charAt(pos))) {
                pos++;
            }
        }
    }
}
