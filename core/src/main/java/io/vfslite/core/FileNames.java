package io.vfslite.core;

/**
 * Filename rules shared by the registry and the command parser.
 * <p>
 * A filename is any non-empty string without whitespace. Every other
 * character, including punctuation and non-ASCII letters, is allowed.
 */
public final class FileNames {

    private FileNames() {
        // utility
    }

    /**
     * Validate a filename and return it unchanged.
     *
     * @throws ValidationException if the name is null, empty or contains whitespace
     */
    public static String requireValid(String name) {
        if (name == null || name.isEmpty()) {
            throw new ValidationException("File name cannot be empty");
        }
        for (int i = 0; i < name.length(); ) {
            int cp = name.codePointAt(i);
            if (Character.isWhitespace(cp)) {
                throw new ValidationException("File name must not contain whitespace: '" + name + "'");
            }
            i += Character.charCount(cp);
        }
        return name;
    }
}
