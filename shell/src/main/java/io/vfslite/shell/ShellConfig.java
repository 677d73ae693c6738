// file: shell/src/main/java/io/vfslite/shell/ShellConfig.java
package io.vfslite.shell;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vfslite.shell.dto.JsonShellConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Shell configuration parsed from CLI args and an optional JSON file.
 *
 * Supports:
 *  - format:  output renderer, text (default) or json
 *  - prompt:  string printed before each line is read (text mode only)
 *  - zone:    time zone for human-readable timestamps
 *  - verbose: log every command at FINE
 *  - help:    print usage and exit
 */
public record ShellConfig(
        OutputFormat format,
        String prompt,
        ZoneId zone,
        boolean verbose,
        boolean help
) {

    /** Output renderer selection. */
    public enum OutputFormat {
        TEXT, JSON;

        static OutputFormat parse(String s) {
            try {
                return valueOf(s.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("format must be one of: text, json (got '" + s + "')", e);
            }
        }
    }

    public static ShellConfig defaults() {
        return new ShellConfig(OutputFormat.TEXT, "", ZoneId.systemDefault(), false, false);
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --format,  -f   text|json
     *   --prompt        <string>
     *   --zone,    -z   <zone id>
     *   --config,  -c   <path to JSON file>
     *   --verbose, -v
     *   --help,    -h
     *
     * Flags given on the command line override values from the config file.
     *
     * @throws IllegalArgumentException on unknown flags or bad values
     */
    public static ShellConfig fromArgs(String[] args) {
        String format = null;
        String prompt = null;
        String zone = null;
        Boolean verbose = null;
        String configPath = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--format", "-f" -> {
                    ensureValue(args, i);
                    format = args[++i];
                }

                case "--prompt" -> {
                    ensureValue(args, i);
                    prompt = args[++i];
                }

                case "--zone", "-z" -> {
                    ensureValue(args, i);
                    zone = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--verbose", "-v" -> verbose = true;

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        if (configPath != null) {
            JsonShellConfig file = fromJsonFile(Path.of(configPath));
            if (format == null) format = file.format;
            if (prompt == null) prompt = file.prompt;
            if (zone == null) zone = file.zone;
            if (verbose == null) verbose = file.verbose;
        }

        ShellConfig d = defaults();
        return new ShellConfig(
                format == null ? d.format() : OutputFormat.parse(format),
                prompt == null ? d.prompt() : prompt,
                zone == null ? d.zone() : parseZone(zone),
                verbose == null ? d.verbose() : verbose,
                help
        );
    }

    /**
     * Read the JSON config file.
     *
     * @throws IllegalArgumentException if the file is missing, unreadable or not valid JSON
     */
    public static JsonShellConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            return mapper.readValue(path.toFile(), JsonShellConfig.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load shell config from " + path + ": " + e.getMessage(), e);
        }
    }

    public static String usage() {
        return """
            Usage: vfslite [options]

            Options:
              --format,  -f   Output format: text or json (default: text)
              --prompt        Prompt printed before each command (default: none)
              --zone,    -z   Time zone for timestamps (default: system zone)
              --config,  -c   Path to JSON config file (optional)
              --verbose, -v   Log every command
              --help,    -h   Show this help message

            Commands are read from standard input, one per line. Type HELP for the list.
            """;
    }

    private static ZoneId parseZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Invalid zone: " + zone, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }
}
