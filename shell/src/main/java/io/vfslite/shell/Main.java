// file: shell/src/main/java/io/vfslite/shell/Main.java
package io.vfslite.shell;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vfslite.shell.repl.JsonRenderer;
import io.vfslite.shell.repl.Repl;
import io.vfslite.shell.repl.ResultRenderer;
import io.vfslite.shell.repl.TextRenderer;
import io.vfslite.storage.FileRegistry;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the vfslite shell.
 *
 * Responsibilities:
 *  - Parse configuration from CLI flags (and the optional JSON file).
 *  - Configure java.util.logging.
 *  - Wire FileRegistry and VersionedFileService with the system clock.
 *  - Run the REPL on stdin/stdout/stderr until EXIT or end of input.
 */
public final class Main {
    private static final String LOGGING_CONFIG = "/vfslite-logging.properties";

    // Held strongly so the level set by --verbose is not lost to GC.
    private static final Logger APP_LOGGER = Logger.getLogger("io.vfslite");

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        ShellConfig cfg;
        try {
            cfg = ShellConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.err.print(ShellConfig.usage());
            System.exit(1);
            return;
        }
        if (cfg.help()) {
            System.out.print(ShellConfig.usage());
            return;
        }

        configureLogging(cfg.verbose());

        // ------ Core wiring -------
        var registry = new FileRegistry(Clock.systemUTC());
        var service = new VersionedFileService(registry);

        // ------ Output -------
        ResultRenderer renderer = switch (cfg.format()) {
            case TEXT -> new TextRenderer(System.out, System.err, cfg.zone(), cfg.prompt());
            case JSON -> new JsonRenderer(new ObjectMapper(), System.out);
        };

        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new Repl(service, renderer).run(in);
    }

    /**
     * Load the bundled logging config unless the JVM was started with its own
     * (-Djava.util.logging.config.file=...).
     */
    static void configureLogging(boolean verbose) throws IOException {
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream props = Main.class.getResourceAsStream(LOGGING_CONFIG)) {
                if (props != null) {
                    LogManager.getLogManager().readConfiguration(props);
                }
            }
        }
        if (verbose) {
            APP_LOGGER.setLevel(Level.FINE);
        }
    }
}
