package io.vfslite.shell.dto;

/**
 * Shape of the optional JSON config file passed with --config.
 * Example:
 *   {
 *     "format": "json",
 *     "prompt": "vfs> ",
 *     "zone": "UTC",
 *     "verbose": false
 *   }
 * Missing fields keep the command-line defaults.
 */
public class JsonShellConfig {
    public String format;
    public String prompt;
    public String zone;
    public Boolean verbose;
}
