package io.vfslite.shell.dto;

import java.util.List;

/**
 * JSON line for commands that only produce text (HELP, EXIT).
 */
public class MessageResponse {
    public boolean ok = true;
    public String command;
    public List<String> lines;
}
