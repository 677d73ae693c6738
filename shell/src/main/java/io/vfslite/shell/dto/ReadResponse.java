package io.vfslite.shell.dto;

/**
 * JSON line for READ:
 *   { "ok": true, "command": "READ", "file": "notes", "content": "hello" }
 */
public class ReadResponse {
    public boolean ok = true;
    public String command = "READ";
    public String file;
    public String content;
}
