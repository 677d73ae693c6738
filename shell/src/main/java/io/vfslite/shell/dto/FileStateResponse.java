// file: src/main/java/io/vfslite/shell/dto/FileStateResponse.java
package io.vfslite.shell.dto;

/**
 * JSON line written after CREATE, INSERT, UPDATE, SNAPSHOT and ROLLBACK.
 * Example:
 *   {
 *     "ok": true,
 *     "command": "INSERT",
 *     "file": "notes",
 *     "activeVersion": 1,
 *     "content": "XY",
 *     "activeIsSnapshot": false,
 *     "totalVersions": 2,
 *     "lastModifiedMillis": 1704067200000
 *   }
 */
public class FileStateResponse {
    public boolean ok = true;
    public String command;
    public String file;
    public int activeVersion;
    public String content;
    public boolean activeIsSnapshot;
    public int totalVersions;
    public long lastModifiedMillis;
}
