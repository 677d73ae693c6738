// file: src/main/java/io/vfslite/shell/dto/HistoryResponse.java
package io.vfslite.shell.dto;

import java.util.List;

/**
 * JSON line for HISTORY.
 * Example shape:
 * {
 *   "ok": true,
 *   "command": "HISTORY",
 *   "file": "notes",
 *   "versions": [
 *     { "versionId": 0, "createdMillis": 1704067200000, "snapshotMillis": 1704067200000, "message": "" },
 *     ...
 *   ]
 * }
 */
public class HistoryResponse {
    public boolean ok = true;
    public String command = "HISTORY";
    public String file;
    public List<VersionRecord> versions;

    public static class VersionRecord {
        public int versionId;
        public long createdMillis;
        public long snapshotMillis;
        public String message;
    }
}
