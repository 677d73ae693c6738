package io.vfslite.shell.dto;

/**
 * JSON line written when a command fails:
 *   {
 *     "ok": false,
 *     "error": { "kind": "NOT_FOUND", "message": "File not found: notes" }
 *   }
 */
public class ErrorResponse {
    public boolean ok = false;
    public ErrorBody error;

    public static class ErrorBody {
        public String kind;
        public String message;
    }
}
