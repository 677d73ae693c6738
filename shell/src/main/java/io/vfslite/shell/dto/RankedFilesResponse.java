package io.vfslite.shell.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * JSON line for RECENT_FILES and BIGGEST_TREES.
 * Each row carries the rank key of its query:
 *  - RECENT_FILES:  lastModifiedMillis
 *  - BIGGEST_TREES: totalVersions
 */
public class RankedFilesResponse {
    public boolean ok = true;
    public String command;
    public List<RankedRecord> files;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RankedRecord {
        public String file;
        public Long lastModifiedMillis;
        public Integer totalVersions;
    }
}
