package com.securefile.core.backup;

import java.nio.file.Path;

/**
 * A backup could not be restored. The destination may hold a partial extraction.
 */
public final class RestoreException extends Exception {
    private final boolean archiveMissing;

    private RestoreException(String message, Throwable cause, boolean archiveMissing) {
        super(message, cause);
        this.archiveMissing = archiveMissing;
    }

    public RestoreException(String message, Throwable cause) {
        this(message, cause, false);
    }

    static RestoreException archiveMissing(Path archive) {
        return new RestoreException("Backup not found: " + archive, null, true);
    }

    /** True when the selected archive was gone by the time the restore started. */
    public boolean isArchiveMissing() {
        return archiveMissing;
    }
}
