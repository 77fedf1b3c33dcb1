package com.securefile.core.backup;

import java.nio.file.Path;

/**
 * A zip archive in the {@code backups} directory, shown by file name.
 */
public record BackupEntry(String fileName, Path archive) {

    @Override
    public String toString() {
        return fileName;
    }
}
