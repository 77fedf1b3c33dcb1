package com.securefile.core.layout;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Names of the files the organize and verify scripts leave inside an organized directory.
 */
public final class OrganizedLayout {
    public static final String CHECKSUM_LOG = "organized_files_checksum.log";
    public static final String ORGANIZER_LOG = "organizer.log";
    public static final String INTEGRITY_LOG = "integrity_check.log";
    public static final String BACKUPS_DIR = "backups";

    private OrganizedLayout() {
    }

    public static Path checksumLog(Path organizedDir) {
        return organizedDir.resolve(CHECKSUM_LOG);
    }

    public static Path backupsDir(Path organizedDir) {
        return organizedDir.resolve(BACKUPS_DIR);
    }

    /** Organizer log first, then the integrity log; only files that exist right now. */
    public static List<Path> existingLogs(Path organizedDir) {
        List<Path> logs = new ArrayList<>(2);
        for (String name : List.of(ORGANIZER_LOG, INTEGRITY_LOG)) {
            Path candidate = organizedDir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                logs.add(candidate);
            }
        }
        return logs;
    }
}
