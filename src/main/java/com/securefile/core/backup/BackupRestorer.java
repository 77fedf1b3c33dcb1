package com.securefile.core.backup;

import com.securefile.core.fs.ZipExtractor;
import com.securefile.core.layout.OrganizedLayout;
import com.securefile.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Lists the zip backups the organize script writes and extracts one of them on request.
 */
public final class BackupRestorer {

    static final String ARCHIVE_EXTENSION = ".zip";

    private static final Logger LOGGER = AppLogger.get();

    /**
     * Archives in {@code <organizedDir>/backups}, newest first. Backup names embed their
     * timestamp, so descending name order is recency order.
     *
     * @return an empty list when the backups directory does not exist
     * @throws IOException if the directory exists but cannot be listed
     */
    public List<BackupEntry> listBackups(Path organizedDir) throws IOException {
        Path backupsDir = OrganizedLayout.backupsDir(organizedDir);
        if (!Files.isDirectory(backupsDir)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(backupsDir)) {
            return children
                .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(ARCHIVE_EXTENSION))
                .map(p -> new BackupEntry(p.getFileName().toString(), p))
                .sorted(Comparator.comparing(BackupEntry::fileName).reversed())
                .toList();
        }
    }

    /**
     * Extracts the named backup into {@code destination}, replacing files that already exist.
     * Nothing is rolled back when extraction fails part way.
     */
    public RestoreSummary restore(Path organizedDir, String fileName, Path destination) throws RestoreException {
        Path backupsDir = OrganizedLayout.backupsDir(organizedDir).normalize();
        Path archive = backupsDir.resolve(fileName).normalize();
        if (!archive.startsWith(backupsDir) || archive.equals(backupsDir)) {
            LOGGER.warning("Rejected backup name outside " + backupsDir + ": " + fileName);
            throw new RestoreException("Backup name points outside the backups folder: " + fileName, null);
        }
        if (!Files.isRegularFile(archive)) {
            throw RestoreException.archiveMissing(archive);
        }
        LOGGER.info(() -> "Restoring " + archive + " into " + destination);

        AtomicInteger extracted = new AtomicInteger();
        List<String> skipped = new ArrayList<>();
        try {
            ZipExtractor.unzip(archive, destination, new ZipExtractor.Listener() {
                @Override
                public void onFileExtracted(Path file) {
                    extracted.incrementAndGet();
                }

                @Override
                public void onEntrySkipped(String name, String reason) {
                    LOGGER.warning("Skipped entry '" + name + "' of " + fileName + ": " + reason);
                    skipped.add(name + " (" + reason + ")");
                }
            });
        } catch (IOException ex) {
            LOGGER.warning("Restore of " + fileName + " failed: " + ex);
            throw new RestoreException("Failed to restore " + fileName + ": " + describe(ex), ex);
        }
        LOGGER.info(() -> "Restored " + extracted.get() + " file(s) from " + fileName);
        return new RestoreSummary(archive, destination, extracted.get(), skipped);
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }
}
