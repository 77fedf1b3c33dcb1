package com.securefile.core.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts a whole zip archive, overwriting existing files. Entries that would land outside
 * the destination are skipped and reported.
 */
public final class ZipExtractor {
    public interface Listener {
        void onFileExtracted(Path file);

        void onEntrySkipped(String name, String reason);
    }

    private ZipExtractor() {
    }

    public static void unzip(Path zipFile, Path destDir, Listener listener) throws IOException {
        Files.createDirectories(destDir);
        Path root = destDir.toRealPath();
        try (ZipFile zip = new ZipFile(zipFile.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    listener.onEntrySkipped(entry.getName(), "Zip entry outside target folder");
                    continue;
                }
                if (target.equals(root)) {
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                listener.onFileExtracted(target);
            }
        }
    }
}
