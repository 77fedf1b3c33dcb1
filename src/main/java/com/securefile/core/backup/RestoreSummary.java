package com.securefile.core.backup;

import java.nio.file.Path;
import java.util.List;

public record RestoreSummary(Path archive, Path destination, int filesExtracted, List<String> skippedEntries) {

    public RestoreSummary {
        skippedEntries = List.copyOf(skippedEntries);
    }
}
