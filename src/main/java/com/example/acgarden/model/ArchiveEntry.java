package com.example.acgarden.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * Files written for one archived submission. Relative paths use '/' and are
 * relative to the repository root, ready for staging.
 */
@Data
@AllArgsConstructor
public class ArchiveEntry {
    private Path directory;
    private String sourceRelativePath;
    private String metadataRelativePath;

    public List<String> relativePaths() {
        return List.of(sourceRelativePath, metadataRelativePath);
    }
}
