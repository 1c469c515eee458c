package com.example.acgarden.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one archive run.
 */
@Data
@NoArgsConstructor
public class ArchiveReport {

    private int fetchedCount;
    private int selectedCount;
    private List<Path> archivedEntries = new ArrayList<>();
    private List<Long> skippedSubmissionIds = new ArrayList<>();
    private List<String> commitIds = new ArrayList<>();

    public int getArchivedCount() {
        return archivedEntries.size();
    }
}
