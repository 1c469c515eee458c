package com.example.acgarden.utils;

import java.nio.file.Path;
import java.util.List;

/**
 * Version-control operations the archive pipeline needs. Implementations report
 * failures as {@link com.example.acgarden.exception.RepositoryException}.
 */
public interface CommitRecorder {

    /**
     * @return true when {@code root} holds version-control metadata
     */
    boolean hasRepository(Path root);

    /**
     * Add files to the index.
     *
     * @param root          repository working tree root
     * @param relativePaths paths relative to {@code root}, using '/' separators
     */
    void stage(Path root, List<String> relativePaths);

    /**
     * Commit the current index on top of HEAD, or as a root commit when the
     * repository has no commits yet.
     *
     * @return id of the new commit
     */
    String commit(Path root, String authorName, String authorEmail, long epochSecond, String message);
}
