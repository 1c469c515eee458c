package com.example.acgarden.service;

import com.example.acgarden.exception.DecodeException;
import com.example.acgarden.exception.FilesystemException;
import com.example.acgarden.model.Submission;
import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.HashSet;
import java.util.Set;

/**
 * Recovers the archive keys already present under a repository root by reading
 * every submission.json in the tree.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionDirectoryIndex {

    public static final String METADATA_FILE_NAME = "submission.json";

    private final ObjectMapper objectMapper;

    /**
     * @param root repository root; a missing root yields an empty set
     * @return keys as produced by {@link Submission#archiveKey()}
     * @throws DecodeException     when a metadata file cannot be parsed
     * @throws FilesystemException when the tree cannot be walked or read
     */
    public Set<String> archivedKeys(Path root) {
        Set<String> keys = new HashSet<>();
        if (root == null || !Files.isDirectory(root)) {
            log.info("Archive root {} does not exist yet, nothing archived", root);
            return keys;
        }

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && shouldIgnoreDirectory(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() && file.getFileName().toString().endsWith(METADATA_FILE_NAME)) {
                        keys.add(readKey(file));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    throw exc;
                }
            });
        } catch (IOException e) {
            throw new FilesystemException("Failed to scan archive root " + root + ": " + e.getMessage(), e);
        }

        log.info("Found {} archived submissions under {}", keys.size(), root);
        return keys;
    }

    private String readKey(Path metadataFile) {
        Submission submission;
        try {
            submission = objectMapper.readValue(metadataFile.toFile(), Submission.class);
        } catch (JacksonException e) {
            throw new DecodeException("Malformed archive metadata " + metadataFile + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FilesystemException("Failed to read " + metadataFile + ": " + e.getMessage(), e);
        }
        if (submission == null || submission.getContestId() == null || submission.getProblemId() == null) {
            throw new DecodeException("Archive metadata " + metadataFile + " lacks contest_id or problem_id");
        }
        return submission.archiveKey();
    }

    // .git and other dot-directories never hold archive entries
    private static boolean shouldIgnoreDirectory(Path dir) {
        Path name = dir.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
