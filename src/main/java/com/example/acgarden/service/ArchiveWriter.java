package com.example.acgarden.service;

import com.example.acgarden.exception.FilesystemException;
import com.example.acgarden.model.ArchiveEntry;
import com.example.acgarden.model.Submission;
import com.example.acgarden.utils.LanguageFileNames;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the source and submission.json of one submission to
 * {@code <root>/<host>/<contest_id>/<problem_id>/}. Not transactional: a failure
 * on the second file leaves the first one behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveWriter {

    private final ObjectMapper objectMapper;

    public ArchiveEntry write(Path root, String host, Submission submission, String source) {
        String fileName = LanguageFileNames.of(submission.getLanguage());
        String relativeDir = host + "/" + submission.getContestId() + "/" + submission.getProblemId();
        Path directory = root.resolve(host).resolve(submission.getContestId()).resolve(submission.getProblemId());

        String metadata;
        try {
            metadata = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(submission);
        } catch (JsonProcessingException e) {
            throw new FilesystemException("Failed to serialize submission " + submission.getId(), e);
        }

        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(fileName), source, StandardCharsets.UTF_8);
            Files.writeString(directory.resolve(SubmissionDirectoryIndex.METADATA_FILE_NAME), metadata, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FilesystemException("Failed to write archive entry " + directory + ": " + e.getMessage(), e);
        }

        log.info("archived the code at {}", directory.resolve(fileName));
        return new ArchiveEntry(directory,
                relativeDir + "/" + fileName,
                relativeDir + "/" + SubmissionDirectoryIndex.METADATA_FILE_NAME);
    }
}
