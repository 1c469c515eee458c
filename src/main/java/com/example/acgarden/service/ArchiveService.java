package com.example.acgarden.service;

import com.example.acgarden.exception.ConfigException;
import com.example.acgarden.model.ArchiveEntry;
import com.example.acgarden.model.ArchiveReport;
import com.example.acgarden.model.GardenConfig;
import com.example.acgarden.model.Submission;
import com.example.acgarden.utils.CommitRecorder;
import com.example.acgarden.utils.HttpTextFetcher;
import com.example.acgarden.utils.RateLimiter;
import com.example.acgarden.utils.SourceExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Archive pipeline: index the existing tree, fetch the history, select what is
 * new, then retrieve, write and commit each selected submission in order. The
 * first failure aborts the run; an empty source only skips its submission.
 */
@Slf4j
@Service
public class ArchiveService {

    private final SubmissionDirectoryIndex directoryIndex;
    private final SubmissionFetcher submissionFetcher;
    private final SubmissionSelector submissionSelector;
    private final HttpTextFetcher httpTextFetcher;
    private final SourceExtractor sourceExtractor;
    private final ArchiveWriter archiveWriter;
    private final CommitRecorder commitRecorder;

    @Value("${acgarden.judge.base-url:https://atcoder.jp}")
    private String judgeBaseUrl = "https://atcoder.jp";

    @Value("${acgarden.archive.host:atcoder.jp}")
    private String archiveHost = "atcoder.jp";

    @Value("${acgarden.throttle.interval-ms:1500}")
    private long throttleIntervalMs = 1500;

    public ArchiveService(SubmissionDirectoryIndex directoryIndex,
                          SubmissionFetcher submissionFetcher,
                          SubmissionSelector submissionSelector,
                          HttpTextFetcher httpTextFetcher,
                          SourceExtractor sourceExtractor,
                          ArchiveWriter archiveWriter,
                          CommitRecorder commitRecorder) {
        this.directoryIndex = directoryIndex;
        this.submissionFetcher = submissionFetcher;
        this.submissionSelector = submissionSelector;
        this.httpTextFetcher = httpTextFetcher;
        this.sourceExtractor = sourceExtractor;
        this.archiveWriter = archiveWriter;
        this.commitRecorder = commitRecorder;
    }

    public ArchiveReport archive(GardenConfig config) {
        GardenConfig.Service atcoder = requireService(config);
        Path root = Paths.get(atcoder.getRepositoryPath());
        ArchiveReport report = new ArchiveReport();

        Set<String> archivedKeys = directoryIndex.archivedKeys(root);
        List<Submission> submissions = submissionFetcher.fetchSubmissions(atcoder.getUserId());
        List<Submission> selected = submissionSelector.select(submissions, archivedKeys);
        report.setFetchedCount(submissions.size());
        report.setSelectedCount(selected.size());

        log.info("Archiving {} code...", selected.size());

        boolean versioned = commitRecorder.hasRepository(root);
        if (versioned) {
            requireText(atcoder.getUserEmail(), "user_email");
        } else {
            log.info("{} is not a git repository, archiving files without commits", root);
        }

        SourceRetriever retriever = newRetriever();
        for (Submission submission : selected) {
            Optional<String> source = retriever.retrieve(submission);
            if (source.isEmpty()) {
                report.getSkippedSubmissionIds().add(submission.getId());
                continue;
            }

            ArchiveEntry entry = archiveWriter.write(root, archiveHost, submission, source.get());
            report.getArchivedEntries().add(entry.getDirectory());

            if (versioned) {
                commitRecorder.stage(root, entry.relativePaths());
                String commitId = commitRecorder.commit(root,
                        submission.getUserId(),
                        atcoder.getUserEmail(),
                        submission.getEpochSecond(),
                        commitMessage(submission));
                report.getCommitIds().add(commitId);
            }
        }

        log.info("Archive finished: {} archived, {} skipped, {} commits",
                report.getArchivedCount(), report.getSkippedSubmissionIds().size(), report.getCommitIds().size());
        return report;
    }

    /**
     * Each run gets its own limiter so separate runs never share throttle state.
     */
    protected SourceRetriever newRetriever() {
        RateLimiter rateLimiter = new RateLimiter(Duration.ofMillis(throttleIntervalMs));
        return new SourceRetriever(httpTextFetcher, sourceExtractor, rateLimiter, judgeBaseUrl);
    }

    static String commitMessage(Submission submission) {
        return "[AC] " + submission.getContestId() + " " + submission.getProblemId();
    }

    public void setJudgeBaseUrl(String judgeBaseUrl) {
        this.judgeBaseUrl = judgeBaseUrl;
    }

    public void setArchiveHost(String archiveHost) {
        this.archiveHost = archiveHost;
    }

    public void setThrottleIntervalMs(long throttleIntervalMs) {
        this.throttleIntervalMs = throttleIntervalMs;
    }

    private static GardenConfig.Service requireService(GardenConfig config) {
        if (config == null || config.getAtcoder() == null) {
            throw new ConfigException("Config has no atcoder section");
        }
        GardenConfig.Service atcoder = config.getAtcoder();
        requireText(atcoder.getRepositoryPath(), "repository_path");
        requireText(atcoder.getUserId(), "user_id");
        return atcoder;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Config value '" + name + "' is not set, run 'edit' to fill it in");
        }
    }
}
