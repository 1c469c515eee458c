package com.example.acgarden.service;

import com.example.acgarden.model.Submission;
import com.example.acgarden.utils.HttpTextFetcher;
import com.example.acgarden.utils.RateLimiter;
import com.example.acgarden.utils.SourceExtractor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Fetches submission pages one at a time under a {@link RateLimiter} and
 * extracts their source text. One instance serves one archive run.
 */
@Slf4j
public class SourceRetriever {

    private final HttpTextFetcher httpTextFetcher;
    private final SourceExtractor sourceExtractor;
    private final RateLimiter rateLimiter;
    private final String judgeBaseUrl;

    public SourceRetriever(HttpTextFetcher httpTextFetcher, SourceExtractor sourceExtractor,
                           RateLimiter rateLimiter, String judgeBaseUrl) {
        this.httpTextFetcher = httpTextFetcher;
        this.sourceExtractor = sourceExtractor;
        this.rateLimiter = rateLimiter;
        this.judgeBaseUrl = judgeBaseUrl.endsWith("/")
                ? judgeBaseUrl.substring(0, judgeBaseUrl.length() - 1)
                : judgeBaseUrl;
    }

    public String submissionUrl(Submission submission) {
        return judgeBaseUrl + "/contests/" + submission.getContestId() + "/submissions/" + submission.getId();
    }

    /**
     * @return the source text, or empty when the page yielded nothing to archive
     * @throws com.example.acgarden.exception.NetworkException on transport failure
     */
    public Optional<String> retrieve(Submission submission) {
        String url = submissionUrl(submission);

        rateLimiter.acquire();
        String page;
        try {
            page = httpTextFetcher.fetchText(url);
        } finally {
            rateLimiter.release();
        }

        Optional<String> source = sourceExtractor.extract(page);
        if (source.isEmpty()) {
            log.warn("Empty source for submission {} ({}), skipping", submission.getId(), url);
        }
        return source;
    }
}
