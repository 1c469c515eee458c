package com.example.acgarden.service;

import com.example.acgarden.exception.DecodeException;
import com.example.acgarden.model.Submission;
import com.example.acgarden.utils.HttpTextFetcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Downloads a user's complete submission history in one request.
 */
@Slf4j
@Service
public class SubmissionFetcher {

    private static final TypeReference<List<Submission>> SUBMISSION_LIST = new TypeReference<>() {};

    private final HttpTextFetcher httpTextFetcher;
    private final ObjectMapper objectMapper;
    private final String submissionsUrl;

    public SubmissionFetcher(HttpTextFetcher httpTextFetcher,
                             ObjectMapper objectMapper,
                             @Value("${acgarden.api.submissions-url:https://kenkoooo.com/atcoder/atcoder-api/results?user=}") String submissionsUrl) {
        this.httpTextFetcher = httpTextFetcher;
        this.objectMapper = objectMapper;
        this.submissionsUrl = submissionsUrl;
    }

    public List<Submission> fetchSubmissions(String userId) {
        String url = submissionsUrl + URLEncoder.encode(userId, StandardCharsets.UTF_8);
        log.info("Fetching submissions of {} from {}", userId, url);

        String body = httpTextFetcher.fetchText(url);
        return parse(body);
    }

    List<Submission> parse(String body) {
        List<Submission> submissions;
        try {
            submissions = objectMapper.readValue(body, SUBMISSION_LIST);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Failed to decode response as an array of submissions: " + e.getOriginalMessage(), e);
        }
        if (submissions == null) {
            throw new DecodeException("Submissions response was null");
        }
        for (int i = 0; i < submissions.size(); i++) {
            requireFields(i, submissions.get(i));
        }
        log.info("Received {} submissions", submissions.size());
        return submissions;
    }

    private static void requireFields(int index, Submission submission) {
        if (submission == null) {
            throw new DecodeException("Submission record " + index + " is null");
        }
        requireField(index, "contest_id", submission.getContestId());
        requireField(index, "problem_id", submission.getProblemId());
        requireField(index, "user_id", submission.getUserId());
        requireField(index, "language", submission.getLanguage());
        requireField(index, "result", submission.getResult());
    }

    private static void requireField(int index, String name, String value) {
        if (value == null) {
            throw new DecodeException("Submission record " + index + " lacks " + name);
        }
    }
}
