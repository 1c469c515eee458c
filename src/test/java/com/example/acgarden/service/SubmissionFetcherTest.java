package com.example.acgarden.service;

import com.example.acgarden.exception.DecodeException;
import com.example.acgarden.exception.NetworkException;
import com.example.acgarden.model.Submission;
import com.example.acgarden.utils.HttpTextFetcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SubmissionFetcherTest {

    private static final String URL = "https://api.test/results?user=";

    private final HttpTextFetcher httpTextFetcher = mock(HttpTextFetcher.class);
    private final SubmissionFetcher fetcher = new SubmissionFetcher(httpTextFetcher, new ObjectMapper(), URL);

    @Test
    void parsesSubmissionArray() {
        when(httpTextFetcher.fetchText(URL + "alice")).thenReturn("["
                + "{\"id\":5,\"epoch_second\":1530000000,\"problem_id\":\"abc100_a\",\"contest_id\":\"abc100\","
                + "\"user_id\":\"alice\",\"language\":\"C++14 (GCC 5.4.1)\",\"point\":100.0,\"length\":200,"
                + "\"result\":\"AC\",\"execution_time\":1},"
                + "{\"id\":6,\"epoch_second\":1530000100,\"problem_id\":\"abc100_b\",\"contest_id\":\"abc100\","
                + "\"user_id\":\"alice\",\"language\":\"Python3\",\"point\":0.0,\"length\":50,"
                + "\"result\":\"CE\",\"execution_time\":null,\"extra\":true}"
                + "]");

        List<Submission> submissions = fetcher.fetchSubmissions("alice");

        assertThat(submissions).hasSize(2);
        Submission first = submissions.get(0);
        assertThat(first.getId()).isEqualTo(5L);
        assertThat(first.getEpochSecond()).isEqualTo(1_530_000_000L);
        assertThat(first.getContestId()).isEqualTo("abc100");
        assertThat(first.getProblemId()).isEqualTo("abc100_a");
        assertThat(first.getLanguage()).isEqualTo("C++14 (GCC 5.4.1)");
        assertThat(first.getExecutionTime()).isEqualTo(1L);
        assertThat(first.isAccepted()).isTrue();
        assertThat(submissions.get(1).getExecutionTime()).isNull();
        assertThat(submissions.get(1).isAccepted()).isFalse();
    }

    @Test
    void emptyArrayIsNoSubmissions() {
        when(httpTextFetcher.fetchText(URL + "bob")).thenReturn("[]");

        assertThat(fetcher.fetchSubmissions("bob")).isEmpty();
    }

    @Test
    void nonArrayBodyIsDecodeError() {
        when(httpTextFetcher.fetchText(URL + "bob")).thenReturn("{\"message\":\"rate limited\"}");

        assertThatThrownBy(() -> fetcher.fetchSubmissions("bob")).isInstanceOf(DecodeException.class);
    }

    @Test
    void truncatedBodyIsDecodeError() {
        when(httpTextFetcher.fetchText(URL + "bob")).thenReturn("[{\"id\": 1,");

        assertThatThrownBy(() -> fetcher.fetchSubmissions("bob")).isInstanceOf(DecodeException.class);
    }

    @Test
    void recordWithoutContestIdIsDecodeError() {
        when(httpTextFetcher.fetchText(URL + "bob")).thenReturn("[{\"id\":1,\"epoch_second\":5,"
                + "\"problem_id\":\"abc100_a\",\"user_id\":\"alice\",\"language\":\"C++17\",\"result\":\"AC\"}]");

        assertThatThrownBy(() -> fetcher.fetchSubmissions("bob"))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("contest_id");
    }

    @Test
    void recordWithoutResultIsDecodeError() {
        when(httpTextFetcher.fetchText(URL + "bob")).thenReturn("[{\"id\":1,\"epoch_second\":5,"
                + "\"contest_id\":\"abc100\",\"problem_id\":\"abc100_a\",\"user_id\":\"alice\",\"language\":\"C++17\"}]");

        assertThatThrownBy(() -> fetcher.fetchSubmissions("bob"))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("result");
    }

    @Test
    void transportFailurePropagates() {
        when(httpTextFetcher.fetchText(URL + "bob")).thenThrow(new NetworkException("connection refused"));

        assertThatThrownBy(() -> fetcher.fetchSubmissions("bob"))
                .isInstanceOf(NetworkException.class)
                .hasMessageContaining("connection refused");
    }
}
