package com.example.acgarden.service;

import com.example.acgarden.model.Submission;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionSelectorTest {

    private final SubmissionSelector selector = new SubmissionSelector();

    @Test
    void keepsOnlyAcceptedSubmissions() {
        List<Submission> selected = selector.select(List.of(
                submission(1, 100, "abc100", "abc100_a", "WA"),
                submission(2, 200, "abc100", "abc100_b", "AC"),
                submission(3, 300, "abc100", "abc100_c", "TLE")), Set.of());

        assertThat(selected).extracting(Submission::getId).containsExactly(2L);
    }

    @Test
    void mostRecentAcceptedSubmissionWins() {
        List<Submission> selected = selector.select(List.of(
                submission(1, 100, "abc100", "abc100_a", "AC"),
                submission(2, 500, "abc100", "abc100_a", "AC"),
                submission(3, 300, "abc100", "abc100_a", "AC")), Set.of());

        assertThat(selected).extracting(Submission::getId).containsExactly(2L);
    }

    @Test
    void skipsAlreadyArchivedKeys() {
        List<Submission> selected = selector.select(List.of(
                submission(1, 100, "abc100", "abc100_a", "AC"),
                submission(2, 200, "abc101", "abc101_a", "AC")),
                Set.of(Submission.archiveKey("abc100", "abc100_a")));

        assertThat(selected).extracting(Submission::getId).containsExactly(2L);
    }

    @Test
    void ordersMostRecentFirst() {
        List<Submission> selected = selector.select(List.of(
                submission(1, 100, "abc100", "abc100_a", "AC"),
                submission(2, 300, "abc101", "abc101_a", "AC"),
                submission(3, 200, "abc102", "abc102_a", "AC")), Set.of());

        assertThat(selected).extracting(Submission::getId).containsExactly(2L, 3L, 1L);
    }

    @Test
    void sameProblemIdInDifferentContestsAreDistinctKeys() {
        List<Submission> selected = selector.select(List.of(
                submission(1, 100, "abc100", "shared", "AC"),
                submission(2, 200, "arc100", "shared", "AC")), Set.of());

        assertThat(selected).hasSize(2);
    }

    @Test
    void emptyInputSelectsNothing() {
        assertThat(selector.select(List.of(), Set.of())).isEmpty();
    }

    static Submission submission(long id, long epochSecond, String contestId, String problemId, String result) {
        return Submission.builder()
                .id(id)
                .epochSecond(epochSecond)
                .contestId(contestId)
                .problemId(problemId)
                .userId("alice")
                .language("C++17")
                .point(100.0)
                .length(120)
                .result(result)
                .executionTime(5L)
                .build();
    }
}
