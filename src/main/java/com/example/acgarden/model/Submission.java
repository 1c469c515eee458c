package com.example.acgarden.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single submission as reported by the AtCoder Problems API. The same shape is
 * persisted as submission.json next to the archived source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "epoch_second", "problem_id", "contest_id", "user_id",
        "language", "point", "length", "result", "execution_time"})
public class Submission {

    /**
     * Judge verdict of a fully correct submission.
     */
    public static final String ACCEPTED = "AC";

    private static final String KEY_SEPARATOR = "/";

    private long id;

    @JsonProperty("epoch_second")
    private long epochSecond;

    @JsonProperty("problem_id")
    private String problemId;

    @JsonProperty("contest_id")
    private String contestId;

    @JsonProperty("user_id")
    private String userId;

    private String language;
    private double point;
    private long length;
    private String result;

    @JsonProperty("execution_time")
    private Long executionTime;

    @JsonIgnore
    public boolean isAccepted() {
        return ACCEPTED.equals(result);
    }

    /**
     * Identity of the archive entry this submission belongs to. Two submissions
     * with the same key can never both be archived.
     */
    @JsonIgnore
    public String archiveKey() {
        return archiveKey(contestId, problemId);
    }

    public static String archiveKey(String contestId, String problemId) {
        return contestId + KEY_SEPARATOR + problemId;
    }
}
