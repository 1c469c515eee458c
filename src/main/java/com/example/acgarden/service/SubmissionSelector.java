package com.example.acgarden.service;

import com.example.acgarden.model.Submission;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which submissions a run archives: accepted, not yet archived, and only
 * the most recent one per problem. Output is ordered most recent first.
 */
@Component
public class SubmissionSelector {

    public List<Submission> select(Collection<Submission> submissions, Set<String> archivedKeys) {
        List<Submission> candidates = submissions.stream()
                .filter(Submission::isAccepted)
                .filter(s -> !archivedKeys.contains(s.archiveKey()))
                .sorted(Comparator.<Submission>comparingLong(Submission::getEpochSecond).reversed())
                .collect(Collectors.toList());

        Set<String> seen = new HashSet<>();
        List<Submission> selected = new ArrayList<>();
        for (Submission submission : candidates) {
            if (seen.add(submission.archiveKey())) {
                selected.add(submission);
            }
        }
        return selected;
    }
}
