package com.engram.core.model;

import java.util.List;

/**
 * Version-control facts gathered by a {@link com.engram.core.history.HistoryProvider}.
 * Fields whose query failed are left empty/zero and the failure is described in {@code warnings}.
 */
public record HistorySummary(
    List<CommitInfo> recentCommits,
    List<Contributor> contributors,
    int commitCount,
    String firstCommitDate,
    String lastCommitDate,
    List<String> warnings
) {

    public HistorySummary {
        recentCommits = List.copyOf(recentCommits);
        contributors = List.copyOf(contributors);
        firstCommitDate = firstCommitDate == null ? "" : firstCommitDate;
        lastCommitDate = lastCommitDate == null ? "" : lastCommitDate;
        warnings = List.copyOf(warnings);
    }

    public static HistorySummary empty() {
        return new HistorySummary(List.of(), List.of(), 0, "", "", List.of());
    }
}
