package com.engram.core.history;

import com.engram.core.engine.Deadline;
import com.engram.core.model.HistorySummary;

import java.nio.file.Path;

/**
 * Source of version-control facts for a repository.
 * <p>
 * Implementations never throw for a repository without history or for a failed query;
 * they return whatever could be gathered and describe the rest in
 * {@link HistorySummary#warnings()}.
 */
public interface HistoryProvider {

    /**
     * @param root     repository root
     * @param limit    maximum number of recent commits to return
     * @param deadline overall time budget; every query is bounded by what remains of it
     */
    HistorySummary extractHistory(Path root, int limit, Deadline deadline);

    default HistorySummary extractHistory(Path root, int limit) {
        return extractHistory(root, limit, Deadline.none());
    }
}
