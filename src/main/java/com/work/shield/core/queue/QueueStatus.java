package com.work.shield.core.queue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class QueueStatus {

    private final int activeJobs;
    private final int queuedJobs;
    private final int maxConcurrent;
    private final int totalTracked;
    private final List<String> queuedJobIds;
    private final List<String> activeJobIds;

    public QueueStatus(int activeJobs, int queuedJobs, int maxConcurrent, int totalTracked,
                       List<String> queuedJobIds, List<String> activeJobIds) {
        this.activeJobs = activeJobs;
        this.queuedJobs = queuedJobs;
        this.maxConcurrent = maxConcurrent;
        this.totalTracked = totalTracked;
        this.queuedJobIds = Collections.unmodifiableList(new ArrayList<>(queuedJobIds));
        this.activeJobIds = Collections.unmodifiableList(new ArrayList<>(activeJobIds));
    }

    public int getActiveJobs() {
        return activeJobs;
    }

    public int getQueuedJobs() {
        return queuedJobs;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public int getTotalTracked() {
        return totalTracked;
    }

    public List<String> getQueuedJobIds() {
        return queuedJobIds;
    }

    public List<String> getActiveJobIds() {
        return activeJobIds;
    }
}
