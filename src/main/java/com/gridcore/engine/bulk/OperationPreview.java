package com.gridcore.engine.bulk;

import java.util.List;

public final class OperationPreview {

    private final List<CellChange> changes;
    private final boolean truncated;
    private final String summary;
    private final long estimatedTime;

    public OperationPreview(List<CellChange> changes, boolean truncated, String summary, long estimatedTime) {
        this.changes = List.copyOf(changes);
        this.truncated = truncated;
        this.summary = summary;
        this.estimatedTime = estimatedTime;
    }

    public List<CellChange> getChanges() {
        return changes;
    }

    /**
     * True when more changes exist than the preview limit allowed.
     */
    public boolean isTruncated() {
        return truncated;
    }

    public String getSummary() {
        return summary;
    }

    public long getEstimatedTime() {
        return estimatedTime;
    }
}
