/**
 * Summary of an orphan-object scan or delete pass over the image prefix
 *
 * Features:
 * - Counts scanned, orphaned, deleted and failed objects
 * - Lists the affected keys for operator review
 * - Immutable, with defensive copies of the key lists
 */

package com.williamcallahan.trivia_image_curator.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class OrphanCleanupSummary {
    private final boolean dryRun;
    private final int totalScanned;
    private final int totalOrphaned;
    private final int deleted;
    private final int failedToDelete;
    private final List<String> orphanedKeys;
    private final List<String> deletedKeys;
    private final List<String> failedKeys;

    public OrphanCleanupSummary(boolean dryRun, int totalScanned, int totalOrphaned, int deleted, int failedToDelete,
                                List<String> orphanedKeys, List<String> deletedKeys, List<String> failedKeys) {
        this.dryRun = dryRun;
        this.totalScanned = totalScanned;
        this.totalOrphaned = totalOrphaned;
        this.deleted = deleted;
        this.failedToDelete = failedToDelete;
        this.orphanedKeys = orphanedKeys != null ? new ArrayList<>(orphanedKeys) : new ArrayList<>();
        this.deletedKeys = deletedKeys != null ? new ArrayList<>(deletedKeys) : new ArrayList<>();
        this.failedKeys = failedKeys != null ? new ArrayList<>(failedKeys) : new ArrayList<>();
    }

    public static OrphanCleanupSummary empty(boolean dryRun) {
        return new OrphanCleanupSummary(dryRun, 0, 0, 0, 0,
            Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
    }

    public static OrphanCleanupSummary dryRun(int totalScanned, List<String> orphanedKeys) {
        return new OrphanCleanupSummary(true, totalScanned, orphanedKeys.size(), 0, 0,
            orphanedKeys, Collections.emptyList(), Collections.emptyList());
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public int getTotalScanned() {
        return totalScanned;
    }

    public int getTotalOrphaned() {
        return totalOrphaned;
    }

    public int getDeleted() {
        return deleted;
    }

    public int getFailedToDelete() {
        return failedToDelete;
    }

    public List<String> getOrphanedKeys() {
        return Collections.unmodifiableList(orphanedKeys);
    }

    public List<String> getDeletedKeys() {
        return Collections.unmodifiableList(deletedKeys);
    }

    public List<String> getFailedKeys() {
        return Collections.unmodifiableList(failedKeys);
    }

    @Override
    public String toString() {
        return "OrphanCleanupSummary{" +
               "dryRun=" + dryRun +
               ", totalScanned=" + totalScanned +
               ", totalOrphaned=" + totalOrphaned +
               ", deleted=" + deleted +
               ", failedToDelete=" + failedToDelete +
               '}';
    }
}
