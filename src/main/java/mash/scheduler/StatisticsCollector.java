// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.scheduler;

import java.time.Duration;
import java.util.EnumMap;
import mash.tree.NodeKind;

/**
 * Counts started nodes and passes while a run is in progress. Safe to use from several workers at once.
 */
public final class StatisticsCollector {
    /**
     * Initializes a collector whose clock starts now.
     */
    public StatisticsCollector() {
        startTime = System.nanoTime();
    }

    /**
     * Records that a node of the given kind started.
     */
    public synchronized void recordStart(final NodeKind kind) {
        counts.merge(kind, 1, Integer::sum);
    }

    /**
     * Records that a new pass began.
     */
    public synchronized void recordPass() {
        passes += 1;
    }

    /**
     * Returns the statistics collected so far, with the time elapsed since this collector was created.
     */
    public synchronized Statistics snapshot() {
        return new Statistics(counts, passes, Duration.ofNanos(System.nanoTime() - startTime));
    }

    private final long startTime;
    private final EnumMap<NodeKind, Integer> counts = new EnumMap<>(NodeKind.class);
    private int passes = 0;
}
