// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.scheduler;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import mash.tree.NodeKind;

/**
 * The outcome of a successful run: how many nodes of every kind started, how many passes it took, and how long.
 */
public record Statistics(Map<NodeKind, Integer> counts, int passes, Duration elapsed) {
    public Statistics {
        final var copy = new EnumMap<NodeKind, Integer>(NodeKind.class);
        copy.putAll(counts);
        counts = Map.copyOf(copy);
    }

    /**
     * Returns how many nodes of the given kind started.
     */
    public int count(final NodeKind kind) {
        return counts.getOrDefault(kind, 0);
    }

    /**
     * Returns the number of started nodes of all kinds.
     */
    public int total() {
        var total = 0;
        for (final var kind : NodeKind.values()) {
            total += count(kind);
        }
        return total;
    }

    @Override
    public String toString() {
        return String.format(
            Locale.ROOT,
            "%d frames; %d+%d leaves; %d includes; %d passes; %.2f seconds",
            count(NodeKind.FRAME),
            count(NodeKind.CODE),
            count(NodeKind.TEXT),
            count(NodeKind.INCLUDE),
            passes,
            elapsed.toNanos() / 1e9
        );
    }
}
