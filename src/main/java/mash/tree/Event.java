// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One phase of one node.
 * <p>
 * Events are identified by the node's identity and the phase, and ordered by the same pair, so the order of events
 * follows the order in which their nodes were created.
 */
public record Event(Node node, Phase phase) implements Comparable<Event> {
    /**
     * Returns the {@code START} event of the given node.
     */
    public static Event start(final Node node) {
        return new Event(node, Phase.START);
    }

    /**
     * Returns the {@code FINISH} event of the given node.
     */
    public static Event finish(final Node node) {
        return new Event(node, Phase.FINISH);
    }

    /**
     * Runs this event's phase callback.
     */
    public PhaseOutcome run(final ExecutionContext context) {
        return switch (phase) {
            case START -> node.start(context);
            case FINISH -> node.finish(context);
        };
    }

    @Override
    public int compareTo(final Event other) {
        final var byIdentity = Long.compare(node.identity(), other.node.identity());
        return (byIdentity != 0) ? byIdentity : phase.compareTo(other.phase);
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        return other instanceof final Event event && node.identity() == event.node.identity() && phase == event.phase;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(node.identity()) * 2 + phase.ordinal();
    }

    @Override
    public String toString() {
        return phase + " " + node.kind() + "#" + node.identity() + " at " + node.address();
    }
}
