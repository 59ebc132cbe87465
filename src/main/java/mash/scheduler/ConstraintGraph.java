// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.scheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import mash.tree.Event;
import mash.tree.Frame;
import mash.tree.Node;
import mash.tree.Phase;
import mash.util.UnreachableCodeReachedError;

/**
 * The events still to run in one pass and the constraints between them.
 * <p>
 * A graph is a snapshot: it is derived from the tree as it was when the pass began, and is thrown away when the
 * tree changes shape. Events that ran in earlier passes are left out, and so is every constraint touching them.
 */
final class ConstraintGraph {
    private ConstraintGraph() {
    }

    /**
     * Derives the graph of the live trees under the given roots, leaving out already executed events.
     */
    static ConstraintGraph plan(final Collection<Frame> roots, final Set<Event> executed) {
        final var graph = new ConstraintGraph();
        final var nodes = new ArrayList<Node>();
        for (final var root : roots) {
            root.enumerate(nodes);
        }
        for (final var node : nodes) {
            for (final var phase : Phase.values()) {
                final var event = node.event(phase);
                if (!executed.contains(event)) {
                    graph.predecessors.put(event, new HashSet<>());
                    graph.successors.put(event, new ArrayList<>());
                }
            }
        }
        for (final var root : roots) {
            root.emitConstraints((first, then) -> {
                if (executed.contains(first) || executed.contains(then)) {
                    return;
                }
                final var thenPredecessors = graph.predecessors.get(then);
                final var firstSuccessors = graph.successors.get(first);
                assert thenPredecessors != null && firstSuccessors != null : "Constraint refers to a node not in the tree";
                if (thenPredecessors.add(first)) {
                    firstSuccessors.add(then);
                }
            });
        }
        graph.predecessors.forEach((event, predecessors) -> {
            if (predecessors.isEmpty()) {
                graph.ready.add(event);
            }
        });
        return graph;
    }

    /**
     * Returns {@code true} iff no event is left to run.
     */
    boolean isDone() {
        return predecessors.isEmpty();
    }

    /**
     * Returns the number of events left to run.
     */
    int pendingCount() {
        return predecessors.size();
    }

    /**
     * Removes and returns up to {@code limit} ready events, lowest first.
     * <p>
     * Returns at least one event as long as the graph is not done; a graph with pending events and none of them
     * ready has a cycle, which the structural constraints never produce.
     */
    List<Event> takeReady(final int limit) {
        assert limit >= 1 : "Ready event limit must be positive";
        if (ready.isEmpty()) {
            throw new UnreachableCodeReachedError(
                "Constraint cycle: " + predecessors.size() + " events pending, none of them ready");
        }
        final var result = new ArrayList<Event>(Math.min(limit, ready.size()));
        while (result.size() < limit && !ready.isEmpty()) {
            result.add(ready.pollFirst());
        }
        return result;
    }

    /**
     * Marks the given event as run, making the events waiting only for it ready.
     */
    void complete(final Event event) {
        predecessors.remove(event);
        ready.remove(event);
        final var waiting = successors.remove(event);
        if (waiting == null) {
            return;
        }
        for (final var successor : waiting) {
            final var remaining = predecessors.get(successor);
            if (remaining != null && remaining.remove(event) && remaining.isEmpty()) {
                ready.add(successor);
            }
        }
    }

    private final HashMap<Event, Set<Event>> predecessors = new HashMap<>();
    private final HashMap<Event, List<Event>> successors = new HashMap<>();
    private final TreeSet<Event> ready = new TreeSet<>();
}
