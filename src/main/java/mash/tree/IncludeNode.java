// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import java.util.List;
import mash.document.Address;
import mash.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An {@code include <name>} directive standing alone in the code part of a frame.
 * <p>
 * Starting the node loads the named document and adopts its root as this node's subtree. The subtree then runs
 * between this node's start and finish.
 */
public final class IncludeNode extends Node {
    IncludeNode(final Address address, final String target) {
        super(address);
        this.target = target;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INCLUDE;
    }

    /**
     * Returns the name of the included document, as written.
     */
    public String target() {
        return target;
    }

    /**
     * Returns the root of the included document, or {@code null} if not loaded yet or empty.
     */
    public @Nullable Frame subtree() {
        return subtree;
    }

    @Override
    public PhaseOutcome start(final ExecutionContext context) {
        assert subtree == null : "Include node started twice";
        final Frame root;
        try (final var trace = new Trace(() -> "Including " + target + " at " + address())) {
            trace.use();
            root = context.includeLoader().load(this);
        }
        if (root == null) {
            return PhaseOutcome.UNCHANGED;
        }
        subtree = root;
        return PhaseOutcome.TREE_CHANGED;
    }

    @Override
    public PhaseOutcome finish(final ExecutionContext context) {
        return PhaseOutcome.UNCHANGED;
    }

    @Override
    public void enumerate(final List<Node> into) {
        super.enumerate(into);
        final var root = subtree;
        if (root != null) {
            root.enumerate(into);
        }
    }

    @Override
    public void emitConstraints(final ConstraintSink sink) {
        super.emitConstraints(sink);
        final var root = subtree;
        if (root != null) {
            sink.before(Event.start(this), Event.start(root));
            sink.before(Event.finish(root), Event.finish(this));
            root.emitConstraints(sink);
        }
    }

    @Override
    void render(final StringBuilder builder, final int depth) {
        renderLeaf(builder, depth, "@ include", target);
        final var root = subtree;
        if (root != null) {
            root.render(builder, depth + 1);
        }
    }

    private final String target;
    private @Nullable Frame subtree = null;
}
