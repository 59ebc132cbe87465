// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import mash.document.Address;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The base class of document tree nodes.
 * <p>
 * Every node has a unique identity, assigned in creation order and never reused, so the scheduler can remember which
 * events already ran even after the tree is rebuilt around them. A node's parent is the frame that owns it; the root
 * of a document has no parent, not even when it is the subtree of an {@link IncludeNode}.
 */
public abstract sealed class Node permits Frame, TextLeaf, CodeLeaf, IncludeNode {
    Node(final Address address) {
        this.address = address;
        identity = nextIdentity.getAndIncrement();
    }

    /**
     * Returns the unique identity of this node.
     */
    public final long identity() {
        return identity;
    }

    /**
     * Returns where this node starts in its document.
     */
    public final Address address() {
        return address;
    }

    /**
     * Returns the frame that owns this node, or {@code null} for document roots and nodes removed from the tree.
     */
    public final @Nullable Frame parent() {
        return parent;
    }

    /**
     * Returns {@code true} iff this node was removed from its parent.
     */
    public final boolean isDetached() {
        return detached;
    }

    /**
     * Returns the kind of this node.
     */
    public abstract NodeKind kind();

    /**
     * Returns the given phase of this node as an event.
     */
    public final Event event(final Phase phase) {
        return new Event(this, phase);
    }

    /**
     * Runs the start phase of this node.
     */
    public abstract PhaseOutcome start(ExecutionContext context);

    /**
     * Runs the finish phase of this node.
     */
    public abstract PhaseOutcome finish(ExecutionContext context);

    /**
     * Adds this node and every live node below it to the given list, parents before children.
     */
    public void enumerate(final List<Node> into) {
        into.add(this);
    }

    /**
     * Emits the ordering constraints of this node and of every live node below it.
     */
    public void emitConstraints(final ConstraintSink sink) {
        sink.before(Event.start(this), Event.finish(this));
    }

    /**
     * Returns an indented, human-readable rendering of the subtree rooted at this node.
     */
    public final String render() {
        final var builder = new StringBuilder();
        render(builder, 0);
        return builder.toString();
    }

    abstract void render(StringBuilder builder, int depth);

    boolean isScheduled() {
        return true;
    }

    final void attachTo(final Frame newParent) {
        assert parent == null && !detached : "Attempted to attach a node that already has a place in the tree";
        parent = newParent;
    }

    final void detach() {
        parent = null;
        detached = true;
    }

    static void indent(final StringBuilder builder, final int depth) {
        builder.append("  ".repeat(depth));
    }

    static void renderLeaf(final StringBuilder builder, final int depth, final String marker, final String content) {
        indent(builder, depth);
        builder.append(marker).append(' ').append(quote(content)).append('\n');
    }

    static String quote(final String text) {
        final var builder = new StringBuilder(text.length() + 2);
        builder.append('\'');
        for (int i = 0; i < text.length(); i += 1) {
            final var c = text.charAt(i);
            switch (c) {
                case '\n' -> builder.append("\\n");
                case '\t' -> builder.append("\\t");
                case '\\' -> builder.append("\\\\");
                case '\'' -> builder.append("\\'");
                default -> builder.append(c);
            }
        }
        return builder.append('\'').toString();
    }

    private static final AtomicLong nextIdentity = new AtomicLong(1);

    private final long identity;
    private final Address address;
    private @Nullable Frame parent = null;
    private boolean detached = false;
}
