// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import mash.document.Address;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A region of a document delimited by {@code [[[} and {@code ]]]}, or the whole document for roots.
 * <p>
 * Text before the separator is code, text after it is literal. Once every literal child finished, their text is
 * available as the frame's composed text, which the frame's own code fragments can refer to.
 */
public final class Frame extends Node {
    private Frame(final Address address, final boolean separated) {
        super(address);
        this.separated = separated;
    }

    /**
     * Returns a new document root. Roots are always separated: everything at the top level is literal text.
     */
    public static Frame root(final Address address) {
        return new Frame(address, true);
    }

    /**
     * Returns a new, still unseparated, nested frame.
     */
    public static Frame nested(final Address address) {
        return new Frame(address, false);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FRAME;
    }

    /**
     * Returns a read-only view of the current children, in document order.
     */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Returns {@code true} iff the separator of this frame was seen.
     */
    public boolean isSeparated() {
        return separated;
    }

    /**
     * Returns the text composed so far from this frame's literal children.
     */
    public String composedText() {
        return composedText.toString();
    }

    @Override
    public PhaseOutcome start(final ExecutionContext context) {
        return PhaseOutcome.UNCHANGED;
    }

    /**
     * Reaps the remaining literal children into the composed text.
     * <p>
     * By the time a frame finishes, its own text leaves already surfaced their text; what is left are the
     * placeholders of code leaves that ran.
     */
    @Override
    public PhaseOutcome finish(final ExecutionContext context) {
        var reaped = false;
        final var iterator = children.iterator();
        while (iterator.hasNext()) {
            final var child = iterator.next();
            if (child instanceof final TextLeaf leaf) {
                composedText.append(leaf.content());
                iterator.remove();
                leaf.detach();
                reaped = true;
            }
        }
        return reaped ? PhaseOutcome.TREE_CHANGED : PhaseOutcome.UNCHANGED;
    }

    @Override
    public void enumerate(final List<Node> into) {
        super.enumerate(into);
        for (final var child : children) {
            child.enumerate(into);
        }
    }

    /**
     * Emits, besides the constraints of the children themselves, that the frame starts before and finishes after
     * every child, and that the children run one after another: first every non-code child, then every code leaf,
     * each group in document order.
     */
    @Override
    public void emitConstraints(final ConstraintSink sink) {
        super.emitConstraints(sink);
        final var ordered = new ArrayList<Node>(children.size());
        for (final var child : children) {
            if (child.isScheduled() && !(child instanceof CodeLeaf)) {
                ordered.add(child);
            }
        }
        for (final var child : children) {
            if (child instanceof CodeLeaf) {
                ordered.add(child);
            }
        }
        @Nullable Node previous = null;
        for (final var child : ordered) {
            sink.before(Event.start(this), Event.start(child));
            sink.before(Event.finish(child), Event.finish(this));
            if (previous != null) {
                sink.before(Event.finish(previous), Event.start(child));
            }
            child.emitConstraints(sink);
            previous = child;
        }
    }

    @Override
    void render(final StringBuilder builder, final int depth) {
        indent(builder, depth);
        builder.append("[[[\n");
        for (final var child : children) {
            child.render(builder, depth + 1);
        }
        indent(builder, depth);
        builder.append("]]]\n");
    }

    void add(final Node child) {
        child.attachTo(this);
        children.add(child);
    }

    void markSeparated() {
        assert !separated : "Frame separated twice";
        separated = true;
    }

    void appendText(final String text) {
        composedText.append(text);
    }

    void remove(final Node child) {
        final var removed = children.remove(child);
        assert removed : "Attempted to remove a node that is not a child";
        child.detach();
    }

    void replace(final Node child, final Node replacement) {
        final var index = children.indexOf(child);
        assert index >= 0 : "Attempted to replace a node that is not a child";
        replacement.attachTo(this);
        children.set(index, replacement);
        child.detach();
    }

    private final ArrayList<Node> children = new ArrayList<>();
    private final StringBuilder composedText = new StringBuilder();
    private boolean separated;
}
