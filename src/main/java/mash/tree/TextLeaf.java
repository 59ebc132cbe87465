// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import java.util.List;
import mash.document.Address;

/**
 * Literal text.
 * <p>
 * A text leaf is either real document text, which surfaces into its parent's composed text when it finishes, or the
 * empty placeholder left behind by a code leaf that ran. Placeholders are not scheduled; they only keep the code
 * leaf's place until the frame reaps them.
 */
public final class TextLeaf extends Node {
    private TextLeaf(final Address address, final String content, final boolean placeholder) {
        super(address);
        this.content = content;
        this.placeholder = placeholder;
    }

    /**
     * Returns a new text leaf holding the given document text.
     */
    public static TextLeaf of(final Address address, final String content) {
        return new TextLeaf(address, content, false);
    }

    static TextLeaf placeholder(final Address address) {
        return new TextLeaf(address, "", true);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TEXT;
    }

    /**
     * Returns the text of this leaf.
     */
    public String content() {
        return content;
    }

    /**
     * Returns {@code true} iff this leaf stands in for a code leaf that already ran.
     */
    public boolean isPlaceholder() {
        return placeholder;
    }

    @Override
    public PhaseOutcome start(final ExecutionContext context) {
        return PhaseOutcome.UNCHANGED;
    }

    /**
     * Appends the text to the parent's composed text and leaves the tree.
     * <p>
     * Nothing can be scheduled after a text leaf that is not already known, so leaving is not a tree change.
     */
    @Override
    public PhaseOutcome finish(final ExecutionContext context) {
        final var parent = parent();
        if (parent != null) {
            parent.appendText(content);
            parent.remove(this);
        }
        return PhaseOutcome.UNCHANGED;
    }

    @Override
    public void enumerate(final List<Node> into) {
        if (!placeholder) {
            super.enumerate(into);
        }
    }

    @Override
    public void emitConstraints(final ConstraintSink sink) {
        if (!placeholder) {
            super.emitConstraints(sink);
        }
    }

    @Override
    boolean isScheduled() {
        return !placeholder;
    }

    @Override
    void render(final StringBuilder builder, final int depth) {
        renderLeaf(builder, depth, placeholder ? "-" : ".", content);
    }

    private final String content;
    private final boolean placeholder;
}
