// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import java.util.Objects;
import mash.document.Address;
import mash.evaluation.EvaluationErrorCondition;
import mash.evaluation.EvaluationException;
import mash.evaluation.Fragment;
import mash.evaluation.Fragments;
import mash.util.Trace;
import mash.util.condition.ConditionContext;

/**
 * A code fragment, i.e. text before the separator of a frame.
 * <p>
 * Starting a code leaf evaluates it and replaces it with an empty placeholder, so a code leaf leaves the tree as
 * soon as it ran.
 */
public final class CodeLeaf extends Node {
    CodeLeaf(final Address address, final String source) {
        super(address);
        this.source = source;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CODE;
    }

    /**
     * Returns the fragment source as written in the document, indentation included.
     */
    public String source() {
        return source;
    }

    /**
     * Evaluates the de-indented fragment while holding the scope lock.
     * <p>
     * Evaluation errors are signaled as fatal {@link EvaluationErrorCondition}s, with the failing line translated
     * into a line of the document.
     */
    @Override
    public PhaseOutcome start(final ExecutionContext context) {
        final var parent = Objects.requireNonNull(parent(), "Code leaf has no enclosing frame");
        final var fragment = new Fragment(Fragments.unindent(source), address(), parent);
        try (final var trace = new Trace(() -> "Evaluating the code fragment at " + address())) {
            trace.use();
            final var scope = context.scope();
            try {
                scope.exclusively(() -> context.evaluator().evaluate(fragment, scope));
            } catch (final EvaluationException e) {
                final var message = Objects.requireNonNullElse(e.getMessage(), "Evaluation failed");
                final var location = address().fragmentLine(e.fragmentLine());
                throw ConditionContext.error(new EvaluationErrorCondition(message, location));
            }
        }
        parent.replace(this, TextLeaf.placeholder(address()));
        return PhaseOutcome.UNCHANGED;
    }

    @Override
    public PhaseOutcome finish(final ExecutionContext context) {
        return PhaseOutcome.UNCHANGED;
    }

    @Override
    void render(final StringBuilder builder, final int depth) {
        renderLeaf(builder, depth, "*", source);
    }

    private final String source;
}
