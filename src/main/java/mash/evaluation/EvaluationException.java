// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

/**
 * Thrown by an {@link Evaluator} when a fragment fails.
 */
public final class EvaluationException extends Exception {
    /**
     * Initializes an exception with the evaluator's own message and the failing line, counted from 1 at the start
     * of the fragment. Use 0 when the line is unknown.
     */
    public EvaluationException(final String message, final int fragmentLine) {
        super(message);
        this.fragmentLine = fragmentLine;
    }

    /**
     * Same as {@link #EvaluationException(String, int)}, keeping the evaluator's underlying failure as the cause.
     */
    public EvaluationException(final String message, final int fragmentLine, final Throwable cause) {
        super(message, cause);
        this.fragmentLine = fragmentLine;
    }

    /**
     * Returns the failing line relative to the fragment, or 0 if unknown.
     */
    public int fragmentLine() {
        return fragmentLine;
    }

    private final int fragmentLine;
}
