// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

/**
 * Runs the source of one code fragment.
 * <p>
 * Implementations may read and modify the given scope; the caller holds the scope's lock for the whole call. Errors
 * are reported by throwing {@link EvaluationException} with a line number relative to the fragment; the caller maps
 * it back to the document. An evaluator that wants the whole run to start over signals a
 * {@link RestartRequestCondition}.
 */
@FunctionalInterface
public interface Evaluator {
    void evaluate(Fragment fragment, Scope scope) throws EvaluationException;
}
