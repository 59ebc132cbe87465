// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import mash.evaluation.Evaluator;
import mash.evaluation.Scope;

/**
 * Everything phase callbacks need from the run they are part of.
 *
 * @param scope         The variables shared by every code fragment of the run.
 * @param evaluator     Evaluates code fragments.
 * @param includeLoader Loads included documents.
 */
public record ExecutionContext(Scope scope, Evaluator evaluator, IncludeLoader includeLoader) {
}
