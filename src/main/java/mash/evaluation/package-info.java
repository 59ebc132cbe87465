// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The boundary between the scheduler and whatever runs the source of code fragments.
 * <p>
 * The scheduler hands every code fragment to an {@link mash.evaluation.Evaluator} together with the single
 * {@link mash.evaluation.Scope} shared by the whole run. {@link mash.evaluation.BuiltinEvaluator} implements a tiny
 * statement language so documents can be woven without any other evaluation substrate.
 */
@NonNullByDefault
package mash.evaluation;

import mash.util.annotation.NonNullByDefault;
