// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A condition and restart system in the style of Common Lisp.
 * <p>
 * Every failure mash reports (structural parse errors, missing includes, fragment evaluation errors) is a
 * {@link mash.util.condition.Condition} signaled through {@link mash.util.condition.ConditionContext}; the command
 * line interface and the run loop decide what happens next by unwinding to a {@link mash.util.condition.Restart}.
 */
@NonNullByDefault
package mash.util.condition;

import mash.util.annotation.NonNullByDefault;
