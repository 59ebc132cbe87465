// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link Handler} receives: the condition and whether it was signaled as fatal.
 *
 * @param condition The condition being signaled.
 * @param isFatal   {@code true} iff the condition was signaled with {@link ConditionContext#error(Condition)}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
