// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined the fatal condition.
 * <p>
 * Nobody being prepared for a fatal condition is a programming error, hence an {@link AssertionError}.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Returns the condition nobody handled.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
