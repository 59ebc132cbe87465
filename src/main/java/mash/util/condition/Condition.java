// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type of everything that can be signaled through the {@link ConditionContext}.
 * <p>
 * A condition describes a situation, not a way out of it. Handlers run on top of the stack of the code that signaled
 * the condition, before anything is unwound, so they can still see every {@link Restart} established below the
 * signaling point and choose where control flow continues.
 */
public abstract class Condition {
    /**
     * Initializes a condition with the given user-readable message.
     */
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Returns the short user-readable message of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Returns the full user-readable description of this condition, including the source location where one exists.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
