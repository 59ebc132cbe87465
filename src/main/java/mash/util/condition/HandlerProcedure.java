// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The code run by a {@link Handler} for every signaled condition.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Looks at the given condition and either declines it by returning normally, or handles it by transferring
     * control elsewhere, typically with {@link Restart#unwindTo()}.
     */
    void handle(@NotNull SignaledCondition condition) throws Unwind;

    /**
     * A handler procedure that may run in any thread.
     * <p>
     * Handlers reach worker threads through {@link ConditionContext#snapshot()}, but only thread-safe ones run there.
     */
    @FunctionalInterface
    interface ThreadSafe extends HandlerProcedure {
    }
}
