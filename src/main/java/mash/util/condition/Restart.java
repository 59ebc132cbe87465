// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import mash.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named place to resume execution at, see {@link ConditionContext#withRestart(String, RestartCallback)}.
 * <p>
 * The command line establishes {@code abort-run} around the whole invocation, the runner {@code restart-run} around
 * each attempt, and the scheduler {@code skip-event} around every event of a concurrent wave.
 */
public final class Restart {
    Restart(final @NotNull String name) {
        owner = ConditionContext.current();
        this.name = name;
        next = owner.restartHead;
        owner.restartHead = this;
    }

    public @NotNull String name() {
        return name;
    }

    /**
     * Abandons everything established since this restart and resumes after it. Never returns.
     * <p>
     * Worker threads that adopted this restart may call this too: {@link mash.util.ExecutorUtils} carries the
     * unwind back to the thread that established the restart.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    @Override
    public @NotNull String toString() {
        return "restart " + name;
    }

    void unlink() {
        assert owner == ConditionContext.current() : "Restart removed by a foreign thread";
        assert owner.restartHead == this : "Restarts removed out of order";
        owner.restartHead = next;
    }

    final @Nullable Restart next;
    private final @NotNull ConditionContext owner;
    private final @NotNull String name;
}
