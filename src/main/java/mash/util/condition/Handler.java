// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A handler procedure pushed onto the calling thread's handler chain for the extent of a try-with-resources block.
 */
public final class Handler implements AutoCloseable {
    /**
     * Pushes the given procedure; it sees every condition signaled until this handler is closed.
     */
    public Handler(final @NotNull HandlerProcedure procedure) {
        owner = ConditionContext.current();
        this.procedure = procedure;
        next = owner.handlerHead;
        owner.handlerHead = this;
    }

    /**
     * Does nothing. Referencing the resource silences warnings about unused try-with-resources variables.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    /**
     * Pops this handler. Handlers are popped in reverse order of creation, by the thread that pushed them.
     */
    @Override
    public void close() {
        assert owner == ConditionContext.current() : "Handler popped by a foreign thread";
        assert owner.handlerHead == this : "Handlers popped out of order";
        owner.handlerHead = next;
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    // Adopted chains reach worker threads; only thread-safe procedures may run there.
    boolean usableIn(final @NotNull ConditionContext context) {
        return context == owner || procedure instanceof HandlerProcedure.ThreadSafe;
    }

    final @Nullable Handler next;
    private final @NotNull ConditionContext owner;
    private final @NotNull HandlerProcedure procedure;
}
