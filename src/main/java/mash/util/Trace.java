// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import mash.util.condition.MessageSupplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One line of the operation trace shown next to a fatal condition, such as
 * "Including lib.mash at (doc.mash, line 4, pos 5)", kept alive by a try-with-resources block.
 * <p>
 * Traces form a per-thread stack. A trace is closed by the thread that opened it, innermost first.
 */
public final class Trace implements AutoCloseable {
    /**
     * Opens a trace whose message is built on first request, at most once.
     */
    public Trace(final MessageSupplier supplier) {
        this(supplier, null);
    }

    /**
     * Opens a trace with a ready-made message.
     */
    public Trace(final String message) {
        this(null, message);
    }

    private Trace(final @Nullable MessageSupplier supplier, final @Nullable String message) {
        this.supplier = supplier;
        this.message = message;
        stack = perThread.get();
        outer = stack.innermost;
        stack.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's open traces, innermost first.
     * <p>
     * The result is a copy, so it can be carried out of a worker thread and reported after the traces are closed.
     */
    @CheckReturnValue
    public static List<String> snapshot() {
        final var result = new ArrayList<String>();
        for (var trace = perThread.get().innermost; trace != null; trace = trace.outer) {
            result.add(trace.message());
        }
        return result;
    }

    /**
     * Does nothing. Referencing the resource silences warnings about unused try-with-resources variables.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert stack == perThread.get() : "Trace closed by a foreign thread";
        assert stack.innermost == this : "Traces closed out of order";
        stack.innermost = outer;
    }

    private String message() {
        var result = message;
        if (result == null) {
            final var pending = supplier;
            assert pending != null;
            result = pending.get();
            message = result;
            supplier = null;
        }
        return result;
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<Stack> perThread = ThreadLocal.withInitial(Stack::new);

    private final Stack stack;
    private final @Nullable Trace outer;
    private @Nullable MessageSupplier supplier;
    private @Nullable String message;

    private static final class Stack {
        private @Nullable Trace innermost = null;
    }
}
