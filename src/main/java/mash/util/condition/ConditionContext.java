// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import java.util.ArrayList;
import java.util.List;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import mash.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point of the condition system: signaling, restart points and hand-over of state to worker threads.
 * <p>
 * Every thread has its own chain of {@link Handler}s and chain of {@link Restart}s, both kept as singly linked
 * lists with the newest entry at the head. The static methods always operate on the calling thread's chains.
 * The scheduler runs independent events on a thread pool; those workers start out empty and pick up the
 * coordinator's chains through a {@link Snapshot}.
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers a non-fatal condition to the handlers, newest first.
     * <p>
     * Returns normally if no handler transfers control. A handler that unwinds to a restart makes this method throw
     * {@link Unwind} without declaring it.
     */
    public static void signal(final @NotNull Condition condition) {
        current().dispatch(new SignaledCondition(condition, false));
    }

    /**
     * Offers a fatal condition to the handlers, newest first.
     * <p>
     * Never returns: if no handler transfers control, {@link UnhandledErrorError} is thrown. Callers write
     * {@code throw ConditionContext.error(...)} so that the compiler sees the end of the control flow.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        current().dispatch(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Establishes a restart called {@code restartName} for the duration of {@code body}.
     *
     * @return What {@code body} returned, or {@code null} when some handler unwound to the new restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> body
    ) {
        final var restart = new Restart(restartName);
        try {
            return body.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() == restart) {
                return null;
            }
            throw SneakyThrow.doThrow(unwind);
        } finally {
            restart.unlink();
        }
    }

    /**
     * Lists the restarts the calling thread can unwind to. The newest comes first, the outermost last.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var result = new ArrayList<@NotNull Restart>();
        for (var restart = current().restartHead; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    /**
     * Finds the newest visible restart with the given name.
     *
     * @return The restart, or {@code null} if none of that name is visible.
     */
    public static @Nullable Restart findRestart(final @NotNull String name) {
        for (var restart = current().restartHead; restart != null; restart = restart.next) {
            if (restart.name().equals(name)) {
                return restart;
            }
        }
        return null;
    }

    /**
     * Captures the calling thread's handlers and restarts for adoption by a worker thread.
     * <p>
     * Handlers not marked {@link HandlerProcedure.ThreadSafe} travel along but stay inert outside their own thread.
     */
    @CheckReturnValue
    public static @NotNull Snapshot snapshot() {
        final var context = current();
        return new Snapshot(context.handlerHead, context.restartHead);
    }

    static @NotNull ConditionContext current() {
        return perThread.get();
    }

    private void dispatch(final @NotNull SignaledCondition condition) {
        // A handler that signals from inside handle() only reaches the handlers older than itself.
        var candidate = (running != null) ? running.next : handlerHead;
        final var outer = running;
        try {
            for (; candidate != null; candidate = candidate.next) {
                if (candidate.usableIn(this)) {
                    running = candidate;
                    candidate.handle(condition);
                }
            }
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        } finally {
            running = outer;
        }
    }

    @Nullable Handler handlerHead = null;
    @Nullable Restart restartHead = null;
    private @Nullable Handler running = null;

    private static final ThreadLocal<@NotNull ConditionContext> perThread =
        ThreadLocal.withInitial(ConditionContext::new);

    /**
     * Handlers and restarts captured by {@link #snapshot()}.
     */
    public static final class Snapshot {
        private Snapshot(final @Nullable Handler handlerHead, final @Nullable Restart restartHead) {
            this.handlerHead = handlerHead;
            this.restartHead = restartHead;
        }

        /**
         * Installs the captured chains in the calling thread, which must not have any handlers or restarts of its
         * own. Closing the returned adoption empties the thread's chains again.
         */
        @CheckReturnValue
        public @NotNull Adoption adopt() {
            final var context = current();
            assert context.handlerHead == null && context.restartHead == null
                : "Snapshot adopted by a thread with its own handlers or restarts";
            context.handlerHead = handlerHead;
            context.restartHead = restartHead;
            return new Adoption(context);
        }

        private final @Nullable Handler handlerHead;
        private final @Nullable Restart restartHead;
    }

    /**
     * A snapshot installed in a worker thread, released with try-with-resources.
     */
    public static final class Adoption implements AutoCloseable {
        private Adoption(final @NotNull ConditionContext context) {
            this.context = context;
        }

        /**
         * Does nothing. Referencing the resource silences warnings about unused try-with-resources variables.
         */
        @SuppressWarnings("EmptyMethod")
        public void use() {
        }

        @Override
        public void close() {
            assert context == current() : "Adoption released by a different thread";
            context.handlerHead = null;
            context.restartHead = null;
        }

        private final @NotNull ConditionContext context;
    }
}
