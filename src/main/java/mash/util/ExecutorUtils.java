// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import mash.util.condition.ConditionContext;
import mash.util.condition.Unwind;
import mash.util.function.ThrowingConsumer;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Helpers for running a batch of tasks on an {@link ExecutorService} and waiting for all of them.
 */
public final class ExecutorUtils {
    private ExecutorUtils() {
    }

    /**
     * Applies the given consumer to every element of the collection, concurrently, and waits for all of them.
     * <p>
     * Tasks are submitted in iteration order. Every task inherits the caller's {@link ConditionContext} state, so
     * thread-safe handlers and restarts established by the caller stay in effect inside the workers. An unwind to
     * one of the caller's restarts that escapes a task continues in the calling thread; runtime exceptions and
     * errors are rethrown as they are. Once one task fails, the tasks that have not started yet never start, the
     * running ones are interrupted, and this method returns only after all of them have stopped.
     */
    public static <T> void forEach(
        final @NotNull ExecutorService executorService,
        final @NotNull Collection<? extends T> collection,
        final @NotNull ThrowingConsumer<? super T, Unwind> consumer
    ) throws Unwind, InterruptedException {
        final var snapshot = ConditionContext.snapshot();
        final var tasks = new ArrayList<@NotNull Task>(collection.size());
        for (final var element : collection) {
            final var task = new Task();
            task.future = executorService.submit(() -> {
                if (!task.claim()) {
                    return null;
                }
                try (
                    final var adoption = snapshot.adopt();
                    final var trace = new Trace(() -> "Running a task in thread " + Thread.currentThread().getName())
                ) {
                    adoption.use();
                    trace.use();
                    consumer.accept(element);
                    return null;
                } catch (final Unwind u) {
                    // Unwind is neither checked Exception nor Error, so it has to be wrapped to cross the future.
                    throw new UnwindException(u);
                } finally {
                    task.stopped.countDown();
                }
            });
            tasks.add(task);
        }
        awaitAll(tasks);
    }

    private static void awaitAll(final @NotNull ArrayList<@NotNull Task> tasks) throws Unwind, InterruptedException {
        var index = 0;
        try {
            var foundInterrupt = false;
            for (; index < tasks.size(); index += 1) {
                try {
                    tasks.get(index).future().get();
                } catch (final ExecutionException e) {
                    foundInterrupt |= recover(e);
                }
            }
            if (foundInterrupt) {
                throw new AssertionError("A task was interrupted, but no other task threw anything concrete");
            }
        } finally {
            abandon(tasks, index);
        }
    }

    // A task still running after its batch failed could act on state its caller is about to discard.
    private static void abandon(final @NotNull ArrayList<@NotNull Task> tasks, final int from) {
        var interrupted = false;
        for (var i = from; i < tasks.size(); i += 1) {
            final var task = tasks.get(i);
            task.future().cancel(true);
            if (task.claim()) {
                continue;
            }
            while (true) {
                try {
                    task.stopped.await();
                    break;
                } catch (final InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    // Returns true if the failure was a mere interruption, so that a more concrete failure can be looked for.
    private static boolean recover(final @NotNull ExecutionException executionException) throws Unwind {
        final var cause = executionException.getCause();
        if (cause instanceof final UnwindException unwind) {
            throw unwind.unwind;
        } else if (cause instanceof InterruptedException || cause instanceof UncheckedInterruptedException) {
            return true;
        } else if (cause instanceof final Error error) {
            throw error;
        } else if (cause instanceof final RuntimeException runtimeException) {
            throw runtimeException;
        } else {
            throw new AssertionError("An exception escaped from a worker through a future", cause);
        }
    }

    private static final class Task {
        // Whoever wins decides: the worker runs the task, the caller abandoning the batch keeps it from ever starting.
        boolean claim() {
            return claimed.compareAndSet(false, true);
        }

        @NotNull Future<?> future() {
            final var result = future;
            assert result != null : "Task awaited before submission";
            return result;
        }

        private @Nullable Future<?> future = null;
        private final AtomicBoolean claimed = new AtomicBoolean(false);
        private final CountDownLatch stopped = new CountDownLatch(1);
    }

    private static final class UnwindException extends Exception {
        private UnwindException(final @NotNull Unwind unwind) {
            this.unwind = unwind;
        }

        private final transient @NotNull Unwind unwind;
    }
}
