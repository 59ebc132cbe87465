// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.scheduler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import mash.tree.Event;
import mash.tree.ExecutionContext;
import mash.tree.Frame;
import mash.tree.Phase;
import mash.tree.PhaseOutcome;
import mash.util.ExecutorUtils;
import mash.util.SneakyThrow;
import mash.util.Trace;
import mash.util.UncheckedInterruptedException;
import mash.util.condition.Condition;
import mash.util.condition.ConditionContext;
import mash.util.condition.Handler;
import mash.util.condition.Unwind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Runs the start and finish phases of every node of one or more trees exactly once, in an order that respects the
 * structural constraints, re-planning whenever the trees change shape.
 * <p>
 * Among simultaneously ready events, the one with the lowest node identity runs first, start before finish. A
 * scheduler with a parallelism above 1 takes up to that many ready events at once and runs them on its executor;
 * only events from independent trees are ever ready together, since the constraints order every tree completely.
 * All bookkeeping happens in the thread that called {@link #execute}.
 */
public final class Scheduler {
    /**
     * Initializes a scheduler that runs every event in the calling thread.
     */
    public Scheduler(final ExecutionContext context, final EventObserver observer) {
        this(context, observer, null, 1);
    }

    /**
     * Initializes a scheduler that runs up to {@code parallelism} ready events at once on the given executor.
     */
    public Scheduler(
        final ExecutionContext context,
        final EventObserver observer,
        final @Nullable ExecutorService executorService,
        final int parallelism
    ) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
        }
        if (parallelism > 1 && executorService == null) {
            throw new IllegalArgumentException("Concurrent execution requires an executor");
        }
        this.context = context;
        this.observer = observer;
        this.executorService = executorService;
        this.parallelism = parallelism;
    }

    /**
     * Executes the given trees to completion.
     * <p>
     * Failures are signaled as fatal conditions by the failing phase; when several independent events fail in the
     * same concurrent wave, they are signaled together as one {@link AggregateFailureCondition}.
     *
     * @return The statistics of the run.
     */
    public Statistics execute(final Collection<Frame> roots) {
        final var statistics = new StatisticsCollector();
        final var executed = new HashSet<Event>();
        var pass = 0;
        while (true) {
            final var graph = ConstraintGraph.plan(roots, executed);
            if (graph.isDone()) {
                return statistics.snapshot();
            }
            pass += 1;
            statistics.recordPass();
            observer.passStarted(pass, graph.pendingCount());
            try (final var trace = new Trace("Executing pass " + pass)) {
                trace.use();
                runPass(graph, executed, statistics);
            }
        }
    }

    private void runPass(final ConstraintGraph graph, final HashSet<Event> executed, final StatisticsCollector statistics) {
        while (!graph.isDone()) {
            final var wave = graph.takeReady(parallelism);
            final var steps = (wave.size() == 1) ? List.of(step(wave.get(0), statistics)) : runWave(wave, statistics);
            var changed = false;
            for (final var step : steps) {
                record(step.event(), step.outcome(), graph, executed);
                final var followUp = step.followUp();
                if (followUp != null) {
                    record(followUp, PhaseOutcome.UNCHANGED, graph, executed);
                }
                changed |= step.outcome() == PhaseOutcome.TREE_CHANGED;
            }
            if (changed) {
                return;
            }
        }
    }

    private void record(
        final Event event,
        final PhaseOutcome outcome,
        final ConstraintGraph graph,
        final HashSet<Event> executed
    ) {
        final var added = executed.add(event);
        assert added : "Event executed twice: " + event;
        graph.complete(event);
        observer.eventExecuted(event, outcome);
    }

    private List<Step> runWave(final List<Event> wave, final StatisticsCollector statistics) {
        final var executor = executorService;
        assert executor != null : "Concurrent wave without an executor";
        final var steps = new ArrayList<Step>(wave.size());
        final var failures = new ArrayList<Failure>();
        try {
            ExecutorUtils.forEach(executor, wave, event -> {
                ConditionContext.withRestart("skip-event", restart -> {
                    try (final var handler = new Handler(signaled -> {
                        if (signaled.isFatal()) {
                            synchronized (failures) {
                                failures.add(new Failure(event, signaled.condition(), Trace.snapshot()));
                            }
                            restart.unwindTo();
                        }
                    })) {
                        handler.use();
                        final var step = step(event, statistics);
                        synchronized (steps) {
                            steps.add(step);
                        }
                    }
                    return null;
                });
            });
        } catch (final Unwind unwind) {
            throw SneakyThrow.doThrow(unwind);
        } catch (final InterruptedException e) {
            throw new UncheckedInterruptedException(e);
        }
        if (failures.size() == 1) {
            final var failure = failures.get(0);
            final var workerTrace = String.join(" <- ", failure.trace());
            try (final var trace = new Trace(() -> "Re-signaling from worker: " + workerTrace)) {
                trace.use();
                throw ConditionContext.error(failure.condition());
            }
        } else if (!failures.isEmpty()) {
            failures.sort(Comparator.comparing(Failure::event));
            final var conditions = new ArrayList<Condition>(failures.size());
            final var traces = new ArrayList<List<String>>(failures.size());
            for (final var failure : failures) {
                conditions.add(failure.condition());
                traces.add(failure.trace());
            }
            throw ConditionContext.error(new AggregateFailureCondition(conditions, traces));
        }
        steps.sort(Comparator.comparing(Step::event));
        return steps;
    }

    // Runs in a worker when the wave is concurrent.
    private Step step(final Event event, final StatisticsCollector statistics) {
        final var node = event.node();
        if (event.phase() == Phase.START) {
            statistics.recordStart(node.kind());
        }
        final var outcome = event.run(context);
        if (event.phase() == Phase.START && node.isDetached()) {
            // A node that left the tree by starting is not enumerated again, so its finish has to run right away.
            final var finish = Event.finish(node);
            finish.run(context);
            return new Step(event, outcome, finish);
        }
        return new Step(event, outcome, null);
    }

    private final ExecutionContext context;
    private final EventObserver observer;
    private final @Nullable ExecutorService executorService;
    private final int parallelism;

    private record Step(Event event, PhaseOutcome outcome, @Nullable Event followUp) {
    }

    private record Failure(Event event, Condition condition, List<String> trace) {
    }
}
