// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.run;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import mash.evaluation.Evaluator;
import mash.evaluation.RestartRequestCondition;
import mash.evaluation.Scope;
import mash.include.IncludeResolver;
import mash.scheduler.Scheduler;
import mash.scheduler.Statistics;
import mash.tree.DocumentParser;
import mash.tree.ExecutionContext;
import mash.tree.Frame;
import mash.util.Trace;
import mash.util.condition.ConditionContext;
import mash.util.condition.Handler;
import mash.util.condition.HandlerProcedure;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Performs whole runs.
 * <p>
 * Every attempt loads the inputs afresh, parses each of them into its own tree, and executes all the trees with one
 * scheduler and one scope. The scope starts out with the variable {@value #ATTEMPT_VARIABLE} set to the 1-based
 * attempt number. A {@link RestartRequestCondition} signaled anywhere during an attempt, worker threads included,
 * abandons the attempt with all its trees, variables and statistics, and the next one begins.
 */
public final class Runner {
    /**
     * Initializes a runner. The executor is only used if the configuration asks for more than one worker.
     */
    public Runner(
        final Configuration configuration,
        final Evaluator evaluator,
        final RunObserver observer,
        final @Nullable ExecutorService executorService
    ) {
        this.configuration = configuration;
        this.evaluator = evaluator;
        this.observer = observer;
        this.executorService = executorService;
    }

    /**
     * Runs until an attempt completes.
     * <p>
     * Signals a fatal {@link RestartLimitExceededCondition} if the last allowed attempt asks for a restart too.
     *
     * @param inputs Supplies the input documents, once per attempt.
     * @return The statistics of the successful attempt.
     */
    public Statistics run(final Supplier<List<SourceDocument>> inputs) {
        for (int attempt = 1; attempt <= configuration.maxAttempts(); attempt += 1) {
            final var number = attempt;
            final var statistics = ConditionContext.withRestart(RESTART_NAME, restart -> {
                try (final var handler = new Handler((HandlerProcedure.ThreadSafe) signaled -> {
                    if (signaled.condition() instanceof RestartRequestCondition) {
                        restart.unwindTo();
                    }
                })) {
                    handler.use();
                    return attempt(number, inputs);
                }
            });
            if (statistics != null) {
                return statistics;
            }
        }
        throw ConditionContext.error(new RestartLimitExceededCondition(configuration.maxAttempts()));
    }

    private Statistics attempt(final int number, final Supplier<List<SourceDocument>> inputs) {
        try (final var trace = new Trace(() -> "Running attempt " + number)) {
            trace.use();
            observer.attemptStarted(number);
            final var roots = new ArrayList<Frame>();
            for (final var document : inputs.get()) {
                final var root = DocumentParser.parse(document.text(), document.name());
                if (root != null) {
                    observer.documentParsed(root);
                    roots.add(root);
                }
            }
            final var scope = new Scope();
            scope.put(ATTEMPT_VARIABLE, number);
            final var includeLoader = new IncludeResolver(
                configuration.workingDirectory(),
                configuration.libraryPaths()
            );
            final var context = new ExecutionContext(scope, evaluator, includeLoader);
            final var scheduler = (configuration.workers() > 1 && executorService != null)
                ? new Scheduler(context, observer, executorService, configuration.workers())
                : new Scheduler(context, observer);
            return scheduler.execute(roots);
        }
    }

    /**
     * The name of the restart established around every attempt.
     */
    public static final String RESTART_NAME = "restart-run";

    /**
     * The variable holding the attempt number.
     */
    public static final String ATTEMPT_VARIABLE = "attempt";

    private final Configuration configuration;
    private final Evaluator evaluator;
    private final RunObserver observer;
    private final @Nullable ExecutorService executorService;
}
