// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import mash.evaluation.BuiltinEvaluator;
import mash.run.Configuration;
import mash.run.RunObserver;
import mash.run.Runner;
import mash.run.SourceDocument;
import mash.scheduler.AggregateFailureCondition;
import mash.util.SneakyThrow;
import mash.util.condition.Condition;
import mash.util.condition.ConditionContext;
import mash.util.condition.Handler;
import mash.util.condition.HandlerProcedure;
import mash.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The {@code mash} command.
 */
public final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(execute(args, Path.of("").toAbsolutePath(), System.getenv(Configuration.SEARCH_PATH_VARIABLE)));
    }

    /**
     * Runs the command with the given arguments, working directory and {@code MASH_PATH} value.
     *
     * @return The process exit code: 0 on success, 1 after a failure, 2 after several simultaneous failures and 64
     *     for invalid arguments.
     */
    public static int execute(final String[] args, final Path workingDirectory, final @Nullable String searchPath) {
        return executeImpl(args, workingDirectory, searchPath).value;
    }

    private static ExitCode executeImpl(
        final String[] args,
        final Path workingDirectory,
        final @Nullable String searchPath
    ) {
        final Configuration configuration;
        try {
            configuration = CommandLine.parse(args, workingDirectory, searchPath);
        } catch (final UsageException e) {
            try (final var streams = Streams.acquire()) {
                streams.err().println(e.getMessage());
                streams.err().println(CommandLine.usage());
                return ExitCode.USAGE;
            }
        }

        final var failure = new AtomicReference<@Nullable Condition>(null);
        try (final var handler = new Handler(FallbackHandler.instance())) {
            handler.use();
            try (final var recorder = new Handler((HandlerProcedure.ThreadSafe) signaled -> {
                if (signaled.isFatal()) {
                    failure.compareAndSet(null, signaled.condition());
                }
            })) {
                recorder.use();
                final var threadPool = (configuration.workers() > 1) ? createThreadPool(configuration.workers()) : null;
                try {
                    final var exitCode = ConditionContext.withRestart(
                        FallbackHandler.ABORT_RESTART_NAME,
                        restart -> run(configuration, threadPool)
                    );
                    return (exitCode != null) ? exitCode : ExitCode.of(failure.get());
                } finally {
                    if (threadPool != null) {
                        shutDownThreadPool(threadPool);
                    }
                }
            }
        }
    }

    private static ExitCode run(final Configuration configuration, final @Nullable ThreadPoolExecutor threadPool) {
        if (configuration.clean()) {
            for (final var directory : BuildState.clean(configuration.workingDirectory())) {
                if (configuration.verbose()) {
                    Streams.printLine("Deleted " + directory);
                }
            }
            if (configuration.inputs().isEmpty()) {
                return ExitCode.SUCCESS;
            }
        }
        final var observer = configuration.verbose() ? new VerboseObserver() : RunObserver.NONE;
        final var runner = new Runner(configuration, new BuiltinEvaluator(Streams::printLine), observer, threadPool);
        final var statistics = runner.run(inputs(configuration.inputs()));
        Streams.printLine(statistics.toString());
        return ExitCode.SUCCESS;
    }

    // Files are read again on every attempt; standard input can only be read once.
    private static Supplier<List<SourceDocument>> inputs(final List<String> names) {
        final var effectiveNames = names.isEmpty() ? List.of(STANDARD_INPUT_NAME) : names;
        final var standardInput = new AtomicReference<@Nullable SourceDocument>(null);
        return () -> {
            final var documents = new ArrayList<SourceDocument>(effectiveNames.size());
            for (final var name : effectiveNames) {
                if (name.equals(STANDARD_INPUT_NAME)) {
                    var document = standardInput.get();
                    if (document == null) {
                        document = readStandardInput();
                        standardInput.set(document);
                    }
                    documents.add(document);
                } else {
                    documents.add(SourceDocument.read(Path.of(name)));
                }
            }
            return documents;
        };
    }

    private static SourceDocument readStandardInput() {
        try (final var streams = Streams.acquire()) {
            streams.err().println("[reading from stdin]");
            return new SourceDocument(STANDARD_INPUT_SOURCE_NAME, streams.readInput());
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    private static ThreadPoolExecutor createThreadPool(final int workers) {
        final var threadId = new AtomicInteger(0);
        return new ThreadPoolExecutor(
            workers,
            workers,
            0,
            TimeUnit.NANOSECONDS,
            new LinkedBlockingQueue<>(),
            runnable -> new Thread(runnable, "worker-thread-" + threadId.addAndGet(1))
        );
    }

    @SuppressWarnings("ResultOfMethodCallIgnored")
    private static void shutDownThreadPool(final ThreadPoolExecutor threadPool) {
        threadPool.shutdownNow();
        try {
            threadPool.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    private static final String STANDARD_INPUT_NAME = "-";
    private static final String STANDARD_INPUT_SOURCE_NAME = "<stdin>";

    private enum ExitCode {
        SUCCESS(0),
        FAILURE(1),
        MULTIPLE_FAILURES(2),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        static ExitCode of(final @Nullable Condition failure) {
            return (failure instanceof AggregateFailureCondition) ? MULTIPLE_FAILURES : FAILURE;
        }

        private final int value;
    }
}
