// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.cli;

import java.io.PrintStream;
import java.util.List;
import mash.util.Trace;
import mash.util.condition.Condition;
import mash.util.condition.ConditionContext;
import mash.util.condition.HandlerProcedure;
import mash.util.condition.Restart;
import mash.util.condition.SignaledCondition;

/**
 * The handler of last resort: reports fatal conditions with their operation trace and aborts the run.
 * <p>
 * mash runs unattended, so instead of asking which restart to take, it always takes {@value #ABORT_RESTART_NAME},
 * or the outermost restart if that one is not visible.
 */
final class FallbackHandler implements HandlerProcedure.ThreadSafe {
    private FallbackHandler() {
    }

    static FallbackHandler instance() {
        return instance;
    }

    @Override
    public void handle(final SignaledCondition condition) {
        if (!condition.isFatal()) {
            return;
        }
        final var restarts = ConditionContext.restarts();
        try (final var streams = Streams.acquire()) {
            showCondition(streams, condition.condition());
            chooseRestart(streams.err(), restarts).unwindTo();
        }
    }

    private static void showCondition(final Streams streams, final Condition condition) {
        final var err = streams.err();
        err.println("A fatal condition of type " + condition.getClass().getName() + " has been signaled.");
        err.println("\nDetailed message:");
        err.println(condition.detailedMessage().stripTrailing());
        err.println("\nOperation trace:");
        for (final var traceMessage : Trace.snapshot()) {
            err.println(" - " + traceMessage);
        }
        err.println();
    }

    private static Restart chooseRestart(final PrintStream err, final List<Restart> restarts) {
        if (restarts.isEmpty()) {
            throw new RuntimeException("No restarts available");
        }
        final var abort = ConditionContext.findRestart(ABORT_RESTART_NAME);
        if (abort != null) {
            err.println("Taking restart " + abort.name() + ".");
            return abort;
        }
        final var outermost = restarts.get(restarts.size() - 1);
        err.println("No " + ABORT_RESTART_NAME + " restart visible, taking " + outermost.name() + ".");
        return outermost;
    }

    /**
     * The name of the restart established around the whole run.
     */
    static final String ABORT_RESTART_NAME = "abort-run";

    private static final FallbackHandler instance = new FallbackHandler();
}
