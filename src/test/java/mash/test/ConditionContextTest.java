// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import mash.util.ExecutorUtils;
import mash.util.Trace;
import mash.util.condition.Condition;
import mash.util.condition.ConditionContext;
import mash.util.condition.Handler;
import mash.util.condition.HandlerProcedure;
import mash.util.condition.Restart;
import mash.util.condition.UnhandledErrorError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

final class ConditionContextTest {
    @Test
    void restartsAreListedNewestFirst() {
        final var names = ConditionContext.withRestart("outer", outer ->
            ConditionContext.withRestart("inner", inner ->
                ConditionContext.restarts().stream().map(Restart::name).toList()));
        assertThat(names).containsExactly("inner", "outer");
        assertThat(ConditionContext.restarts()).isEmpty();
    }

    @Test
    void findRestartReturnsNewestOfThatName() {
        ConditionContext.withRestart("run", outer -> ConditionContext.withRestart("run", inner -> {
            assertThat(ConditionContext.findRestart("run")).isSameAs(inner);
            assertThat(ConditionContext.findRestart("missing")).isNull();
            return null;
        }));
    }

    @Test
    void unwindingReturnsNullFromWithRestart() {
        final var result = ConditionContext.withRestart("abort", restart -> {
            try (final var handler = new Handler(signaled -> restart.unwindTo())) {
                handler.use();
                ConditionContext.signal(new TestCondition("boom"));
                return "completed";
            }
        });
        assertThat(result).isNull();
    }

    @Test
    void declinedNonFatalSignalReturns() {
        final var seen = new ArrayList<String>();
        try (final var handler = new Handler(signaled -> seen.add(signaled.condition().message()))) {
            handler.use();
            ConditionContext.signal(new TestCondition("note"));
        }
        assertThat(seen).containsExactly("note");
    }

    @Test
    void declinedFatalSignalThrows() {
        assertThatThrownBy(() -> ConditionContext.error(new TestCondition("fatal")))
            .isInstanceOf(UnhandledErrorError.class)
            .hasMessageContaining("fatal");
    }

    @Test
    void handlerSignalingReachesOnlyOlderHandlers() {
        final var seen = new ArrayList<String>();
        try (final var older = new Handler(signaled -> seen.add("older: " + signaled.condition().message()))) {
            older.use();
            try (final var newer = new Handler(signaled -> {
                seen.add("newer: " + signaled.condition().message());
                if (signaled.condition().message().equals("first")) {
                    ConditionContext.signal(new TestCondition("nested"));
                }
            })) {
                newer.use();
                ConditionContext.signal(new TestCondition("first"));
            }
        }
        assertThat(seen).containsExactly("newer: first", "older: nested", "older: first");
    }

    @Test
    void workersUseOnlyThreadSafeHandlers() throws Throwable {
        final var threadSafe = new ArrayList<String>();
        final var local = new ArrayList<String>();
        final var pool = Executors.newFixedThreadPool(2);
        try (
            final var safeHandler = new Handler((HandlerProcedure.ThreadSafe) signaled -> {
                synchronized (threadSafe) {
                    threadSafe.add(signaled.condition().message());
                }
            });
            final var localHandler = new Handler(signaled -> local.add(signaled.condition().message()))
        ) {
            safeHandler.use();
            localHandler.use();
            ExecutorUtils.forEach(
                pool,
                List.of("a", "b"),
                message -> ConditionContext.signal(new TestCondition(message))
            );
        } finally {
            pool.shutdown();
        }
        assertThat(threadSafe).containsExactlyInAnyOrder("a", "b");
        assertThat(local).isEmpty();
    }

    @Test
    void traceSnapshotListsInnermostFirst() {
        try (final var outer = new Trace("Parsing doc.mash")) {
            outer.use();
            try (final var inner = new Trace(() -> "Evaluating fragment")) {
                inner.use();
                assertThat(Trace.snapshot()).containsExactly("Evaluating fragment", "Parsing doc.mash");
            }
            assertThat(Trace.snapshot()).containsExactly("Parsing doc.mash");
        }
        assertThat(Trace.snapshot()).isEmpty();
    }

    private static final class TestCondition extends Condition {
        private TestCondition(final String message) {
            super(message);
        }
    }
}
