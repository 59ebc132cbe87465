// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.util.concurrent.atomic.AtomicReference;
import mash.util.condition.Condition;
import mash.util.condition.ConditionContext;
import mash.util.condition.Handler;
import mash.util.condition.HandlerProcedure;
import static org.assertj.core.api.Assertions.assertThat;

final class Conditions {
    private Conditions() {
    }

    // Runs the action, expecting it to signal a fatal condition of the given type; the action is abandoned there.
    static <C extends Condition> C expectFatal(final Class<C> type, final Runnable action) {
        final var captured = new AtomicReference<Condition>();
        final var completed = ConditionContext.withRestart("abort-test", restart -> {
            try (final var handler = new Handler((HandlerProcedure.ThreadSafe) signaled -> {
                if (signaled.isFatal()) {
                    captured.compareAndSet(null, signaled.condition());
                    restart.unwindTo();
                }
            })) {
                handler.use();
                action.run();
                return Boolean.TRUE;
            }
        });
        assertThat(completed).as("action completed without signaling a fatal condition").isNull();
        assertThat(captured.get()).isInstanceOf(type);
        return type.cast(captured.get());
    }
}
