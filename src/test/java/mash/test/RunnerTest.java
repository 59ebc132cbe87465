// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import mash.evaluation.BuiltinEvaluator;
import mash.run.Configuration;
import mash.run.RestartLimitExceededCondition;
import mash.run.RunObserver;
import mash.run.Runner;
import mash.run.SourceDocument;
import mash.tree.Frame;
import mash.tree.NodeKind;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class RunnerTest {
    @Test
    void restartRequestsStartOver(@TempDir final Path directory) {
        final var output = new ArrayList<String>();
        final var loads = new AtomicInteger(0);
        final var runner = new Runner(
            Configuration.defaults(directory, List.of()),
            new BuiltinEvaluator(output::add),
            RunObserver.NONE,
            null
        );
        final var document = "before [[[\nprint attempt ${attempt}\nif ${attempt} == 1: restart\n||| x ]]] after";
        final var statistics = runner.run(() -> {
            loads.incrementAndGet();
            return List.of(new SourceDocument("doc.mash", document));
        });
        assertThat(output).containsExactly("attempt 1", "attempt 2");
        assertThat(loads).hasValue(2);
        assertThat(statistics.count(NodeKind.CODE)).isEqualTo(1);
    }

    @Test
    void endlessRestartsAreCutOff(@TempDir final Path directory) {
        final var configuration = new Configuration(directory, List.of(), List.of(), false, false, 1, 3);
        final var attempts = new ArrayList<Integer>();
        final var runner = new Runner(configuration, new BuiltinEvaluator(line -> {
        }), new RunObserver() {
            @Override
            public void attemptStarted(final int attempt) {
                attempts.add(attempt);
            }
        }, null);
        final var condition = Conditions.expectFatal(
            RestartLimitExceededCondition.class,
            () -> runner.run(() -> List.of(new SourceDocument("doc.mash", "[[[ restart ||| x ]]]")))
        );
        assertThat(condition.maxAttempts()).isEqualTo(3);
        assertThat(attempts).containsExactly(1, 2, 3);
    }

    @Test
    void everyInputBecomesItsOwnTree(@TempDir final Path directory) {
        final var output = new ArrayList<String>();
        final var parsed = new ArrayList<String>();
        final var runner = new Runner(
            Configuration.defaults(directory, List.of()),
            new BuiltinEvaluator(output::add),
            new RunObserver() {
                @Override
                public void documentParsed(final Frame root) {
                    parsed.add(root.address().sourceName());
                }
            },
            null
        );
        final var statistics = runner.run(() -> List.of(
            new SourceDocument("first.mash", "[[[ shared = first ]]]"),
            new SourceDocument("empty.mash", ""),
            new SourceDocument("second.mash", "[[[ print ${shared} ]]]")
        ));
        assertThat(parsed).containsExactly("first.mash", "second.mash");
        assertThat(output).containsExactly("first");
        assertThat(statistics.count(NodeKind.FRAME)).isEqualTo(4);
    }
}
