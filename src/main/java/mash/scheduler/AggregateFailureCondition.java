// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.scheduler;

import java.util.List;
import mash.util.condition.Condition;

/**
 * A condition signaling that several independent events failed in the same concurrent wave.
 */
public final class AggregateFailureCondition extends Condition {
    /**
     * Initializes a new aggregate of the given failures, in execution order. {@code traces} holds, for every failure,
     * the operation trace of the worker thread that signaled it, innermost first.
     */
    public AggregateFailureCondition(final List<Condition> failures, final List<List<String>> traces) {
        super(failures.size() + " events failed");
        if (failures.size() != traces.size()) {
            throw new IllegalArgumentException("Every failure needs exactly one trace");
        }
        this.failures = List.copyOf(failures);
        this.traces = traces.stream().map(List::copyOf).toList();
    }

    /**
     * Returns the individual failures.
     */
    public List<Condition> failures() {
        return failures;
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder(message()).append(':');
        for (var i = 0; i < failures.size(); i += 1) {
            builder.append('\n').append(failures.get(i).detailedMessage());
            for (final var line : traces.get(i)) {
                builder.append("\n  - ").append(line);
            }
        }
        return builder.toString();
    }

    private final List<Condition> failures;
    private final List<List<String>> traces;
}
