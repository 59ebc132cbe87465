// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.cli;

import mash.run.RunObserver;
import mash.tree.Event;
import mash.tree.Frame;
import mash.tree.PhaseOutcome;

/**
 * Prints the parsed trees and the progress of the scheduler to standard output.
 */
final class VerboseObserver implements RunObserver {
    @Override
    public void attemptStarted(final int attempt) {
        Streams.printLine("Starting attempt " + attempt);
    }

    @Override
    public void documentParsed(final Frame root) {
        try (final var streams = Streams.acquire()) {
            streams.out().println("Parsed " + root.address().sourceName() + ":");
            streams.out().print(root.render());
        }
    }

    @Override
    public void passStarted(final int pass, final int pendingEvents) {
        Streams.printLine("Pass " + pass + ": " + pendingEvents + " events pending");
    }

    @Override
    public void eventExecuted(final Event event, final PhaseOutcome outcome) {
        final var suffix = (outcome == PhaseOutcome.TREE_CHANGED) ? " (tree changed)" : "";
        Streams.printLine("  " + event + suffix);
    }
}
