// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.run;

import mash.scheduler.EventObserver;
import mash.tree.Frame;

/**
 * Receives progress notifications of a whole run, besides those of the scheduler.
 */
public interface RunObserver extends EventObserver {
    /**
     * An observer that ignores everything.
     */
    RunObserver NONE = new RunObserver() {
    };

    /**
     * Called when an attempt begins, with its 1-based number.
     */
    default void attemptStarted(final int attempt) {
    }

    /**
     * Called after an input document was parsed into a tree, before anything runs.
     */
    default void documentParsed(final Frame root) {
    }
}
