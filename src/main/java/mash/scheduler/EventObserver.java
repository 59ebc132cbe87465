// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.scheduler;

import mash.tree.Event;
import mash.tree.PhaseOutcome;

/**
 * Receives progress notifications from a {@link Scheduler}. Notifications always come from the thread that called
 * {@link Scheduler#execute}, in execution order.
 */
public interface EventObserver {
    /**
     * An observer that ignores everything.
     */
    EventObserver NONE = new EventObserver() {
    };

    /**
     * Called when a pass begins, with the 1-based pass number and the number of events still to run.
     */
    default void passStarted(final int pass, final int pendingEvents) {
    }

    /**
     * Called after an event ran.
     */
    default void eventExecuted(final Event event, final PhaseOutcome outcome) {
    }
}
