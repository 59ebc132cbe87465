// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

import mash.document.Address;
import mash.util.condition.Condition;

/**
 * A non-fatal condition asking for the whole run to start over.
 * <p>
 * The run loop handles it by discarding every tree, the scope and the statistics, and parsing the inputs again. If
 * nobody handles it, signaling returns normally and the evaluator should treat the request as a failure.
 */
public final class RestartRequestCondition extends Condition {
    /**
     * Initializes a restart request made by the fragment at the given address.
     */
    public RestartRequestCondition(final Address origin) {
        super("Restart requested");
        this.origin = origin;
    }

    /**
     * Returns the address of the fragment that asked for the restart.
     */
    public Address origin() {
        return origin;
    }

    @Override
    public String detailedMessage() {
        return origin + ": " + message();
    }

    private final Address origin;
}
