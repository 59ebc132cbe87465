// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.run;

import mash.util.condition.Condition;

/**
 * A condition signaling that fragments kept asking for restarts after the last allowed attempt.
 */
public final class RestartLimitExceededCondition extends Condition {
    public RestartLimitExceededCondition(final int maxAttempts) {
        super("Run restarted too many times, giving up after " + maxAttempts + " attempts");
        this.maxAttempts = maxAttempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    private final int maxAttempts;
}
