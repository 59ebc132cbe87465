// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition.exception;

import java.io.IOException;

/**
 * A condition signaling that reading a document, resolving an include, or clearing build state failed with an
 * {@link IOException}.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    /**
     * Wraps the given {@link IOException}.
     */
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
