// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util;

import org.jetbrains.annotations.NotNull;

/**
 * Carries an {@link InterruptedException} through code that cannot declare it.
 */
public final class UncheckedInterruptedException extends RuntimeException {
    /**
     * Wraps the given interruption.
     */
    public UncheckedInterruptedException(final @NotNull InterruptedException cause) {
        super(cause);
    }

    /**
     * Returns the wrapped {@link InterruptedException}.
     */
    @Override
    public synchronized @NotNull InterruptedException getCause() {
        final var cause = super.getCause();
        assert cause instanceof InterruptedException;
        return (InterruptedException) cause;
    }
}
