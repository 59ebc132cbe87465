// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable that carries control flow to a {@link Restart}.
 * <p>
 * Public only so that methods can declare {@code throws Unwind}. Code should not catch or throw it by hand, except to
 * carry an unwind across a thread boundary.
 * <p>
 * It is neither an {@link Exception} nor an {@link Error}: it does not signal anything exceptional, so ordinary
 * {@code catch (Exception e)} blocks must not intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to a restart point", null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
