// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util;

import org.jetbrains.annotations.NotNull;

/**
 * Throws checked throwables without declaring them.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws the given throwable as if it were unchecked, whatever its actual type.
     * <p>
     * Reserved for throwables that nearly everything may throw anyway, such as {@link InterruptedException} and
     * {@link mash.util.condition.Unwind}. Everything else should go through the normal checked exception mechanism.
     * <p>
     * Never returns normally. The declared return type lets call sites write {@code throw SneakyThrow.doThrow(e)}
     * so the compiler knows control flow ends there.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    /**
     * Pretends to throw {@code E}, so that a sneakily thrown {@code E} can be caught at the call site.
     */
    @SuppressWarnings({"RedundantThrows", "EmptyMethod"})
    public static <E extends Throwable> void pretendThrows() throws E {
    }

    // The cast is erased, so the JVM rethrows the original object untouched.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
