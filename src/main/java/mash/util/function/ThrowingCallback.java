// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.function;

/**
 * A callback with no arguments and no result that may throw {@code E}.
 */
@FunctionalInterface
public interface ThrowingCallback<E extends Throwable> {
    void call() throws E;
}
