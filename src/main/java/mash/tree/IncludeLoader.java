// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds, reads and parses the document an {@link IncludeNode} names.
 */
@FunctionalInterface
public interface IncludeLoader {
    /**
     * Returns the root frame of the included document, or {@code null} if the document is empty.
     * <p>
     * Failures are signaled as fatal conditions.
     */
    @Nullable Frame load(IncludeNode node);
}
