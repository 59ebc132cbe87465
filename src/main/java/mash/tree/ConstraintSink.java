// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

/**
 * Receives the ordering constraints nodes derive from their place in the tree.
 */
@FunctionalInterface
public interface ConstraintSink {
    /**
     * Records that {@code first} must run before {@code then}.
     */
    void before(Event first, Event then);
}
