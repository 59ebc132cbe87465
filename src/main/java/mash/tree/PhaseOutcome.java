// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

/**
 * What running a phase did to the shape of the tree.
 */
public enum PhaseOutcome {
    /**
     * The phase may have changed node contents, but no node appeared that needs scheduling.
     */
    UNCHANGED,
    /**
     * The phase changed the tree in a way that requires the constraints to be derived again.
     */
    TREE_CHANGED,
}
