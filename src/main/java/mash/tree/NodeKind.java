// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

/**
 * The four kinds of tree nodes, as counted by the statistics.
 */
public enum NodeKind {
    FRAME,
    CODE,
    TEXT,
    INCLUDE,
}
