// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

/**
 * One of the two phases every node runs in. Phases are ordered, {@code START} comes before {@code FINISH}.
 */
public enum Phase {
    START,
    FINISH,
}
