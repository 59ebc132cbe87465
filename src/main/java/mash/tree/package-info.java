// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The node tree of a parsed document and the per-node behaviour the scheduler drives.
 * <p>
 * Frames own their children and include nodes own their resolved subtree; parent references only point back up.
 * Every node runs in two phases, {@link mash.tree.Phase#START} and {@link mash.tree.Phase#FINISH}, and describes the
 * order its phases must run in relative to its neighbours through
 * {@link mash.tree.Node#emitConstraints(ConstraintSink)}.
 */
@NonNullByDefault
package mash.tree;

import mash.util.annotation.NonNullByDefault;
