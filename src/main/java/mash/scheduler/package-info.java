// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Execution of node trees under structural ordering constraints.
 * <p>
 * The {@link mash.scheduler.Scheduler} works in passes: every pass derives a fresh
 * {@link mash.scheduler.ConstraintGraph} from the live tree, minus everything that already ran, and drains it until
 * it is empty or an event reports that the tree changed shape.
 */
@NonNullByDefault
package mash.scheduler;

import mash.util.annotation.NonNullByDefault;
