// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

import mash.document.Address;
import mash.tree.Frame;

/**
 * A code fragment ready to be evaluated.
 *
 * @param source         The de-indented source text; line 1 of it is at {@code address}.
 * @param address        Where the fragment starts in its document.
 * @param enclosingFrame The frame the fragment belongs to. Its composed text is complete by the time the fragment
 *                       runs.
 */
public record Fragment(String source, Address address, Frame enclosingFrame) {
}
