// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Whole runs: parsing every input, executing the resulting trees, and starting over when a fragment asks for it.
 */
@NonNullByDefault
package mash.run;

import mash.util.annotation.NonNullByDefault;
