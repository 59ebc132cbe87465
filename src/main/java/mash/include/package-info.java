// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Resolution and loading of included documents.
 */
@NonNullByDefault
package mash.include;

import mash.util.annotation.NonNullByDefault;
