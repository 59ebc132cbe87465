// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Conditions wrapping Java exceptions.
 */
@NonNullByDefault
package mash.util.condition.exception;

import mash.util.annotation.NonNullByDefault;
