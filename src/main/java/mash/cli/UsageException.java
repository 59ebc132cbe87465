// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.cli;

/**
 * Thrown when the command line arguments make no sense.
 */
public final class UsageException extends Exception {
    public UsageException(final String message) {
        super(message);
    }
}
