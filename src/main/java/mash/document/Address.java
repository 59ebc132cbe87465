// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

/**
 * A location in a source document: its name, a 1-based line and a 1-based offset within the line.
 */
public record Address(String sourceName, int line, int offset) {
    public Address {
        assert line >= 1 : "Line numbers start at 1";
        assert offset >= 1 : "Offsets start at 1";
    }

    /**
     * Maps a line number reported relative to a fragment starting at this address back to the document.
     * <p>
     * Line 1 of the fragment is this address's line. Lines below 1 mean "unknown" and map to this address itself.
     */
    public Address fragmentLine(final int fragmentRelativeLine) {
        if (fragmentRelativeLine < 1) {
            return this;
        }
        return new Address(sourceName, line + fragmentRelativeLine - 1, 1);
    }

    @Override
    public String toString() {
        return "(" + sourceName + ", line " + line + ", pos " + offset + ")";
    }
}
