// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A token together with the address where it starts.
 */
public record Element(Address address, Token payload) {
    /**
     * Returns the literal text of this element, or {@code null} if it is a marker.
     */
    public @Nullable String text() {
        return (payload instanceof final Token.Text text) ? text.text() : null;
    }

    /**
     * Returns the marker kind of this element, or {@code null} if it is literal text.
     */
    public @Nullable TokenKind kind() {
        return (payload instanceof final Token.Marker marker) ? marker.kind() : null;
    }

    @Override
    public String toString() {
        final var text = text();
        return address + " " + ((text != null) ? quote(text) : String.valueOf(kind()));
    }

    private static String quote(final String text) {
        return "'" + text.replace("\\", "\\\\").replace("\n", "\\n").replace("'", "\\'") + "'";
    }
}
