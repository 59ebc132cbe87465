// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

/**
 * An item produced by the {@link Scanner}: either a run of literal text or a structural marker.
 */
public sealed interface Token {
    /**
     * Returns the number of characters this token covers in the document.
     */
    int length();

    /**
     * A run of literal text containing no markers.
     */
    record Text(String text) implements Token {
        @Override
        public int length() {
            return text.length();
        }
    }

    /**
     * A structural marker or a line break.
     */
    record Marker(TokenKind kind) implements Token {
        @Override
        public int length() {
            return kind.lexeme().length();
        }
    }
}
