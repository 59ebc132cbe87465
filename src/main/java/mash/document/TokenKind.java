// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

import java.util.regex.Pattern;

/**
 * The structural tokens of a document.
 * <p>
 * The declaration order is also the tie-break order when two tokens would start at the same position.
 */
public enum TokenKind {
    OPEN("[[["),
    SEPARATOR("|||"),
    CLOSE("]]]"),
    NEW_LINE("\n");

    TokenKind(final String lexeme) {
        this.lexeme = lexeme;
        pattern = Pattern.compile(Pattern.quote(lexeme));
    }

    /**
     * Returns the exact text of this token in a document.
     */
    public String lexeme() {
        return lexeme;
    }

    Pattern pattern() {
        return pattern;
    }

    private final String lexeme;
    private final Pattern pattern;
}
