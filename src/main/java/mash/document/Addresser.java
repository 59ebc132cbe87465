// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

import java.util.Iterator;

/**
 * Attaches an {@link Address} to every token coming out of a {@link Scanner}.
 * <p>
 * The offset of every element is the running column. A line break becomes literal {@code "\n"} text addressed at
 * the end of its line, after which the line number goes up and the column starts over, so literal runs can span
 * lines once compressed.
 */
public final class Addresser implements Iterator<Element> {
    /**
     * Initializes an addresser over the given tokens, which start at the given line of the named source.
     */
    public Addresser(final Iterator<Token> tokens, final String sourceName, final int startLine) {
        this.tokens = tokens;
        this.sourceName = sourceName;
        line = startLine;
    }

    @Override
    public boolean hasNext() {
        return tokens.hasNext();
    }

    @Override
    public Element next() {
        final var token = tokens.next();
        final var address = new Address(sourceName, line, column);
        if (token instanceof final Token.Marker marker && marker.kind() == TokenKind.NEW_LINE) {
            line += 1;
            column = 1;
            return new Element(address, new Token.Text(TokenKind.NEW_LINE.lexeme()));
        }
        column += token.length();
        return new Element(address, token);
    }

    private final Iterator<Token> tokens;
    private final String sourceName;
    private int line;
    private int column = 1;
}
