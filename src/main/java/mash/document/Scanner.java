// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.regex.Matcher;

/**
 * Splits a document into literal text and structural {@link Token}s, lazily and in a single pass.
 * <p>
 * The scanner keeps one cursor per {@link TokenKind}, each pointing at the next occurrence of that token, in a
 * priority queue ordered by position. The earliest cursor is taken, the text before it (if any) and the token itself
 * are produced, and only that cursor is searched forward again. Each character is therefore examined once per token
 * kind instead of once per token.
 * <p>
 * Tokens are produced on demand; a scanner is an iterator and can be consumed only once.
 */
public final class Scanner implements Iterator<Token> {
    /**
     * Initializes a scanner over the given text.
     */
    public Scanner(final String text) {
        this.text = text;
        // Every cursor starts out unsearched, so that the first search of every kind goes through the same code path
        // as all later ones.
        for (final var kind : TokenKind.values()) {
            queue.add(new Cursor(kind, kind.pattern().matcher(text)));
        }
    }

    @Override
    public boolean hasNext() {
        return !pending.isEmpty() || fill();
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens in the document");
        }
        return pending.removeFirst();
    }

    private boolean fill() {
        while (pending.isEmpty()) {
            final var cursor = queue.poll();
            if (cursor == null) {
                return flushTrailingText();
            }
            if (cursor.start >= 0) {
                if (cursor.start > index) {
                    pending.addLast(new Token.Text(text.substring(index, cursor.start)));
                }
                pending.addLast(new Token.Marker(cursor.kind));
                index = cursor.end;
            }
            // Kinds with no further occurrence simply drop out of the queue.
            if (cursor.matcher.find(index)) {
                cursor.start = cursor.matcher.start();
                cursor.end = cursor.matcher.end();
                queue.add(cursor);
            }
        }
        return true;
    }

    private boolean flushTrailingText() {
        if (index >= text.length()) {
            return false;
        }
        pending.addLast(new Token.Text(text.substring(index)));
        index = text.length();
        return true;
    }

    private final String text;
    private final PriorityQueue<Cursor> queue = new PriorityQueue<>(
        TokenKind.values().length,
        Comparator.<Cursor>comparingInt(cursor -> cursor.start).thenComparing(cursor -> cursor.kind)
    );
    private final ArrayDeque<Token> pending = new ArrayDeque<>(2);
    private int index = 0;

    private static final class Cursor {
        private Cursor(final TokenKind kind, final Matcher matcher) {
            this.kind = kind;
            this.matcher = matcher;
        }

        private final TokenKind kind;
        private final Matcher matcher;
        // Negative until the first search.
        private int start = -1;
        private int end = -1;
    }
}
