// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Merges adjacent literal text elements into one, keeping the address of the first.
 * <p>
 * The result alternates between structural markers and maximal runs of literal text, which is what the tree builder
 * expects.
 */
public final class Compressor implements Iterator<Element> {
    /**
     * Initializes a compressor over the given addressed elements.
     */
    public Compressor(final Iterator<Element> elements) {
        this.elements = elements;
    }

    @Override
    public boolean hasNext() {
        return lookahead != null || elements.hasNext();
    }

    @Override
    public Element next() {
        final var first = take();
        final var firstText = first.text();
        if (firstText == null) {
            return first;
        }
        final var builder = new StringBuilder(firstText);
        while (hasNext()) {
            final var following = take();
            final var followingText = following.text();
            if (followingText == null) {
                lookahead = following;
                break;
            }
            builder.append(followingText);
        }
        return new Element(first.address(), new Token.Text(builder.toString()));
    }

    private Element take() {
        final var element = lookahead;
        if (element != null) {
            lookahead = null;
            return element;
        }
        if (!elements.hasNext()) {
            throw new NoSuchElementException("No more elements in the document");
        }
        return elements.next();
    }

    private final Iterator<Element> elements;
    private @Nullable Element lookahead = null;
}
