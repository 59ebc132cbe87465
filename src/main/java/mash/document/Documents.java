// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.document;

import java.util.Iterator;

/**
 * Entry points to the lexical pipeline.
 */
public final class Documents {
    private Documents() {
    }

    /**
     * Returns the compressed, addressed elements of the given document text, as consumed by the tree builder.
     * <p>
     * The first character of the text is at the given line, offset 1, of the named source.
     */
    public static Iterator<Element> elements(final String text, final String sourceName, final int startLine) {
        return new Compressor(new Addresser(new Scanner(text), sourceName, startLine));
    }

    /**
     * Same as {@link #elements(String, String, int)}, starting at line 1.
     */
    public static Iterator<Element> elements(final String text, final String sourceName) {
        return elements(text, sourceName, 1);
    }
}
