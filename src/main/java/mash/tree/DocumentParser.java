// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import mash.document.Documents;
import mash.util.Trace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parses document text into a node tree: scanning, addressing, compression and tree building in one go.
 */
public final class DocumentParser {
    private DocumentParser() {
    }

    /**
     * Parses the given text, whose first character is at the given line of the named source.
     *
     * @return The root frame, or {@code null} if the text is empty.
     */
    public static @Nullable Frame parse(final String text, final String sourceName, final int startLine) {
        try (final var trace = new Trace(() -> "Parsing " + sourceName)) {
            trace.use();
            return TreeBuilder.build(Documents.elements(text, sourceName, startLine));
        }
    }

    /**
     * Same as {@link #parse(String, String, int)}, starting at line 1.
     */
    public static @Nullable Frame parse(final String text, final String sourceName) {
        return parse(text, sourceName, 1);
    }
}
