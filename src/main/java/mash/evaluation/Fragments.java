// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

import java.util.regex.Pattern;

/**
 * Text operations on fragment sources.
 */
public final class Fragments {
    private Fragments() {
    }

    /**
     * Removes the indentation of the first non-blank line from the start of every line.
     * <p>
     * Fragments are usually indented to match the surrounding document; this undoes that without changing the
     * number of lines, so line numbers within the fragment stay valid.
     */
    public static String unindent(final String source) {
        final var matcher = firstContentPattern.matcher(source);
        if (!matcher.find()) {
            return source;
        }
        final var prefix = matcher.group(1);
        if (prefix.isEmpty()) {
            return source;
        }
        final var unindented = source.replace("\n" + prefix, "\n");
        return unindented.startsWith(prefix) ? unindented.substring(prefix.length()) : unindented;
    }

    private static final Pattern firstContentPattern = Pattern.compile("([ \\t]*)[^ \\t\\n]");
}
