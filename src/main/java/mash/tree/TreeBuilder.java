// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import java.util.Iterator;
import java.util.regex.Pattern;
import mash.document.Element;
import mash.document.Token;
import mash.util.UnreachableCodeReachedError;
import mash.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Turns a stream of compressed elements into a node tree.
 * <p>
 * The first element's address becomes the address of the root frame. Structural errors are signaled as fatal
 * {@link StructuralParseErrorCondition}s.
 */
public final class TreeBuilder {
    private TreeBuilder() {
    }

    /**
     * Builds the tree of the given elements.
     *
     * @return The root frame, or {@code null} if there are no elements at all.
     */
    public static @Nullable Frame build(final Iterator<Element> elements) {
        if (!elements.hasNext()) {
            return null;
        }
        final var first = elements.next();
        final var root = Frame.root(first.address());
        var current = accept(root, first);
        while (elements.hasNext()) {
            current = accept(current, elements.next());
        }
        if (current != root) {
            throw ConditionContext.error(
                new StructuralParseErrorCondition(StructuralParseErrorCondition.Kind.UNCLOSED_FRAME, current.address()));
        }
        return root;
    }

    private static Frame accept(final Frame current, final Element element) {
        final var payload = element.payload();
        if (payload instanceof final Token.Text text) {
            current.add(leaf(current, element, text.text()));
            return current;
        }
        final var address = element.address();
        switch (((Token.Marker) payload).kind()) {
            case OPEN -> {
                final var child = Frame.nested(address);
                current.add(child);
                return child;
            }
            case CLOSE -> {
                final var parent = current.parent();
                if (parent == null) {
                    throw ConditionContext.error(new StructuralParseErrorCondition(
                        StructuralParseErrorCondition.Kind.UNMATCHED_CLOSE, address));
                }
                return parent;
            }
            case SEPARATOR -> {
                if (current.isSeparated()) {
                    throw ConditionContext.error(new StructuralParseErrorCondition(
                        StructuralParseErrorCondition.Kind.DUPLICATE_SEPARATOR, address));
                }
                current.markSeparated();
                return current;
            }
            default -> throw new UnreachableCodeReachedError("Line breaks are literal text after addressing");
        }
    }

    private static Node leaf(final Frame current, final Element element, final String text) {
        if (current.isSeparated()) {
            return TextLeaf.of(element.address(), text);
        }
        final var include = includePattern.matcher(text);
        if (include.matches()) {
            return new IncludeNode(element.address(), include.group(1));
        }
        return new CodeLeaf(element.address(), text);
    }

    private static final Pattern includePattern = Pattern.compile("\\s*include\\s+(\\S+)\\s*");
}
