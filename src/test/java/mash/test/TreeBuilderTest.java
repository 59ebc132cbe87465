// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.util.ArrayList;
import java.util.Objects;
import mash.document.Address;
import mash.tree.CodeLeaf;
import mash.tree.DocumentParser;
import mash.tree.Frame;
import mash.tree.IncludeNode;
import mash.tree.Node;
import mash.tree.StructuralParseErrorCondition;
import mash.tree.TextLeaf;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class TreeBuilderTest {
    @Test
    void buildsNestedFrames() {
        final var root = parse("a\nb[[[c|||d]]]e\nf");
        assertThat(root.isSeparated()).isTrue();
        assertThat(root.address()).isEqualTo(new Address("doc.mash", 1, 1));
        assertThat(root.children()).hasSize(3);
        assertThat(root.children().get(0)).isInstanceOf(TextLeaf.class);
        assertThat(root.children().get(1)).isInstanceOf(Frame.class);
        assertThat(root.children().get(2)).isInstanceOf(TextLeaf.class);

        final var frame = (Frame) root.children().get(1);
        assertThat(frame.parent()).isSameAs(root);
        assertThat(frame.isSeparated()).isTrue();
        assertThat(frame.children()).hasSize(2);
        assertThat(((CodeLeaf) frame.children().get(0)).source()).isEqualTo("c");
        assertThat(((TextLeaf) frame.children().get(1)).content()).isEqualTo("d");
    }

    @Test
    void rendersTree() {
        final var root = parse("a\nb[[[c|||d]]]e\nf");
        assertThat(root.render()).isEqualTo(
            "[[[\n"
                + "  . 'a\\nb'\n"
                + "  [[[\n"
                + "    * 'c'\n"
                + "    . 'd'\n"
                + "  ]]]\n"
                + "  . 'e\\nf'\n"
                + "]]]\n"
        );
    }

    @Test
    void textBeforeSeparatorIsCode() {
        final var root = parse("[[[ x = 1 ]]]");
        final var frame = (Frame) root.children().get(0);
        assertThat(frame.isSeparated()).isFalse();
        assertThat(frame.children()).singleElement().isInstanceOf(CodeLeaf.class);
    }

    @Test
    void recognizesIncludeDirectives() {
        final var root = parse("[[[\n  include lib/common.mash \n|||text]]][[[ included = 1 ]]]");
        final var first = (Frame) root.children().get(0);
        final var include = (IncludeNode) first.children().get(0);
        assertThat(include.target()).isEqualTo("lib/common.mash");
        assertThat(include.subtree()).isNull();
        assertThat(include.render()).isEqualTo("@ include 'lib/common.mash'\n");
        final var second = (Frame) root.children().get(1);
        assertThat(second.children()).singleElement().isInstanceOf(CodeLeaf.class);
    }

    @Test
    void includeAfterSeparatorIsText() {
        final var root = parse("[[[||| include lib.mash ]]]");
        final var frame = (Frame) root.children().get(0);
        assertThat(frame.children()).singleElement().isInstanceOf(TextLeaf.class);
    }

    @Test
    void whitespaceBeforeSeparatorIsCode() {
        final var root = parse("[[[ ||| include lib.mash ]]]");
        final var frame = (Frame) root.children().get(0);
        assertThat(frame.children()).hasSize(2);
        assertThat(frame.children().get(0)).isInstanceOf(CodeLeaf.class);
        assertThat(frame.children().get(1)).isInstanceOf(TextLeaf.class);
    }

    @Test
    void emptyDocumentHasNoRoot() {
        assertThat(DocumentParser.parse("", "empty.mash")).isNull();
    }

    @Test
    void openAndCloseMarkersBalance() {
        final var root = parse("x[[[ a [[[ b ||| c ]]] ||| d [[[ ||| e ]]] ]]] y [[[ ]]]");
        final var nodes = new ArrayList<Node>();
        root.enumerate(nodes);
        assertThat(nodes).filteredOn(Frame.class::isInstance).hasSize(5);
        for (final var node : nodes) {
            final var parent = node.parent();
            if (parent == root) {
                assertThat(isBefore(node.address(), root.address())).isFalse();
            } else if (parent != null) {
                assertThat(node.identity()).isGreaterThan(parent.identity());
                assertThat(isBefore(parent.address(), node.address())).isTrue();
            }
        }
    }

    @Test
    void rootSharesItsFirstChildsAddress() {
        final var root = parse("\n\n  x [[[ a ||| b ]]]");
        assertThat(root.address()).isEqualTo(root.children().get(0).address());
        assertThat(root.address()).isEqualTo(new Address("doc.mash", 1, 1));
    }

    @Test
    void duplicateSeparatorReportsItsLine() {
        final var condition = Conditions.expectFatal(
            StructuralParseErrorCondition.class,
            () -> DocumentParser.parse("[[[ a \n ||| b \n ||| c ]]]", "xyz.mash")
        );
        assertThat(condition.kind()).isEqualTo(StructuralParseErrorCondition.Kind.DUPLICATE_SEPARATOR);
        assertThat(condition.address()).isEqualTo(new Address("xyz.mash", 3, 2));
        assertThat(condition.detailedMessage()).startsWith("(xyz.mash, line 3, pos 2): ");
    }

    @Test
    void unclosedFrameReportsItsOpeningLine() {
        final var condition = Conditions.expectFatal(
            StructuralParseErrorCondition.class,
            () -> DocumentParser.parse("1\n2\n3 [[[ a\nb\nc\nd", "doc.mash")
        );
        assertThat(condition.kind()).isEqualTo(StructuralParseErrorCondition.Kind.UNCLOSED_FRAME);
        assertThat(condition.address()).isEqualTo(new Address("doc.mash", 3, 3));
    }

    @Test
    void unmatchedCloseReportsTheMarker() {
        final var condition = Conditions.expectFatal(
            StructuralParseErrorCondition.class,
            () -> DocumentParser.parse("a ]]] b", "doc.mash")
        );
        assertThat(condition.kind()).isEqualTo(StructuralParseErrorCondition.Kind.UNMATCHED_CLOSE);
        assertThat(condition.address()).isEqualTo(new Address("doc.mash", 1, 3));
    }

    private static boolean isBefore(final Address first, final Address second) {
        return first.line() < second.line() || (first.line() == second.line() && first.offset() < second.offset());
    }

    private static Frame parse(final String text) {
        return Objects.requireNonNull(DocumentParser.parse(text, "doc.mash"));
    }
}
