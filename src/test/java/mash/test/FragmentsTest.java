// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import mash.evaluation.Fragments;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;

final class FragmentsTest {
    @Test
    void unindentRemovesCommonPrefix() {
        final var source = "    print('hello')\n    print('world')";
        final var unindented = Fragments.unindent(source);
        assertThat(unindented).isEqualTo("print('hello')\nprint('world')");
        assertThat(source.length() - unindented.length()).isEqualTo(8);
    }

    @Test
    void unindentUsesFirstNonBlankLine() {
        assertThat(Fragments.unindent("\n\t  a\n\t    b\n\t  c\n")).isEqualTo("\na\n  b\nc\n");
    }

    @Test
    void unindentKeepsUnindentedText() {
        assertThat(Fragments.unindent("a\n  b")).isEqualTo("a\n  b");
        assertThat(Fragments.unindent("   \n  ")).isEqualTo("   \n  ");
        assertThat(Fragments.unindent("")).isEmpty();
    }
}
