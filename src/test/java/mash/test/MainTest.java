// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import mash.cli.Main;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {
    @Test
    void successfulRunExitsWithZero() throws IOException {
        final var document = write("ok.mash", "[[[ x = 1 ||| fine ]]]");
        assertThat(Main.execute(new String[] {document}, work, null)).isZero();
    }

    @Test
    void failingDocumentExitsWithOne() throws IOException {
        final var document = write("bad.mash", "[[[ fail boom ||| text ]]]");
        assertThat(Main.execute(new String[] {document}, work, null)).isEqualTo(1);
    }

    @Test
    void simultaneousFailuresExitWithTwo() throws IOException {
        final var first = write("first.mash", "[[[ fail one ||| x ]]]");
        final var second = write("second.mash", "[[[ fail two ||| y ]]]");
        assertThat(Main.execute(new String[] {"-j", "2", first, second}, work, null)).isEqualTo(2);
    }

    @Test
    void sequentialFailuresStopAtTheFirst() throws IOException {
        final var first = write("first.mash", "[[[ fail one ||| x ]]]");
        final var second = write("second.mash", "[[[ fail two ||| y ]]]");
        assertThat(Main.execute(new String[] {first, second}, work, null)).isEqualTo(1);
    }

    @Test
    void invalidArgumentsExitWithUsage() {
        assertThat(Main.execute(new String[] {"--bogus"}, work, null)).isEqualTo(64);
        assertThat(Main.execute(new String[] {"-j"}, work, null)).isEqualTo(64);
    }

    private String write(final String name, final String text) throws IOException {
        final var path = work.resolve(name);
        Files.writeString(path, text, StandardCharsets.UTF_8);
        return path.toString();
    }

    @TempDir
    Path work;
}
