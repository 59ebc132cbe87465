// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.test;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import mash.cli.BuildState;
import mash.cli.CommandLine;
import mash.cli.UsageException;
import mash.run.Configuration;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class CommandLineTest {
    @Test
    void defaults() throws UsageException {
        final var configuration = CommandLine.parse(new String[0], work, null);
        assertThat(configuration.workingDirectory()).isEqualTo(work);
        assertThat(configuration.inputs()).isEmpty();
        assertThat(configuration.libraryPaths()).isEmpty();
        assertThat(configuration.clean()).isFalse();
        assertThat(configuration.verbose()).isFalse();
        assertThat(configuration.workers()).isEqualTo(1);
        assertThat(configuration.maxAttempts()).isEqualTo(Configuration.DEFAULT_MAX_ATTEMPTS);
    }

    @Test
    void parsesEveryOption() throws UsageException {
        final var args = new String[] {"-c", "-v", "-j", "4", "-L", "lib", "--attempts", "3", "a.mash", "b.mash"};
        final var configuration = CommandLine.parse(args, work, "/x" + File.pathSeparator + File.pathSeparator + "/y");
        assertThat(configuration.clean()).isTrue();
        assertThat(configuration.verbose()).isTrue();
        assertThat(configuration.workers()).isEqualTo(4);
        assertThat(configuration.maxAttempts()).isEqualTo(3);
        assertThat(configuration.inputs()).containsExactly("a.mash", "b.mash");
        assertThat(configuration.libraryPaths()).containsExactly(work.resolve("lib"), Path.of("/x"), Path.of("/y"));
    }

    @Test
    void doubleDashEndsOptions() throws UsageException {
        final var configuration = CommandLine.parse(new String[] {"--", "-v", "-"}, work, null);
        assertThat(configuration.verbose()).isFalse();
        assertThat(configuration.inputs()).containsExactly("-v", "-");
    }

    @ParameterizedTest
    @ValueSource(strings = {"-x", "-j", "-j 0", "-j many", "-L", "--attempts -1"})
    void rejectsBadArguments(final String arguments) {
        assertThatExceptionOfType(UsageException.class)
            .isThrownBy(() -> CommandLine.parse(arguments.split(" "), work, null));
    }

    @Test
    void cleanDeletesBuildState(@TempDir final Path directory) throws Exception {
        Files.createDirectories(directory.resolve(".mash/nested"));
        Files.writeString(directory.resolve(".mash/nested/output.txt"), "built");
        Files.createDirectory(directory.resolve(".mash-archive"));
        Files.writeString(directory.resolve("document.mash"), "kept");

        final var deleted = BuildState.clean(directory);
        assertThat(deleted).containsExactly(directory.resolve(".mash"), directory.resolve(".mash-archive"));
        assertThat(directory.resolve(".mash")).doesNotExist();
        assertThat(directory.resolve(".mash-archive")).doesNotExist();
        assertThat(directory.resolve("document.mash")).exists();
        assertThat(BuildState.clean(directory)).isEqualTo(List.of());
    }

    private final Path work = Path.of("/work");
}
