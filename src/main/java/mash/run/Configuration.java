// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.run;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The settings of a run, collected from the command line and the environment.
 *
 * @param workingDirectory The directory searched first for included documents, and where build state lives.
 * @param libraryPaths     Further directories searched for included documents, in order.
 * @param inputs           The documents to weave; empty means standard input.
 * @param clean            Whether to delete cached build state first.
 * @param verbose          Whether to print trees and progress.
 * @param workers          The maximum number of events run at once.
 * @param maxAttempts      The maximum number of attempts, counting the first one, before restarts are refused.
 */
public record Configuration(
    Path workingDirectory,
    List<Path> libraryPaths,
    List<String> inputs,
    boolean clean,
    boolean verbose,
    int workers,
    int maxAttempts
) {
    public Configuration {
        if (workers < 1) {
            throw new IllegalArgumentException("Worker count must be positive, got " + workers);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Attempt limit must be positive, got " + maxAttempts);
        }
        libraryPaths = List.copyOf(libraryPaths);
        inputs = List.copyOf(inputs);
    }

    /**
     * Returns a configuration with default settings for the given inputs, with no library directories.
     */
    public static Configuration defaults(final Path workingDirectory, final List<String> inputs) {
        return new Configuration(workingDirectory, List.of(), inputs, false, false, 1, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Splits the value of {@value #SEARCH_PATH_VARIABLE} into directories, skipping empty entries.
     */
    public static List<Path> parseSearchPath(final @Nullable String value) {
        final var result = new ArrayList<Path>();
        if (value == null) {
            return result;
        }
        for (final var entry : separatorPattern.split(value)) {
            if (!entry.isBlank()) {
                result.add(Path.of(entry.strip()));
            }
        }
        return result;
    }

    /**
     * The environment variable holding extra library directories, separated by the platform path separator.
     */
    public static final String SEARCH_PATH_VARIABLE = "MASH_PATH";

    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    private static final Pattern separatorPattern = Pattern.compile(Pattern.quote(File.pathSeparator));
}
