// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import mash.run.Configuration;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Parser of the command line {@code mash [-c] [-v] [-j N] [-L dir]... [--attempts N] [--] [file...]}.
 * <ul>
 * <li>{@code -c} deletes cached build state before anything else; with no file, nothing else happens.
 * <li>{@code -v} prints the parsed trees and every executed event.
 * <li>{@code -j N} runs up to {@code N} independent events at once.
 * <li>{@code -L dir} adds a library directory to the include search path; repeatable.
 * <li>{@code --attempts N} limits how many times a run may start, counting the first time.
 * </ul>
 * Library directories from {@code -L} come before those from {@value Configuration#SEARCH_PATH_VARIABLE}.
 */
public final class CommandLine {
    private CommandLine() {
    }

    /**
     * Parses the given arguments.
     *
     * @param workingDirectory The directory relative library paths are resolved against.
     * @param searchPath       The value of {@value Configuration#SEARCH_PATH_VARIABLE}, if set.
     * @throws UsageException If an argument is unknown, or an option lacks its value or has an invalid one.
     */
    public static Configuration parse(
        final String[] args,
        final Path workingDirectory,
        final @Nullable String searchPath
    ) throws UsageException {
        var clean = false;
        var verbose = false;
        var workers = 1;
        var maxAttempts = Configuration.DEFAULT_MAX_ATTEMPTS;
        final var libraryPaths = new ArrayList<Path>();
        final var inputs = new ArrayList<String>();
        var optionsEnded = false;
        for (int i = 0; i < args.length; i += 1) {
            final var arg = args[i];
            if (optionsEnded || !arg.startsWith("-") || arg.equals("-")) {
                inputs.add(arg);
                continue;
            }
            switch (arg) {
                case "--" -> optionsEnded = true;
                case "-c" -> clean = true;
                case "-v" -> verbose = true;
                case "-j" -> {
                    i += 1;
                    workers = positiveInteger(arg, value(args, i, arg));
                }
                case "-L" -> {
                    i += 1;
                    libraryPaths.add(workingDirectory.resolve(value(args, i, arg)));
                }
                case "--attempts" -> {
                    i += 1;
                    maxAttempts = positiveInteger(arg, value(args, i, arg));
                }
                default -> throw new UsageException("Unknown option " + arg);
            }
        }
        for (final var path : Configuration.parseSearchPath(searchPath)) {
            libraryPaths.add(workingDirectory.resolve(path));
        }
        return new Configuration(workingDirectory, libraryPaths, inputs, clean, verbose, workers, maxAttempts);
    }

    /**
     * Returns the one-line usage summary.
     */
    public static String usage() {
        return "Usage: mash [-c] [-v] [-j N] [-L dir]... [--attempts N] [--] [file...]";
    }

    private static String value(final String[] args, final int index, final String option) throws UsageException {
        if (index >= args.length) {
            throw new UsageException("Option " + option + " requires a value");
        }
        return args[index];
    }

    private static int positiveInteger(final String option, final String value) throws UsageException {
        final int result;
        try {
            result = Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new UsageException("Option " + option + " expects a number, got " + value);
        }
        if (result < 1) {
            throw new UsageException("Option " + option + " expects a positive number, got " + value);
        }
        return result;
    }
}
