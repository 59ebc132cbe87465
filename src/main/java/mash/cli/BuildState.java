// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.cli;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import mash.util.Trace;
import mash.util.condition.ConditionContext;
import mash.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The cached build state kept in the working directory by fragments: the current build directory and the archive of
 * earlier builds.
 */
public final class BuildState {
    private BuildState() {
    }

    /**
     * Deletes every build state directory under the given working directory.
     * <p>
     * Signals a fatal {@link IOExceptionCondition} if a deletion fails.
     *
     * @return The directories that existed and were deleted.
     */
    public static List<Path> clean(final Path workingDirectory) {
        final var deleted = new ArrayList<Path>();
        for (final var name : directoryNames) {
            final var directory = workingDirectory.resolve(name);
            if (!Files.isDirectory(directory)) {
                continue;
            }
            try (final var trace = new Trace(() -> "Deleting build state directory " + directory)) {
                trace.use();
                deleteRecursively(directory);
            }
            deleted.add(directory);
        }
        return deleted;
    }

    private static void deleteRecursively(final Path directory) {
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attributes)
                    throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(
                    final Path visited,
                    final @Nullable IOException exception
                ) throws IOException {
                    if (exception != null) {
                        throw exception;
                    }
                    Files.delete(visited);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }

    /**
     * The names of the build state directories.
     */
    public static final List<String> directoryNames = List.of(".mash", ".mash-archive");
}
