// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.include;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import mash.tree.DocumentParser;
import mash.tree.Frame;
import mash.tree.IncludeLoader;
import mash.tree.IncludeNode;
import mash.util.condition.ConditionContext;
import mash.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Loads included documents from an ordered list of directories: the working directory first, then every library
 * directory in order. The first regular file with the included name wins.
 * <p>
 * An included document is parsed with its resolved path as its source name, so addresses inside it point at the
 * file that was actually read.
 */
public final class IncludeResolver implements IncludeLoader {
    /**
     * Initializes a resolver that searches the working directory, then the given library directories.
     */
    public IncludeResolver(final Path workingDirectory, final List<Path> libraryPaths) {
        final var path = new ArrayList<Path>(libraryPaths.size() + 1);
        path.add(workingDirectory);
        path.addAll(libraryPaths);
        searchPath = List.copyOf(path);
    }

    /**
     * Returns the directories searched, in order.
     */
    public List<Path> searchPath() {
        return searchPath;
    }

    /**
     * Returns every location where the named document is looked for, in search order.
     */
    public List<Path> candidates(final String name) {
        final var result = new ArrayList<Path>(searchPath.size());
        for (final var directory : searchPath) {
            result.add(directory.resolve(name));
        }
        return result;
    }

    /**
     * Returns the first existing regular file with the given name, or {@code null} if there is none.
     */
    public @Nullable Path resolve(final String name) {
        for (final var candidate : candidates(name)) {
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Resolves, reads and parses the document the given node includes.
     * <p>
     * Signals a fatal {@link IncludeNotFoundCondition} if no candidate exists, and a fatal
     * {@link IOExceptionCondition} if reading fails.
     */
    @Override
    public @Nullable Frame load(final IncludeNode node) {
        final var name = node.target();
        final var path = resolve(name);
        if (path == null) {
            throw ConditionContext.error(new IncludeNotFoundCondition(name, node.address(), candidates(name)));
        }
        final String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        return DocumentParser.parse(text, path.toString());
    }

    private final List<Path> searchPath;
}
