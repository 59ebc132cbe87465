// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.run;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import mash.util.condition.ConditionContext;
import mash.util.condition.exception.IOExceptionCondition;

/**
 * The text of an input document and the name addresses inside it refer to.
 */
public record SourceDocument(String name, String text) {
    /**
     * Reads the given file as UTF-8, naming the document after the path as given.
     * <p>
     * Signals a fatal {@link IOExceptionCondition} if reading fails.
     */
    public static SourceDocument read(final Path path) {
        try {
            return new SourceDocument(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
    }
}
