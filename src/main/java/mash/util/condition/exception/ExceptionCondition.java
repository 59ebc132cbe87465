// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.util.condition.exception;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import mash.util.condition.Condition;
import org.jetbrains.annotations.NotNull;

/**
 * A condition wrapping a Java exception that mash cannot do anything about locally.
 */
abstract class ExceptionCondition<E extends Exception> extends Condition {
    ExceptionCondition(final @NotNull E exception) {
        super(String.valueOf(exception.getMessage()));
        this.exception = exception;
    }

    /**
     * Returns the wrapped exception.
     */
    public final @NotNull E exception() {
        return exception;
    }

    @Override
    public @NotNull String detailedMessage() {
        final var charset = StandardCharsets.UTF_8;
        final var stream = new ByteArrayOutputStream();
        final var printStream = new PrintStream(stream, false, charset);
        exception.printStackTrace(printStream);
        printStream.flush();
        return stream.toString(charset);
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + exception;
    }

    private final @NotNull E exception;
}
