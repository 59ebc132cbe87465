// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.locks.ReentrantLock;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import mash.util.SneakyThrow;

/**
 * Exclusive access to the standard streams, so that fragment output, verbose progress and diagnostics coming from
 * different worker threads never interleave mid-line.
 */
final class Streams implements AutoCloseable {
    @SuppressFBWarnings(value = "UL_UNRELEASED_LOCK", justification = "Released in close()")
    @SuppressWarnings("LockAcquiredButNotSafelyReleased")
    private Streams() {
        try {
            lock.lockInterruptibly();
        } catch (final InterruptedException e) {
            throw SneakyThrow.doThrow(e);
        }
    }

    static Streams acquire() {
        return new Streams();
    }

    /**
     * Prints one line to standard output.
     */
    static void printLine(final String line) {
        try (final var streams = acquire()) {
            streams.out().println(line);
        }
    }

    @Override
    public void close() {
        lock.unlock();
    }

    @SuppressWarnings({"MethodMayBeStatic", "UseOfSystemOutOrSystemErr"})
    PrintStream out() {
        return System.out;
    }

    @SuppressWarnings({"MethodMayBeStatic", "UseOfSystemOutOrSystemErr"})
    PrintStream err() {
        return System.err;
    }

    /**
     * Reads standard input to the end, decoding it as UTF-8, the encoding of documents.
     */
    @SuppressWarnings("MethodMayBeStatic")
    String readInput() throws IOException {
        return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static final ReentrantLock lock = new ReentrantLock();
}
