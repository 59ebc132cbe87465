// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import mash.util.function.ThrowingCallback;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The variables shared by every code fragment of a run.
 * <p>
 * Fragments run in document order within a frame, so later fragments see, and may overwrite, what earlier ones
 * defined. The scope is the only mutable state shared across subtrees; when independent subtrees run concurrently,
 * each fragment evaluation holds the scope's lock for its whole duration through {@link #exclusively}.
 */
public final class Scope {
    /**
     * Runs the given callback while holding this scope's lock.
     */
    public <E extends Throwable> void exclusively(final ThrowingCallback<E> callback) throws E {
        lock.lock();
        try {
            callback.call();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the value of the named variable, or {@code null} if it is not defined.
     */
    public @Nullable Object get(final String name) {
        lock.lock();
        try {
            return variables.get(name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns {@code true} iff the named variable is defined.
     */
    public boolean contains(final String name) {
        lock.lock();
        try {
            return variables.containsKey(name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Defines or overwrites the named variable.
     */
    public void put(final String name, final Object value) {
        lock.lock();
        try {
            variables.put(name, value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the named variable, if defined.
     */
    public void remove(final String name) {
        lock.lock();
        try {
            variables.remove(name);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a copy of all variables, in order of first definition.
     */
    public Map<String, Object> snapshot() {
        lock.lock();
        try {
            return new LinkedHashMap<>(variables);
        } finally {
            lock.unlock();
        }
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, Object> variables = new LinkedHashMap<>();
}
