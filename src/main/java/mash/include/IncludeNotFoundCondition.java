// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.include;

import java.nio.file.Path;
import java.util.List;
import mash.document.Address;
import mash.util.condition.Condition;

/**
 * A condition signaling that no directory of the search path contains an included document.
 */
public final class IncludeNotFoundCondition extends Condition {
    /**
     * Initializes a new condition for the named document, included at the given address, after looking at the given
     * candidate locations.
     */
    public IncludeNotFoundCondition(final String name, final Address address, final List<Path> searched) {
        super("Included document " + name + " not found");
        this.name = name;
        this.address = address;
        this.searched = List.copyOf(searched);
    }

    public String name() {
        return name;
    }

    public Address address() {
        return address;
    }

    /**
     * Returns every location looked at, in search order.
     */
    public List<Path> searched() {
        return searched;
    }

    @Override
    public String detailedMessage() {
        final var builder = new StringBuilder();
        builder.append(address).append(": ").append(message()).append(", searched:");
        for (final var candidate : searched) {
            builder.append("\n  ").append(candidate);
        }
        return builder.toString();
    }

    private final String name;
    private final Address address;
    private final List<Path> searched;
}
