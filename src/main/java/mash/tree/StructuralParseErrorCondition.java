// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.tree;

import mash.document.Address;
import mash.util.condition.Condition;

/**
 * A condition signaling that the markers of a document do not nest properly.
 */
public final class StructuralParseErrorCondition extends Condition {
    /**
     * Initializes a new parse error of the given kind at the given address.
     */
    public StructuralParseErrorCondition(final Kind kind, final Address address) {
        super(kind.message);
        this.kind = kind;
        this.address = address;
    }

    /**
     * Returns what went wrong.
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Returns the address of the offending marker, or of the opening marker of a frame that was never closed.
     */
    public Address address() {
        return address;
    }

    @Override
    public String detailedMessage() {
        return address + ": " + message();
    }

    private final Kind kind;
    private final Address address;

    /**
     * The ways marker structure can be broken.
     */
    public enum Kind {
        DUPLICATE_SEPARATOR("Frame has more than one separator"),
        UNMATCHED_CLOSE("Close marker without a matching open marker"),
        UNCLOSED_FRAME("Frame was never closed");

        Kind(final String message) {
            this.message = message;
        }

        private final String message;
    }
}
