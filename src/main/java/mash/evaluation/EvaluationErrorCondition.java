// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mash.evaluation;

import mash.document.Address;
import mash.util.condition.Condition;

/**
 * A condition signaling that an evaluator rejected a code fragment.
 * <p>
 * The address points at the failing line in the original document, not in the de-indented fragment.
 */
public final class EvaluationErrorCondition extends Condition {
    /**
     * Initializes a new evaluation error with the evaluator's message, located at the given document address.
     */
    public EvaluationErrorCondition(final String nativeMessage, final Address address) {
        super(nativeMessage);
        this.address = address;
    }

    /**
     * Returns the document address of the failure.
     */
    public Address address() {
        return address;
    }

    @Override
    public String detailedMessage() {
        return address + ": " + message();
    }

    private final Address address;
}
