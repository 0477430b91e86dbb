// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.util.condition.Condition;

/**
 * An attribute value is outside its type: an unrecognized enumerated value, a malformed or out of range number, or a
 * boolean that isn't {@code true}, {@code false}, {@code 1} or {@code 0}.
 */
public final class InvalidAttributeErrorCondition extends Condition {
    InvalidAttributeErrorCondition(final String attribute, final String value, final String message) {
        super(message);
        this.attribute = attribute;
        this.value = value;
    }

    /**
     * Retrieves the name of the offending attribute.
     */
    public String attribute() {
        return attribute;
    }

    /**
     * Retrieves the raw value that was rejected.
     */
    public String value() {
        return value;
    }

    private final String attribute;
    private final String value;
}
