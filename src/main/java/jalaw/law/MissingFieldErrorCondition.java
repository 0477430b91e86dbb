// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.util.condition.Condition;

/**
 * A required attribute or child element is absent.
 */
public final class MissingFieldErrorCondition extends Condition {
    MissingFieldErrorCondition(final String field, final String message) {
        super(message);
        this.field = field;
    }

    /**
     * Retrieves the attribute or tag name that was expected.
     */
    public String field() {
        return field;
    }

    private final String field;
}
