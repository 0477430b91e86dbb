// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.law;

import jalaw.util.condition.Condition;

/**
 * An element appeared where the schema doesn't allow it: either a child tag outside the content kinds of a
 * mixed-content context, or a node bound to an element of the wrong kind.
 */
public final class UnsupportedContentErrorCondition extends Condition {
    UnsupportedContentErrorCondition(final String message) {
        super(message);
    }
}
