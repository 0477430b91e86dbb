// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when control flow arrives somewhere the program's own invariants say it never can.
 */
public final class UnreachableCodeReachedError extends AssertionError {
    public UnreachableCodeReachedError(final @NotNull String message) {
        super(message);
    }
}
