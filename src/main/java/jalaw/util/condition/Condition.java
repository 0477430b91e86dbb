// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The base type for all conditions.
 * <p>
 * A condition describes something that happened; unlike an exception it is delivered to handlers <em>before</em> the
 * stack is unwound, so a handler can still see the restarts and traces established below it.
 */
public abstract class Condition {
    protected Condition(final @NotNull String message) {
        this.message = message;
    }

    /**
     * Retrieves the short, user-readable message of this condition.
     */
    public final @NotNull String message() {
        return message;
    }

    /**
     * Retrieves a longer user-readable description. Defaults to {@link #message()}.
     */
    public @NotNull String detailedMessage() {
        return message;
    }

    @Override
    public @NotNull String toString() {
        return getClass().getName() + ": " + message;
    }

    private final @NotNull String message;
}
