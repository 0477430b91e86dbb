// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown by {@link ConditionContext#error(Condition)} when every handler declined the fatal condition.
 * <p>
 * Callers without a handler of their own see binding errors as this error; {@link #condition()} tells what went wrong.
 */
public final class UnhandledErrorError extends AssertionError {
    UnhandledErrorError(final @NotNull Condition condition) {
        super("Fatal condition signaled, but no condition handler unwound; condition: " + condition);
        this.condition = condition;
    }

    /**
     * Retrieves the condition that nobody handled.
     */
    public @NotNull Condition condition() {
        return condition;
    }

    private final transient @NotNull Condition condition;
}
