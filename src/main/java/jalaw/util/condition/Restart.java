// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition;

import jalaw.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A named point that a handler can transfer control to.
 *
 * @see ConditionContext#withRestart(String, RestartCallback)
 * @see ConditionContext#restarts()
 */
public final class Restart {
    Restart(final @NotNull String name) {
        final var context = ConditionContext.localContext();
        next = context.firstRestart;
        this.name = name;
        owner = context;
        context.firstRestart = this;
    }

    /**
     * Retrieves the user-readable name of this restart.
     */
    public @NotNull String name() {
        return name;
    }

    /**
     * Unwinds the stack to this restart point. Never returns.
     */
    public void unwindTo() {
        throw SneakyThrow.doThrow(new Unwind(this));
    }

    void unlink() {
        assert owner == ConditionContext.localContext() : "Restart unlinked by a different thread";
        assert owner.firstRestart == this : "Restart chain corrupt";
        owner.firstRestart = next;
    }

    final @Nullable Restart next;
    private final @NotNull String name;
    private final @NotNull ConditionContext owner;
}
