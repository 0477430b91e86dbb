// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A condition handler, intended to be used within try-with-resources.
 * <p>
 * While open, the handler's procedure is offered every condition signaled by the same thread. Handlers are consulted
 * newest first.
 */
public final class Handler implements AutoCloseable {
    public Handler(final @NotNull HandlerProcedure procedure) {
        final var context = ConditionContext.localContext();
        next = context.firstHandler;
        this.procedure = procedure;
        owner = context;
        context.firstHandler = this;
    }

    /**
     * Does nothing. Silences warnings about try-with-resources variables that are never referenced.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == ConditionContext.localContext() : "Handler closed by a different thread";
        assert owner.firstHandler == this : "Handler chain corrupt";
        owner.firstHandler = next;
    }

    void handle(final @NotNull SignaledCondition condition) throws Unwind {
        procedure.handle(condition);
    }

    final @Nullable Handler next;
    private final @NotNull HandlerProcedure procedure;
    private final @NotNull ConditionContext owner;
}
