// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The body of a {@link Handler}.
 */
@FunctionalInterface
public interface HandlerProcedure {
    /**
     * Reacts to a signaled condition.
     * <p>
     * Returning normally declines the condition and passes it on to older handlers. Calling {@link Restart#unwindTo()}
     * or throwing handles it.
     */
    void handle(@NotNull SignaledCondition condition) throws Unwind;
}
