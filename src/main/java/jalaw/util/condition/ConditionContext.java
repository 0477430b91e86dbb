// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition;

import java.util.ArrayList;
import java.util.List;
import jalaw.util.SneakyThrow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The per-thread registry of active handlers and restarts.
 * <p>
 * Instances are never exposed; the static methods act on the calling thread's context.
 *
 * @see Handler
 * @see Restart
 */
public final class ConditionContext {
    private ConditionContext() {
    }

    /**
     * Offers the condition to the active handlers, newest first. Returns normally if all of them decline.
     * <p>
     * A handler may unwind to a restart, so this method may throw {@link Unwind}.
     */
    public static void signal(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, false));
    }

    /**
     * Signals the condition as fatal.
     * <p>
     * Like {@link #signal(Condition)}, but if every handler declines, {@link UnhandledErrorError} is thrown. The method
     * never returns normally; its return type lets call sites write {@code throw ConditionContext.error(...)}.
     */
    public static @NotNull UnhandledErrorError error(final @NotNull Condition condition) {
        localContext().signal(new SignaledCondition(condition, true));
        throw new UnhandledErrorError(condition);
    }

    /**
     * Runs {@code callback} with a restart named {@code restartName} active.
     *
     * @return The callback's result, or {@code null} if a handler unwound to this restart.
     */
    public static <T> @Nullable T withRestart(
        final @NotNull String restartName,
        final @NotNull RestartCallback<? extends T> callback
    ) {
        final var restart = new Restart(restartName);
        try {
            return callback.call(restart);
        } catch (final Unwind unwind) {
            if (unwind.target() != restart) {
                throw SneakyThrow.doThrow(unwind);
            }
            return null;
        } finally {
            restart.unlink();
        }
    }

    /**
     * Returns a snapshot of the active restarts, newest first.
     */
    public static @NotNull List<@NotNull Restart> restarts() {
        final var result = new ArrayList<@NotNull Restart>();
        for (var restart = localContext().firstRestart; restart != null; restart = restart.next) {
            result.add(restart);
        }
        return result;
    }

    static @NotNull ConditionContext localContext() {
        return localContext.get();
    }

    private void signal(final @NotNull SignaledCondition condition) {
        for (var handler = firstCandidate(); handler != null; handler = handler.next) {
            final var saved = currentHandler;
            currentHandler = handler;
            try {
                handler.handle(condition);
            } catch (final Unwind unwind) {
                throw SneakyThrow.doThrow(unwind);
            } finally {
                currentHandler = saved;
            }
        }
    }

    // A condition signaled from inside a handler only reaches handlers older than that one.
    private @Nullable Handler firstCandidate() {
        return (currentHandler == null) ? firstHandler : currentHandler.next;
    }

    @Nullable Handler firstHandler = null;
    @Nullable Restart firstRestart = null;
    private @Nullable Handler currentHandler = null;

    private static final ThreadLocal<@NotNull ConditionContext> localContext =
        ThreadLocal.withInitial(ConditionContext::new);
}
