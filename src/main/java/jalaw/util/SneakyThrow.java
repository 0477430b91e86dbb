// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util;

import org.jetbrains.annotations.NotNull;

/**
 * Throwing checked throwables without declaring them.
 * <p>
 * Reserved for {@link jalaw.util.condition.Unwind}, which every caller of a signaling method could otherwise be forced
 * to declare.
 */
public final class SneakyThrow {
    private SneakyThrow() {
    }

    /**
     * Throws {@code throwable} unchecked. Declared to return an error so call sites can write {@code throw doThrow(t)}.
     */
    public static @NotNull UnreachableCodeReachedError doThrow(final @NotNull Throwable throwable) {
        throw SneakyThrow.<RuntimeException>doThrowImpl(throwable);
    }

    // E is erased to Throwable, so the cast below never happens at run time.
    @SuppressWarnings("unchecked")
    private static <E extends Throwable> @NotNull UnreachableCodeReachedError doThrowImpl(
        final @NotNull Throwable throwable
    ) throws E {
        throw (E) throwable;
    }
}
