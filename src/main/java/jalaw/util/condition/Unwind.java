// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * The throwable that carries control from {@link Restart#unwindTo()} back to its restart point.
 * <p>
 * Public only so methods can declare it. It is neither an {@link Exception} nor an {@link Error}: it is not a failure,
 * and ordinary {@code catch (Exception e)} blocks must not intercept it.
 */
@SuppressWarnings("ExtendsThrowable")
public final class Unwind extends Throwable {
    Unwind(final @NotNull Restart target) {
        super("Unwinding to restart " + target.name(), null, false, false);
        this.target = target;
    }

    @NotNull Restart target() {
        return target;
    }

    private final transient @NotNull Restart target;
}
