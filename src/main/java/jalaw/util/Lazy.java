// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.util;

import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A value computed on first access and cached for the lifetime of its owner.
 * <p>
 * The supplier is invoked at most once; it is released after it produced a value. If the supplier throws, nothing is
 * cached and the next access tries again.
 * <p>
 * Safe to share between threads: concurrent first accesses are serialized, later accesses read a published value
 * without locking.
 */
public final class Lazy<T> implements Supplier<T> {
    private Lazy(final Supplier<? extends T> supplier) {
        this.supplier = supplier;
    }

    /**
     * Creates a lazy value produced by the given supplier. The supplier must not return {@code null}.
     */
    public static <T> Lazy<T> of(final Supplier<? extends T> supplier) {
        return new Lazy<>(supplier);
    }

    @Override
    public T get() {
        final var existing = value;
        return (existing != null) ? existing : compute();
    }

    private synchronized T compute() {
        final var existing = value;
        if (existing != null) {
            return existing;
        }
        final var currentSupplier = supplier;
        if (currentSupplier == null) {
            throw new UnreachableCodeReachedError("Lazy value has neither a value nor a supplier");
        }
        final T computed = currentSupplier.get();
        if (computed == null) {
            throw new NullPointerException("Lazy value supplier returned null");
        }
        value = computed;
        supplier = null;
        return computed;
    }

    private volatile @Nullable T value = null;
    private @Nullable Supplier<? extends T> supplier;
}
