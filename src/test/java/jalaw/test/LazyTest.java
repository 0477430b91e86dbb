// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import java.util.concurrent.atomic.AtomicInteger;
import jalaw.util.Lazy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import org.junit.jupiter.api.Test;

final class LazyTest {
    @Test
    void supplierRunsOnce() {
        final var calls = new AtomicInteger(0);
        final var lazy = Lazy.of(() -> "value" + calls.incrementAndGet());
        assertThat(calls).hasValue(0);
        assertThat(lazy.get()).isEqualTo("value1");
        assertThat(lazy.get()).isEqualTo("value1");
        assertThat(calls).hasValue(1);
    }

    @Test
    void failedSupplierIsRetried() {
        final var calls = new AtomicInteger(0);
        final var lazy = Lazy.of(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("first call fails");
            }
            return "second";
        });
        assertThatExceptionOfType(IllegalStateException.class).isThrownBy(lazy::get);
        assertThat(lazy.get()).isEqualTo("second");
    }

    @Test
    void nullResultIsRejected() {
        final Lazy<String> lazy = Lazy.of(() -> null);
        assertThatExceptionOfType(NullPointerException.class).isThrownBy(lazy::get);
    }
}
