// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package jalaw.test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import jalaw.util.condition.UnhandledErrorError;
import jalaw.xml.XmlElement;
import jalaw.xml.XmlReader;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

final class Fixtures {
    private Fixtures() {
    }

    static XmlElement xml(final String source) {
        return XmlReader.parse(source);
    }

    static byte[] resource(final String name) {
        try (final var stream = Fixtures.class.getResourceAsStream("/xml/" + name)) {
            return Objects.requireNonNull(stream, name).readAllBytes();
        } catch (final IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Runs {@code action}, which must fail with an unhandled fatal condition, and returns the error.
     */
    static UnhandledErrorError catchUnhandled(final ThrowingCallable action) {
        final var error = catchThrowableOfType(action, UnhandledErrorError.class);
        assertThat(error).as("unhandled error").isNotNull();
        return error;
    }
}
